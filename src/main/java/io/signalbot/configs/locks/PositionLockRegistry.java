package io.signalbot.configs.locks;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per traded symbol. Webhook transitions and risk cycles for the same symbol never interleave.
 */
@Component
public class PositionLockRegistry implements LockRegistry {
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public ReentrantLock getLock(String symbol) {
        return locks.computeIfAbsent(symbol.toUpperCase(), k -> new ReentrantLock(true));
    }
}
