package io.signalbot.utils.lock.single_lock;

import io.signalbot.configs.locks.PositionLockRegistry;
import lombok.RequiredArgsConstructor;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.IntStream;

@Aspect
@Component
@RequiredArgsConstructor
public class LockAspect {

    private final PositionLockRegistry positionLockRegistry;

    @Around("@annotation(withLock)")
    public Object aroundWithLock(ProceedingJoinPoint pjp, WithLock withLock) throws Throwable {
        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String[] paramNames = sig.getParameterNames();
        Object[] args = pjp.getArgs();

        int idx = IntStream.range(0, paramNames.length)
                .filter(i -> paramNames[i].equals(withLock.keyParam()))
                .findFirst()
                .orElseThrow(() ->
                        new IllegalStateException("Lock key parameter not found: " + withLock.keyParam())
                );

        Object key = args[idx];
        if (key == null) {
            throw new IllegalArgumentException("Lock key '" + withLock.keyParam() + "' must not be null");
        }

        ReentrantLock lock = switch (withLock.registry()) {
            case POSITION -> positionLockRegistry.getLock(key.toString());
        };

        lock.lock();
        try {
            return pjp.proceed();
        } finally {
            lock.unlock();
        }
    }
}
