package io.signalbot.utils.logging;

import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.trading.position.enums.PositionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only journal of position transitions, one file per symbol and day.
 * Written for audit only; nothing reads it back on start-up.
 */
@Slf4j
@Component
public class TradingLogWriter {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final String logsDir;
    private final Clock clock;
    private final ConcurrentHashMap<String, ReentrantLock> fileLocks = new ConcurrentHashMap<>();

    public TradingLogWriter(TradingProperties properties, Clock clock) {
        this.logsDir = properties.getJournalDir();
        this.clock = clock;
        createLogsDirectory();
    }

    private void createLogsDirectory() {
        File dir = new File(logsDir);
        if (!dir.exists()) {
            if (dir.mkdirs()) {
                log.info("Created trading journal directory: {}", logsDir);
            } else {
                log.error("Failed to create trading journal directory: {}", logsDir);
            }
        }
    }

    public void writeTransition(String symbol, PositionState from, PositionState to, String detail) {
        writeTradeLog(symbol, String.format("%s -> %s | %s", from, to, detail));
    }

    public void writeTradeLog(String symbol, String message) {
        LocalDateTime now = LocalDateTime.now(clock);
        String fileName = getLogFileName(symbol, now);
        ReentrantLock lock = fileLocks.computeIfAbsent(fileName, k -> new ReentrantLock());

        lock.lock();
        try (PrintWriter writer = new PrintWriter(new FileWriter(fileName, true))) {
            writer.println(String.format("[%s] %s", now.format(TIME_FORMATTER), message));
            writer.flush();
        } catch (IOException e) {
            log.error("Failed to write trade journal for {}: {}", symbol, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    String getLogFileName(String symbol, LocalDateTime now) {
        return String.format("%s/%s_%s.log", logsDir, symbol.toLowerCase(Locale.ROOT), now.format(DATE_FORMATTER));
    }
}
