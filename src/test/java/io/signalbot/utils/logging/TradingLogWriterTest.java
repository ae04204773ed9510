package io.signalbot.utils.logging;

import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.helpers.MutableClock;
import io.signalbot.trading.position.enums.PositionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TradingLogWriter Tests")
class TradingLogWriterTest {

    @TempDir
    Path tempDir;

    private TradingLogWriter writer;

    @BeforeEach
    void setUp() {
        TradingProperties properties = new TradingProperties();
        properties.setJournalDir(tempDir.resolve("trading").toString());
        MutableClock clock = new MutableClock(Instant.parse("2025-01-10T12:30:15.250Z"));
        writer = new TradingLogWriter(properties, clock);
    }

    @Test
    @DisplayName("Should create the journal directory")
    void testCreatesDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve("trading")));
    }

    @Test
    @DisplayName("Should append transitions to a per-symbol daily file")
    void testWriteTransition() throws IOException {
        // When
        writer.writeTransition("WLFIUSDT", PositionState.FLAT, PositionState.OPEN, "open LONG qty=3840");
        writer.writeTransition("WLFIUSDT", PositionState.OPEN, PositionState.LOCKED, "trailing lock");

        // Then
        List<String> lines = Files.readAllLines(tempDir.resolve("trading").resolve("wlfiusdt_2025-01-10.log"));
        assertEquals(2, lines.size());
        assertEquals("[12:30:15.250] FLAT -> OPEN | open LONG qty=3840", lines.get(0));
        assertTrue(lines.get(1).endsWith("OPEN -> LOCKED | trailing lock"));
    }
}
