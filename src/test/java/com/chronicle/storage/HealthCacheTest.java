package com.chronicle.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HealthCacheTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    @Test
    void testEmptyUntilRecorded() {
        HealthCache cache = HealthCache.inMemory(5000, clock);

        assertTrue(cache.lookup().isEmpty());
        cache.record(false);
        assertEquals(Boolean.FALSE, cache.lookup().orElseThrow());
    }

    @Test
    void testEntryExpires() {
        HealthCache cache = HealthCache.inMemory(5000, clock);
        cache.record(true);

        clock.advance(Duration.ofMillis(4999));
        assertEquals(Boolean.TRUE, cache.lookup().orElseThrow());
        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.lookup().isEmpty());
    }

    @Test
    void testMarkerIsSharedAcrossInstances() {
        Path marker = tempDir.resolve(HealthCache.MARKER_FILE);
        new HealthCache(marker, 5000, clock).record(false);

        assertTrue(Files.exists(marker));
        HealthCache nextProcess = new HealthCache(marker, 5000, clock);
        assertEquals(Boolean.FALSE, nextProcess.lookup().orElseThrow());
    }

    @Test
    void testUnreadableMarkerIsIgnored() throws IOException {
        Path marker = tempDir.resolve(HealthCache.MARKER_FILE);
        Files.writeString(marker, "not json");

        assertTrue(new HealthCache(marker, 5000, clock).lookup().isEmpty());
    }
}
