package com.chronicle.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.util.Jsons;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Remembers the last primary health probe for a short window. The result is also written to a
 * small marker file so consecutive hook processes skip a probe that just failed.
 */
public class HealthCache {

    private static final Logger logger = LoggerFactory.getLogger(HealthCache.class);

    public static final String MARKER_FILE = "primary-health.json";

    private final Path markerFile;
    private final long windowMs;
    private final Clock clock;
    private Marker current;

    public HealthCache(Path markerFile, long windowMs, Clock clock) {
        this.markerFile = markerFile;
        this.windowMs = windowMs;
        this.clock = clock;
    }

    /**
     * In-memory only, for embedded use and tests.
     */
    public static HealthCache inMemory(long windowMs, Clock clock) {
        return new HealthCache(null, windowMs, clock);
    }

    /**
     * Health state recorded within the window, or empty when a fresh probe is due.
     */
    public Optional<Boolean> lookup() {
        if (current == null) {
            current = readMarker();
        }
        if (current == null) {
            return Optional.empty();
        }
        long age = clock.millis() - current.checkedAt;
        if (age < 0 || age >= windowMs) {
            return Optional.empty();
        }
        return Optional.of(current.healthy);
    }

    public void record(boolean healthy) {
        current = new Marker(healthy, clock.millis());
        writeMarker(current);
    }

    private Marker readMarker() {
        if (markerFile == null || !Files.isRegularFile(markerFile)) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(markerFile.toFile(), Marker.class);
        } catch (IOException e) {
            logger.debug("Ignoring unreadable health marker {}: {}", markerFile, e.getMessage());
            return null;
        }
    }

    private void writeMarker(Marker marker) {
        if (markerFile == null) {
            return;
        }
        try {
            if (markerFile.getParent() != null) {
                Files.createDirectories(markerFile.getParent());
            }
            Path temp = markerFile.resolveSibling(markerFile.getFileName() + ".tmp");
            Jsons.mapper().writeValue(temp.toFile(), marker);
            Files.move(temp, markerFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.debug("Could not write health marker {}: {}", markerFile, e.getMessage());
        }
    }

    static final class Marker {
        final boolean healthy;
        final long checkedAt;

        @JsonCreator
        Marker(@JsonProperty("healthy") boolean healthy, @JsonProperty("checkedAt") long checkedAt) {
            this.healthy = healthy;
            this.checkedAt = checkedAt;
        }

        @JsonProperty("healthy")
        boolean isHealthy() { return healthy; }

        @JsonProperty("checkedAt")
        long getCheckedAt() { return checkedAt; }

        @JsonProperty("checkedAtIso")
        String getCheckedAtIso() { return Instant.ofEpochMilli(checkedAt).toString(); }
    }
}
