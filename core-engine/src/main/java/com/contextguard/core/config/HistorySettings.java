package com.contextguard.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Recent-scan history settings. Without a {@code path} the history is kept
 * in memory only.
 *
 * @since 1.0.0
 */
public class HistorySettings {

    private String path;
    private int maxEntries = 50;
    private int maxAgeDays = 7;

    void validate(List<String> errors) {
        if (maxEntries <= 0) {
            errors.add("history.maxEntries must be > 0, got: " + maxEntries);
        }
        if (maxAgeDays <= 0) {
            errors.add("history.maxAgeDays must be > 0, got: " + maxAgeDays);
        }
    }

    public Optional<Path> snapshotPath() {
        return path == null || path.isBlank() ? Optional.empty() : Optional.of(Path.of(path));
    }

    public Duration maxAge() {
        return Duration.ofDays(maxAgeDays);
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public int getMaxAgeDays() {
        return maxAgeDays;
    }

    public void setMaxAgeDays(int maxAgeDays) {
        this.maxAgeDays = maxAgeDays;
    }

    @Override
    public String toString() {
        return "HistorySettings{path='" + path + "', maxEntries=" + maxEntries
                + ", maxAgeDays=" + maxAgeDays + '}';
    }
}
