package com.contextguard.core.orchestration;

import com.contextguard.core.model.AnalysisResult;
import com.contextguard.core.model.JsonMappers;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link ScanHistoryStore} backed by a JSON array file.
 *
 * <p>
 * Every save drops results older than {@code maxAge}, keeps the newest
 * {@code maxEntries}, writes a temporary file next to the target and moves
 * it into place, so readers never observe a partial snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileScanHistoryStore implements ScanHistoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileScanHistoryStore.class);

    private static final TypeReference<List<AnalysisResult>> SCAN_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final int maxEntries;
    private final Duration maxAge;
    private final Clock clock;
    private final ObjectMapper mapper;

    public JsonFileScanHistoryStore(Path file, int maxEntries, Duration maxAge, Clock clock) {
        this.file = Objects.requireNonNull(file, "History file must not be null");
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.mapper = JsonMappers.create().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public List<AnalysisResult> load() throws IOException {
        if (!Files.exists(file)) {
            LOG.debug("No scan history at {}", file);
            return List.of();
        }
        List<AnalysisResult> scans = mapper.readValue(file.toFile(), SCAN_LIST);
        if (scans == null) {
            return List.of();
        }
        List<AnalysisResult> loaded = scans.stream().filter(Objects::nonNull).toList();
        if (loaded.size() < scans.size()) {
            LOG.warn("Skipped {} null entries in {}", scans.size() - loaded.size(), file);
        }
        LOG.info("Loaded {} scan(s) from {}", loaded.size(), file);
        return loaded;
    }

    @Override
    public void save(List<AnalysisResult> scans) throws IOException {
        List<AnalysisResult> retained = prune(scans);

        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(temp.toFile(), retained);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        LOG.debug("Saved {} scan(s) to {}", retained.size(), file);
    }

    /**
     * @param scans results, oldest first
     * @return the results within the age bound, newest {@code maxEntries}
     */
    List<AnalysisResult> prune(List<AnalysisResult> scans) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<AnalysisResult> fresh = scans.stream()
                .filter(s -> !s.getTimestamp().isBefore(cutoff))
                .toList();
        return fresh.subList(Math.max(0, fresh.size() - maxEntries), fresh.size());
    }

    public Path getFile() {
        return file;
    }
}
