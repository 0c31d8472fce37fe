package com.contextguard.core.detection;

import com.contextguard.core.config.GuardConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link CodeDetector} instances by tier name from a
 * {@link GuardConfig}.
 *
 * <p>
 * This is the single point of extension when adding new detector tiers:
 * register the new type string here and create the corresponding detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create a detector of the given type.
     *
     * @param type   one of {@code semantic}, {@code remote}, {@code heuristic}
     * @param config configuration supplying rules and remote settings
     * @return a new detector
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException if the type is unknown
     */
    public static CodeDetector create(String type, GuardConfig config) {
        Objects.requireNonNull(type, "Detector type must not be null");
        Objects.requireNonNull(config, "GuardConfig must not be null");

        return switch (type.toLowerCase(Locale.ROOT)) {
            case "semantic" -> new SemanticDetector(config.getRules());
            case "remote" -> new RemoteDetector(config.getRemote());
            case "heuristic" -> new HeuristicDetector();
            default -> throw new IllegalArgumentException(
                    "Unknown detector type: '" + type
                            + "'. Supported types: semantic, remote, heuristic");
        };
    }

    /**
     * Create one detector per type, in the given order.
     *
     * @param types  detector type names
     * @param config configuration
     * @return unmodifiable list of detectors
     */
    public static List<CodeDetector> createAll(List<String> types, GuardConfig config) {
        Objects.requireNonNull(types, "Detector types must not be null");
        LOG.info("Creating {} detector(s): {}", types.size(), types);
        List<CodeDetector> detectors = types.stream()
                .map(t -> create(t, config))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
