package com.contextguard.core.cache;

import com.contextguard.core.model.AnalysisRequest;
import com.contextguard.core.model.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Derives the request fingerprint used as cache key and coalescing key.
 *
 * <p>
 * The key is {@code analysis_<sha256-hex>_<language>} where the digest
 * covers the content, the language and the options serialized as JSON with
 * map keys sorted, so option order never changes the key.
 * </p>
 *
 * @since 1.0.0
 */
public final class CacheKeyGenerator {

    private static final String PREFIX = "analysis_";

    private static final ObjectMapper CANONICAL_MAPPER = JsonMappers.create()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CacheKeyGenerator() {
        // utility class
    }

    public static String generate(AnalysisRequest request) {
        Objects.requireNonNull(request, "AnalysisRequest must not be null");
        return generate(request.getContent(), request.getLanguage(), request.getOptions());
    }

    /**
     * @param content  analysed text
     * @param language language tag
     * @param options  mode options, may be {@code null} or empty
     * @return deterministic cache key
     * @throws IllegalArgumentException if an option name is {@code null}
     */
    public static String generate(String content, String language, Map<String, ?> options) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(language, "language must not be null");

        String canonical = content + '\u0000' + language + '\u0000' + canonicalOptions(options);
        return PREFIX + sha256Hex(canonical) + '_' + language;
    }

    private static String canonicalOptions(Map<String, ?> options) {
        if (options == null || options.isEmpty()) {
            return "";
        }
        for (String name : options.keySet()) {
            if (name == null) {
                throw new IllegalArgumentException("Option names must not be null");
            }
        }
        Map<String, ?> sorted = new TreeMap<>(options);
        try {
            return CANONICAL_MAPPER.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            // values Jackson cannot serialize still produce a stable key
            return sorted.toString();
        }
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available in this JVM", e);
        }
    }
}
