package com.contextguard.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A request to analyse one snippet of source text.
 *
 * <p>
 * Built per call and never persisted. {@code content} and {@code language}
 * are required; {@code name} and {@code options} are optional. Options take
 * part in the cache fingerprint.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisRequest {

    private final String content;
    private final String language;
    private final String name;
    private final Map<String, Object> options;

    private AnalysisRequest(Builder builder) {
        this.content = Objects.requireNonNull(builder.content, "content must not be null");
        this.language = Objects.requireNonNull(builder.language, "language must not be null");
        this.name = builder.name;
        this.options = builder.options.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
    }

    /**
     * Shorthand for a request without options.
     *
     * @param content  text to analyse
     * @param language language tag, e.g. {@code javascript}
     * @param name     optional source name, may be {@code null}
     * @return the request
     */
    public static AnalysisRequest of(String content, String language, String name) {
        return builder().content(content).language(language).name(name).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getContent() {
        return content;
    }

    public String getLanguage() {
        return language;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    /**
     * @return unmodifiable view of the mode options
     */
    public Map<String, Object> getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "AnalysisRequest{" +
                "language='" + language + '\'' +
                ", name='" + name + '\'' +
                ", length=" + content.length() +
                ", options=" + options +
                '}';
    }

    /**
     * Fluent builder for {@link AnalysisRequest}.
     */
    public static class Builder {
        private String content;
        private String language;
        private String name;
        private final Map<String, Object> options = new LinkedHashMap<>();

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder option(String key, Object value) {
            options.put(Objects.requireNonNull(key, "option key must not be null"), value);
            return this;
        }

        public Builder options(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::option);
            }
            return this;
        }

        /**
         * @return a new request
         * @throws NullPointerException if {@code content} or {@code language}
         *                              is {@code null}
         */
        public AnalysisRequest build() {
            return new AnalysisRequest(this);
        }
    }
}
