package com.contextguard.core.detection;

import com.contextguard.core.model.AnalysisRequest;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/analyze} on the remote detection service.
 *
 * @since 1.0.0
 */
public final class RemoteAnalyzeRequest {

    private final String content;
    private final String language;
    private final String name;

    @JsonCreator
    public RemoteAnalyzeRequest(@JsonProperty("content") String content,
            @JsonProperty("language") String language,
            @JsonProperty("name") String name) {
        this.content = content;
        this.language = language;
        this.name = name;
    }

    public static RemoteAnalyzeRequest from(AnalysisRequest request) {
        return new RemoteAnalyzeRequest(request.getContent(), request.getLanguage(),
                request.getName().orElse(null));
    }

    /**
     * Convert back to an in-process request.
     *
     * @return the request
     * @throws NullPointerException if {@code content} or {@code language} is
     *                              missing
     */
    public AnalysisRequest toRequest() {
        return AnalysisRequest.of(content, language, name);
    }

    public String getContent() {
        return content;
    }

    public String getLanguage() {
        return language;
    }

    public String getName() {
        return name;
    }
}
