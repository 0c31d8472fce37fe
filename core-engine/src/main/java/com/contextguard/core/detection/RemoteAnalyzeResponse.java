package com.contextguard.core.detection;

import com.contextguard.core.model.DetectionReport;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope returned by {@code POST /api/v1/analyze}:
 * {@code {success, result?, error?}}.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RemoteAnalyzeResponse {

    private final boolean success;
    private final DetectionReport result;
    private final String error;

    @JsonCreator
    public RemoteAnalyzeResponse(@JsonProperty("success") boolean success,
            @JsonProperty("result") DetectionReport result,
            @JsonProperty("error") String error) {
        this.success = success;
        this.result = result;
        this.error = error;
    }

    public static RemoteAnalyzeResponse ok(DetectionReport result) {
        return new RemoteAnalyzeResponse(true, result, null);
    }

    public static RemoteAnalyzeResponse failure(String error) {
        return new RemoteAnalyzeResponse(false, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public DetectionReport getResult() {
        return result;
    }

    public String getError() {
        return error;
    }
}
