package com.newsinsight.refresh.collector;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Outcome of one source health probe.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResult {

    String sourceName;

    Long sourceId;

    boolean success;

    String message;

    String errorDetails;

    LocalDateTime checkedAt;

    /**
     * Filled in by the status-check round, not by collectors.
     */
    Integer consecutiveErrorCount;

    public static StatusResult ok(SourceSnapshot source, String message) {
        return StatusResult.builder()
                .sourceName(source.name())
                .sourceId(source.id())
                .success(true)
                .message(message)
                .checkedAt(LocalDateTime.now())
                .build();
    }

    public static StatusResult failure(SourceSnapshot source, String message, String errorDetails) {
        return StatusResult.builder()
                .sourceName(source.name())
                .sourceId(source.id())
                .success(false)
                .message(message)
                .errorDetails(errorDetails)
                .checkedAt(LocalDateTime.now())
                .build();
    }

    /**
     * Text stored as the source's last error. Null for successful probes.
     */
    public String errorText() {
        if (success) {
            return null;
        }
        if (errorDetails == null || errorDetails.isBlank()) {
            return message;
        }
        return message == null ? errorDetails : message + ": " + errorDetails;
    }

    /**
     * A probe whose result could not be recorded is reported as failed.
     */
    public StatusResult withPersistenceFailure(String cause) {
        String note = "health update not persisted (" + cause + ")";
        return toBuilder()
                .success(false)
                .message(message == null ? note : message + "; " + note)
                .build();
    }
}
