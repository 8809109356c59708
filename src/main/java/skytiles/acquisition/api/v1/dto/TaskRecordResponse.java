package skytiles.acquisition.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skytiles.acquisition.model.TaskRecord;

import java.time.Instant;

/**
 * Response DTO for one timestamp's record.
 * GET /api/v1/timestamps/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskRecordResponse(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("epochSecond") long epochSecond,
        @JsonProperty("status") String status,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("givenUp") boolean givenUp,
        @JsonProperty("lastError") String lastError,
        @JsonProperty("lastAttemptAt") Instant lastAttemptAt,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("artifactPath") String artifactPath) {
    /** Create response from domain model */
    public static TaskRecordResponse from(TaskRecord record, int maxAttempts) {
        return new TaskRecordResponse(
                record.timestamp().id(),
                record.timestamp().epochSecond(),
                record.status().name(),
                record.attempts(),
                record.isExhausted(maxAttempts),
                record.lastError(),
                record.lastAttemptAt(),
                record.createdAt(),
                record.finishedAt(),
                record.artifactPath());
    }
}
