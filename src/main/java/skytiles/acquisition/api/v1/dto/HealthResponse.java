package skytiles.acquisition.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("scheduler") String scheduler,
        @JsonProperty("retryQueue") Integer retryQueue,
        @JsonProperty("givenUp") Integer givenUp,
        @JsonProperty("runningTasks") Integer runningTasks,
        @JsonProperty("failedTasks") Integer failedTasks,
        @JsonProperty("counters") Map<String, Long> counters) {
    public static HealthResponse healthy(String uptime, String version, String scheduler, int retryQueue,
            int givenUp, int runningTasks, int failedTasks, Map<String, Long> counters) {
        return new HealthResponse("healthy", "ok", uptime, version, scheduler, retryQueue, givenUp,
                runningTasks, failedTasks, counters);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null, null, null);
    }
}
