package skytiles.acquisition.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /api/v1/timestamps/{id}/trigger
 */
public record TriggerResponse(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("force") boolean force,
        @JsonProperty("status") String status) {

    public static TriggerResponse accepted(String timestamp, boolean force) {
        return new TriggerResponse(timestamp, force, "accepted");
    }
}
