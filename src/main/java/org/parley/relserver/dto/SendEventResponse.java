package org.parley.relserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Response DTO for endpoints that create an event.
 *
 * @param eventId the id of the new event
 */
@Schema(description = "Id of the event that was created",
    example = "{\"event_id\":\"$0192f3c4-8d2e-7a10-9b3c-2f1e4d5a6b7c:example.org\"}")
public record SendEventResponse(
    @Schema(description = "Event id", requiredMode = Schema.RequiredMode.REQUIRED)
    @JsonProperty("event_id") String eventId) {
}
