package org.parley.relserver.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

/**
 * Optional request body of a redaction.
 *
 * @param reason free-text reason, copied into the redaction event content
 */
@Schema(description = "Redaction request", example = "{\"reason\":\"spam\"}")
public record RedactRequest(
    @Size(max = 1024, message = "reason must be at most 1024 characters")
    String reason) {
}
