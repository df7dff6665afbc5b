package org.parley.relserver.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import org.parley.relserver.domain.AggregationGroup;

/**
 * One annotation group as served to clients.
 *
 * @param type the annotation event type
 * @param key the aggregation key
 * @param count the number of live annotations
 */
@Schema(description = "Count of annotations sharing an event type and key",
    example = "{\"type\":\"m.reaction\",\"key\":\"👍\",\"count\":3}")
public record AggregationGroupInfo(
    @Schema(description = "Annotation event type", requiredMode = Schema.RequiredMode.REQUIRED)
    String type,
    @Schema(description = "Aggregation key", requiredMode = Schema.RequiredMode.REQUIRED)
    String key,
    @Schema(description = "Number of annotations", requiredMode = Schema.RequiredMode.REQUIRED)
    long count) {

  public static AggregationGroupInfo of(AggregationGroup group) {
    return new AggregationGroupInfo(group.eventType(), group.key(), group.count());
  }
}
