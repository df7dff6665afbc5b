package org.parley.relserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/**
 * A page of aggregation groups.
 *
 * @param chunk groups ordered by count descending
 * @param nextBatch token for the next page, absent when exhausted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Page of annotation groups",
    example = "{\"chunk\":[{\"type\":\"m.reaction\",\"key\":\"a\",\"count\":2}],"
        + "\"next_batch\":\"eyJzIjoiQSJ9\"}")
public record AggregationChunkResponse(
    @Schema(description = "Groups, highest count first",
        requiredMode = Schema.RequiredMode.REQUIRED)
    List<AggregationGroupInfo> chunk,
    @Schema(description = "Token for the next page; absent when there are no more groups")
    @JsonProperty("next_batch") String nextBatch) {

  /**
   * Copies the chunk into an unmodifiable list.
   */
  public AggregationChunkResponse {
    chunk = chunk != null ? List.copyOf(chunk) : List.of();
  }
}
