package org.parley.relserver.pagination;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Position of a paginating client inside one query's result stream.
 * Each query shape has its own variant so a token issued for one shape
 * is never accepted by another. Tokens carry a format version.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "s")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RelationPageCursor.class, name = "R"),
    @JsonSubTypes.Type(value = GroupPageCursor.class, name = "G"),
    @JsonSubTypes.Type(value = AggregationPageCursor.class, name = "A"),
    @JsonSubTypes.Type(value = MessagesPageCursor.class, name = "M")
})
public sealed interface PaginationCursor
    permits RelationPageCursor, GroupPageCursor, AggregationPageCursor, MessagesPageCursor {

  /** Current token format version. */
  int CURRENT_VERSION = 1;

  /**
   * Returns the token format version this cursor was encoded with.
   *
   * @return the version
   */
  int version();
}
