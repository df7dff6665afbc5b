package org.parley.relserver.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RFC 7807 problem body returned for every error.
 *
 * <p>{@code code} is the stable machine-readable error code clients switch on.
 * Additional members (such as a recovery {@code hint}) are serialized at the top level.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "title", "status", "code"})
public final class ProblemDetail {

  private static final String TYPE = "about:blank";

  private final String title;
  private final int status;
  private final String code;
  private final Map<String, Object> extras = new LinkedHashMap<>();

  /**
   * Creates a problem.
   *
   * @param title human-readable summary
   * @param status HTTP status code
   * @param code stable error code
   */
  @JsonCreator
  public ProblemDetail(
      @JsonProperty("title") String title,
      @JsonProperty("status") int status,
      @JsonProperty("code") String code) {
    this.title = title;
    this.status = status;
    this.code = code;
  }

  @JsonProperty("type")
  public String getType() {
    return TYPE;
  }

  public String getTitle() {
    return title;
  }

  public int getStatus() {
    return status;
  }

  public String getCode() {
    return code;
  }

  /**
   * Adds a top-level member to the problem body.
   *
   * @param name member name
   * @param value member value
   */
  @JsonAnySetter
  public void putExtra(String name, Object value) {
    if (!"type".equals(name)) {
      extras.put(name, value);
    }
  }

  @JsonAnyGetter
  public Map<String, Object> getExtras() {
    return Collections.unmodifiableMap(extras);
  }
}
