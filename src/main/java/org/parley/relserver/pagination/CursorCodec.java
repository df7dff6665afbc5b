package org.parley.relserver.pagination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Base64;
import org.parley.relserver.exception.InvalidCursorException;
import org.springframework.stereotype.Component;

/**
 * Encodes pagination cursors into opaque URL-safe tokens and back.
 *
 * <p>A token is the JSON form of the cursor (tagged with its query shape and
 * format version), Base64url-encoded without padding. Decoding validates the
 * encoding, the JSON, the version and, when requested, the expected shape.
 */
@Component
public class CursorCodec {

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private final ObjectMapper objectMapper;

  /**
   * Constructs a CursorCodec.
   *
   * @param objectMapper the JSON mapper
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a Spring-managed bean"
  )
  public CursorCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Encodes a cursor as an opaque token.
   *
   * @param cursor the cursor
   * @return the URL-safe token
   */
  public String encode(PaginationCursor cursor) {
    try {
      return ENCODER.encodeToString(
          objectMapper.writerFor(PaginationCursor.class).writeValueAsBytes(cursor));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode pagination cursor", e);
    }
  }

  /**
   * Decodes a token of any shape.
   *
   * @param token the token
   * @return the cursor
   * @throws InvalidCursorException if the token is malformed or of an unsupported version
   */
  public PaginationCursor decode(String token) {
    if (token == null || token.isBlank()) {
      throw new InvalidCursorException("Pagination token is empty");
    }

    byte[] json;
    try {
      json = DECODER.decode(token.trim());
    } catch (IllegalArgumentException e) {
      throw new InvalidCursorException("Pagination token is not valid base64url", e);
    }

    PaginationCursor cursor;
    try {
      cursor = objectMapper.readValue(json, PaginationCursor.class);
    } catch (IOException e) {
      throw new InvalidCursorException("Pagination token is malformed", e);
    }

    if (cursor == null) {
      throw new InvalidCursorException("Pagination token is malformed");
    }
    if (cursor.version() != PaginationCursor.CURRENT_VERSION) {
      throw new InvalidCursorException(
          "Unsupported pagination token version: " + cursor.version());
    }
    return cursor;
  }

  /**
   * Decodes a token that must have been issued for the given query shape.
   *
   * @param token the token
   * @param expected the expected cursor variant
   * @param <T> the cursor type
   * @return the cursor
   * @throws InvalidCursorException if the token is invalid or was issued for another query shape
   */
  public <T extends PaginationCursor> T decode(String token, Class<T> expected) {
    PaginationCursor cursor = decode(token);
    if (!expected.isInstance(cursor)) {
      throw new InvalidCursorException(
          "Pagination token was issued for a different kind of query");
    }
    return expected.cast(cursor);
  }
}
