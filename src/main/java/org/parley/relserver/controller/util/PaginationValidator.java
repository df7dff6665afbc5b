package org.parley.relserver.controller.util;

import org.parley.relserver.config.RelationsProperties;

/**
 * Utility class for validating pagination parameters.
 */
public final class PaginationValidator {

  /**
   * Private constructor to prevent instantiation.
   */
  private PaginationValidator() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Validates the limit parameter and applies the configured default.
   *
   * @param limit the requested limit, or null
   * @param properties relation configuration (default and maximum limit)
   * @return the effective limit
   * @throws IllegalArgumentException if the limit is out of range
   */
  public static int resolveLimit(Integer limit, RelationsProperties properties) {
    if (limit == null) {
      return properties.getDefaultLimit();
    }
    if (limit < 1 || limit > properties.getMaxLimit()) {
      throw new IllegalArgumentException(
          "Limit must be between 1 and " + properties.getMaxLimit());
    }
    return limit;
  }

  /**
   * Normalizes an optional pagination token: a blank token means "first page".
   *
   * @param from the token from the request, or null
   * @return the token, or null for the first page
   */
  public static String normalizeToken(String from) {
    return from == null || from.isBlank() ? null : from;
  }
}
