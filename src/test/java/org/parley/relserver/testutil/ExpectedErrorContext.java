package org.parley.relserver.testutil;

import org.slf4j.MDC;

/**
 * Marks log output a test provokes on purpose, so it does not clutter the build log.
 *
 * <pre>{@code
 * try (var ignored = ExpectedErrorContext.suppress("Failed to project event")) {
 *   projector.handleEvent(poisonRecord);
 * }
 * }</pre>
 *
 * <p>Suppression is per thread and ends when the returned handle is closed.
 */
public final class ExpectedErrorContext {

  private ExpectedErrorContext() {
    // Utility class - prevent instantiation
  }

  /**
   * Suppresses ERROR and WARN events whose message contains any of the patterns.
   *
   * @param messagePatterns case-sensitive substrings
   * @return a handle that ends the suppression when closed
   */
  public static AutoCloseable suppress(String... messagePatterns) {
    if (messagePatterns == null || messagePatterns.length == 0) {
      throw new IllegalArgumentException("At least one message pattern must be specified");
    }
    MDC.put(ExpectedErrorSuppressionFilter.MDC_SUPPRESS_PATTERNS,
        String.join(ExpectedErrorSuppressionFilter.SEPARATOR, messagePatterns));
    return () -> MDC.remove(ExpectedErrorSuppressionFilter.MDC_SUPPRESS_PATTERNS);
  }
}
