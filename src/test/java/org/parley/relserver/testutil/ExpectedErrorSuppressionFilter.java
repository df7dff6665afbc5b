package org.parley.relserver.testutil;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Logback filter dropping ERROR and WARN events that the current test declared
 * as expected through {@link ExpectedErrorContext}.
 */
public class ExpectedErrorSuppressionFilter extends Filter<ILoggingEvent> {

  static final String MDC_SUPPRESS_PATTERNS = "test.suppress.patterns";
  static final String SEPARATOR = "|||";

  @Override
  public FilterReply decide(ILoggingEvent event) {
    if (event.getLevel() != Level.ERROR && event.getLevel() != Level.WARN) {
      return FilterReply.NEUTRAL;
    }

    Map<String, String> mdc = event.getMDCPropertyMap();
    String patterns = mdc == null ? null : mdc.get(MDC_SUPPRESS_PATTERNS);
    if (patterns == null || patterns.isEmpty()) {
      return FilterReply.NEUTRAL;
    }

    String message = event.getFormattedMessage();
    String exceptionMessage = event.getThrowableProxy() != null
        ? event.getThrowableProxy().getMessage()
        : null;
    for (String pattern : patterns.split(Pattern.quote(SEPARATOR))) {
      if ((message != null && message.contains(pattern))
          || (exceptionMessage != null && exceptionMessage.contains(pattern))) {
        return FilterReply.DENY;
      }
    }
    return FilterReply.NEUTRAL;
  }
}
