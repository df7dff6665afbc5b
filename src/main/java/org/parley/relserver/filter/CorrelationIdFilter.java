package org.parley.relserver.filter;

import com.github.f4b6a3.uuid.UuidCreator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that assigns a correlation ID to each HTTP request.
 * A well-formed {@code X-Correlation-ID} request header is reused, otherwise a
 * UUIDv7 is generated. The id is stored in SLF4J MDC for logging, echoed in the
 * response, and copied into Kafka headers by the event publisher.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

  /**
   * MDC key for correlation ID (used in logging pattern and EventPublisher).
   */
  public static final String CORRELATION_ID_KEY = "correlationId";

  /**
   * Request and response header carrying the correlation ID.
   */
  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

  private static final int MAX_LENGTH = 128;

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String correlationId = resolve(request.getHeader(CORRELATION_ID_HEADER));
    MDC.put(CORRELATION_ID_KEY, correlationId);
    response.setHeader(CORRELATION_ID_HEADER, correlationId);

    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CORRELATION_ID_KEY);
    }
  }

  static String resolve(String incoming) {
    if (incoming != null && !incoming.isBlank() && incoming.length() <= MAX_LENGTH
        && incoming.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_')) {
      return incoming;
    }
    return UuidCreator.getTimeOrderedEpoch().toString();
  }
}
