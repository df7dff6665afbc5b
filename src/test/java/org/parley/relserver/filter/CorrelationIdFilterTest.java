package org.parley.relserver.filter;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Unit tests for CorrelationIdFilter.
 */
class CorrelationIdFilterTest {

  private final CorrelationIdFilter filter = new CorrelationIdFilter();

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void resolve_shouldReuseWellFormedHeader() {
    assertThat(CorrelationIdFilter.resolve("req-42_abc")).isEqualTo("req-42_abc");
  }

  @Test
  void resolve_shouldGenerateIdWhenHeaderMissingOrMalformed() {
    assertThat(CorrelationIdFilter.resolve(null)).hasSize(36);
    assertThat(CorrelationIdFilter.resolve("  ")).hasSize(36);
    assertThat(CorrelationIdFilter.resolve("bad id\nwith newline")).hasSize(36);
    assertThat(CorrelationIdFilter.resolve("x".repeat(129))).hasSize(36);
  }

  @Test
  void doFilter_shouldExposeIdInMdcAndResponse() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/test");
    request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "trace-1");
    MockHttpServletResponse response = new MockHttpServletResponse();
    AtomicReference<String> seen = new AtomicReference<>();

    filter.doFilter(request, response,
        (req, res) -> seen.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY)));

    assertThat(seen.get()).isEqualTo("trace-1");
    assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
        .isEqualTo("trace-1");
    assertThat(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY)).isNull();
  }
}
