package com.planner.taskservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.planner.observability.CorrelationContext;
import com.planner.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates a correlation id when none is provided")
    void generates() throws Exception {
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(new MockHttpServletRequest(), response, chain);

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("propagates the client's correlation id")
    void propagates() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("replaces an oversized correlation id")
    void oversized() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "x".repeat(500));
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).hasSizeLessThanOrEqualTo(128);
    }

    @Test
    @DisplayName("exposes the context while the chain runs and clears it afterwards")
    void scopedToRequest() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain-123");

        filter.doFilter(request, new MockHttpServletResponse(),
                (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null)));

        assertThat(captured.get()).isEqualTo(CorrelationContext.of("during-chain-123"));
        assertThat(captured.get().tenantId()).isNull();
        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
