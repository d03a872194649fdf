package com.cryptofolio.backend.config;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestCorrelationFilterTest {

    private final RequestCorrelationFilter filter = new RequestCorrelationFilter();

    @Test
    void propagatesIncomingIdsAndClearsMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/portfolio/assets");
        request.addHeader(RequestCorrelationFilter.REQUEST_ID_HEADER, "req-1");
        request.addHeader(RequestCorrelationFilter.CORRELATION_ID_HEADER, "corr-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seen.set(MDC.get(RequestCorrelationFilter.CORRELATION_ID_MDC_KEY));
            }
        });

        assertThat(seen).hasValue("corr-1");
        assertThat(response.getHeader(RequestCorrelationFilter.REQUEST_ID_HEADER)).isEqualTo("req-1");
        assertThat(MDC.get(RequestCorrelationFilter.REQUEST_ID_MDC_KEY)).isNull();
        assertThat(MDC.get(RequestCorrelationFilter.CORRELATION_ID_MDC_KEY)).isNull();
    }

    @Test
    void generatesIdsWhenAbsent() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/"), response, new MockFilterChain());

        assertThat(response.getHeader(RequestCorrelationFilter.REQUEST_ID_HEADER)).isNotBlank();
        assertThat(response.getHeader(RequestCorrelationFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    void blankHeaderIsReplacedWithGeneratedId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.addHeader(RequestCorrelationFilter.REQUEST_ID_HEADER, "  ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader(RequestCorrelationFilter.REQUEST_ID_HEADER)).isNotBlank().hasSize(36);
    }
}
