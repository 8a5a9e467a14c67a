package com.matchatime.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import com.matchatime.backend.global.config.AppEnvironment;
import com.matchatime.backend.global.config.WebProperties;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter(new ClientIpResolver(
            new WebProperties(AppEnvironment.PRODUCTION, "http://localhost:5173", new WebProperties.Cookie(null),
                    new WebProperties.Web(false), new WebProperties.Timing(Duration.ZERO))));

    @Test
    void echoesWellFormedRequestIdAndExposesItToLogsDuringTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/auth/me");
        request.setRemoteAddr("198.51.100.4");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, (req, res) -> {
            seen.put("requestId", MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            seen.put("clientIp", MDC.get(RequestIdFilter.CLIENT_IP_MDC_KEY));
        });

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(seen).containsEntry("requestId", "abc-123").containsEntry("clientIp", "198.51.100.4");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
        assertThat(MDC.get(RequestIdFilter.CLIENT_IP_MDC_KEY)).isNull();
    }

    @Test
    void replacesMissingOrUnsafeIds() {
        assertThat(RequestIdFilter.requestIdFrom(null)).hasSize(36);
        assertThat(RequestIdFilter.requestIdFrom("bad id\nINFO forged")).hasSize(36);
        assertThat(RequestIdFilter.requestIdFrom("x".repeat(65))).hasSize(36);
        assertThat(RequestIdFilter.requestIdFrom(" trace.42 ")).isEqualTo("trace.42");
    }
}
