package com.engagement.anomaly.web;

import com.engagement.anomaly.config.SecurityConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeyInterceptorTest {

    private SecurityConfig securityConfig;
    private ApiKeyInterceptor interceptor;

    @BeforeEach
    void setUp() {
        securityConfig = new SecurityConfig();
        securityConfig.setApiKey("secret");
        interceptor = new ApiKeyInterceptor(securityConfig, new ObjectMapper());
    }

    @Test
    void matchingKey_isAdmitted() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/metrics/summary");
        request.addHeader(ApiKeyInterceptor.HEADER, "secret");

        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), null)).isTrue();
    }

    @Test
    void wrongKey_isRejectedWith403() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/metrics/summary");
        request.addHeader(ApiKeyInterceptor.HEADER, "secreT");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(request, response, null)).isFalse();
        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("\"error\":\"forbidden\"");
    }

    @Test
    void missingKey_isRejected() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/alerts/history");

        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), null)).isFalse();
    }

    @Test
    void blankConfiguredKey_disablesCheck() throws Exception {
        securityConfig.setApiKey("");
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/alerts/history");

        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), null)).isTrue();
    }

    @Test
    void corsPreflight_isAdmittedWithoutKey() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("OPTIONS", "/api/v1/alerts/history");
        request.addHeader("Origin", "http://localhost:5173");
        request.addHeader("Access-Control-Request-Method", "GET");

        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), null)).isTrue();
    }
}
