package com.example.membership_sync.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/webhooks/identity");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    try {
      interceptor.preHandle(request, response, new Object());
    } catch (Exception ex) {
      fail("preHandle should not throw", ex);
    }

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/webhooks/identity");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("client_ip")).isNull();
  }

  @Test
  void generatesRequestIdWhenInboundValueIsUnusable() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/webhooks/identity");
    request.addHeader("X-Request-Id", "bad\nid");
    request.setRemoteAddr("192.0.2.10");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank().isNotEqualTo("bad\nid");
    assertThat(MDC.get("client_ip")).isEqualTo("192.0.2.10");
  }
}
