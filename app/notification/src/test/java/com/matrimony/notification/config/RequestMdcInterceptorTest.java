package com.matrimony.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

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
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/notifications");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.setRemoteAddr("203.0.113.5");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/notifications");
    // クライアントが付けた X-Forwarded-For は信用しない
    assertThat(MDC.get("client_ip")).isEqualTo("203.0.113.5");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("client_ip")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/tracking/pixel/x");
    request.setRemoteAddr("192.0.2.10");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("client_ip")).isEqualTo("192.0.2.10");
  }

  @Test
  void keysSetOutsideTheRequestSurviveCompletion() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/admin/jobs");
    MDC.put("job_name", "notification-dispatch");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());
    interceptor.afterCompletion(request, new MockHttpServletResponse(), new Object(), null);

    assertThat(MDC.get("job_name")).isEqualTo("notification-dispatch");
    assertThat(MDC.get("http_path")).isNull();
  }
}
