package com.example.pipeline.config;

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
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/internal/triggers/events/4/cancelled");
    request.addHeader("X-Request-Id", "req-1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/internal/triggers/events/4/cancelled");
    assertThat(response.getHeader("X-Request-Id")).isEqualTo("req-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("http_path")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderIsBlank() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/admin/pipeline/queues");
    request.addHeader("X-Request-Id", " ");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isNotBlank().isEqualTo(response.getHeader("X-Request-Id"));
  }

  @Test
  void afterCompletionWithoutPreHandleKeepsForeignKeys() {
    MDC.put("job_id", "job-1");

    interceptor.afterCompletion(
        new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), new Object(), null);

    assertThat(MDC.get("job_id")).isEqualTo("job-1");
  }
}
