package com.clinicqueue.appointment.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/api/appointments/42/reschedule");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.addHeader("X-Staff-Id", "7");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("appointment_id", "42"));
    final MockHttpServletResponse response = new MockHttpServletResponse();

    try {
      interceptor.preHandle(request, response, new Object());
    } catch (Exception ex) {
      fail("preHandle should not throw", ex);
    }

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/api/appointments/42/reschedule");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("staff_id")).isEqualTo("7");
    assertThat(MDC.get("appointment_id")).isEqualTo("42");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("appointment_id")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderMissing() throws Exception {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/no-show/stats");
    request.setRemoteAddr("192.168.1.5");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("client_ip")).isEqualTo("192.168.1.5");
    assertThat(MDC.get("staff_id")).isNull();
  }
}
