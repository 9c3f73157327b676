/*
 * どこで: Pairing Web 層
 * 何を: リクエスト単位の相関キーと照会対象の registrant_id を MDC へ載せる
 * なぜ: 登録・照会・自己修復のログを 1 リクエスト単位で追えるようにするため
 */
package com.example.pairing.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String REGISTRANT_ID_KEY = "registrant_id";

  private static final List<String> MDC_KEYS =
      List.of("request_id", "http_method", "http_path", "client_ip", REGISTRANT_ID_KEY);

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = resolveRequestId(request);
    MDC.put("request_id", requestId);
    MDC.put("http_method", request.getMethod());
    MDC.put("http_path", request.getRequestURI());
    putIfPresent("client_ip", request.getRemoteAddr());
    // GET /api/users/{id}/match の照会対象
    putIfPresent(REGISTRANT_ID_KEY, pathVariable(request, "id"));
    response.setHeader(REQUEST_ID_HEADER, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    MDC_KEYS.forEach(MDC::remove);
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return UUID.randomUUID().toString();
  }

  @Nullable
  private String pathVariable(HttpServletRequest request, String name) {
    final Object variables =
        request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (variables instanceof Map<?, ?> map && map.get(name) instanceof String value) {
      return value;
    }
    return null;
  }

  private void putIfPresent(String key, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
    }
  }
}
