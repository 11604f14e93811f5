package com.monsoonfire.notification.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/** Copies request identity (request id, method, path, caller, forwarded user) into the MDC. */
@Component
@RequiredArgsConstructor
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  private final NotificationInternalApiProperties internalApiProperties;

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> entries = new LinkedHashMap<>();
    entries.put("request_id", resolveRequestId(request));
    entries.put("http_method", request.getMethod());
    entries.put("http_path", request.getRequestURI());
    entries.put("client_ip", resolveClientIp(request));
    entries.put("user_id", request.getHeader(internalApiProperties.userIdHeaderName()));
    entries.values().removeIf(value -> value == null || value.isBlank());
    entries.forEach(MDC::put);
    request.setAttribute(ATTRIBUTE_KEYS, entries.keySet());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof Iterable<?> keys) {
      for (Object key : keys) {
        MDC.remove(String.valueOf(key));
      }
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader("X-Request-Id");
    return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor == null || forwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwardedFor.split(",", 2)[0].trim();
  }
}
