/*
 * どこで: Assignment Web 層
 * 何を: リクエスト単位の request_id / メソッド / パス / 接続元を MDC へ積む
 * なぜ: JSON ログから 1 回の操作 (登録・再送・出力) を追跡できるようにするため
 */
package com.taskmeister.assignment.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.web.servlet.HandlerInterceptor;

public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";

  static final String REQUEST_ID = "request_id";
  static final String HTTP_METHOD = "http_method";
  static final String HTTP_PATH = "http_path";
  static final String CLIENT_IP = "client_ip";

  // logback-spring.xml の includeMdcKeyName と揃える
  static final List<String> MDC_KEYS = List.of(REQUEST_ID, HTTP_METHOD, HTTP_PATH, CLIENT_IP);

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String requestId = resolveRequestId(request);
    put(keys, REQUEST_ID, requestId);
    put(keys, HTTP_METHOD, request.getMethod());
    put(keys, HTTP_PATH, request.getRequestURI());
    put(keys, CLIENT_IP, resolveClientIp(request));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId != null && !requestId.isBlank()) {
      return requestId.trim();
    }
    return UUID.randomUUID().toString();
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    // 先頭が元のクライアント
    final int commaIndex = forwarded.indexOf(',');
    return commaIndex < 0 ? forwarded.trim() : forwarded.substring(0, commaIndex).trim();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
