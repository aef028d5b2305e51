package com.labbackup.api.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Logs API calls with their outcome and duration. Each request gets a short id in the MDC
 * ({@code requestId}) so backup, retention and deletion log lines can be tied to the call
 * that caused them.
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    static final String REQUEST_ID = "requestId";
    private static final String START_TIME_ATTR = "requestStartTime";

    @Value("${backup.http.slow-request-ms:2000}")
    private long slowRequestMs;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTR, System.currentTimeMillis());
        String requestId = request.getHeader("X-Request-Id");
        MDC.put(REQUEST_ID, requestId != null && !requestId.isBlank()
                ? requestId : UUID.randomUUID().toString().substring(0, 8));
        log.debug("Request: {} {}", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                               Object handler, Exception ex) {
        try {
            Long startTime = (Long) request.getAttribute(START_TIME_ATTR);
            long duration = startTime != null ? System.currentTimeMillis() - startTime : 0;
            int status = response.getStatus();
            String method = request.getMethod();
            String uri = request.getRequestURI();

            if (status >= 500) {
                log.error("Response: {} {} -> {} ({}ms){}", method, uri, status, duration,
                        ex != null ? " - " + ex.getMessage() : "");
            } else if (status >= 400) {
                log.warn("Response: {} {} -> {} ({}ms)", method, uri, status, duration);
            } else if (duration >= slowRequestMs) {
                log.warn("Slow response: {} {} -> {} ({}ms)", method, uri, status, duration);
            } else if (isMutating(method)) {
                log.info("Response: {} {} -> {} ({}ms)", method, uri, status, duration);
            } else {
                log.debug("Response: {} {} -> {} ({}ms)", method, uri, status, duration);
            }
        } finally {
            MDC.remove(REQUEST_ID);
        }
    }

    // Triggers, deletions, protection changes
    private boolean isMutating(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "DELETE".equals(method);
    }
}
