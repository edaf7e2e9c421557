package com.adobe.nthprime.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * HTTP Request Logging Interceptor.
 * 
 * Logs one line per prediction request with method, path and query, status,
 * duration in milliseconds and the correlation ID from MDC. Failed requests
 * are logged at WARN.
 */
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger("http.request");
    private static final String START_TIME_ATTR = "requestStartTime";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTR, System.nanoTime());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Long startTime = (Long) request.getAttribute(START_TIME_ATTR);
        long durationMillis = startTime != null ? (System.nanoTime() - startTime) / 1_000_000 : 0;

        String query = request.getQueryString();
        String path = query != null ? request.getRequestURI() + "?" + query : request.getRequestURI();
        int status = response.getStatus();
        String correlationId = MDC.get("correlationId");

        if (status >= 400) {
            log.warn("method={} path={} status={} duration={}ms correlationId={}",
                request.getMethod(), path, status, durationMillis, correlationId);
        } else {
            log.info("method={} path={} status={} duration={}ms correlationId={}",
                request.getMethod(), path, status, durationMillis, correlationId);
        }
    }
}
