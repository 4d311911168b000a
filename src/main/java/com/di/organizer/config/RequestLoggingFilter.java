package com.di.organizer.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Logs method, URI, JSON body and response status of every API call.
 * Multipart bodies are never logged, only their size; uploaded tables can be large and binary.
 * Enable with organizer.request-logging.enabled=true in application.yml.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Value("${organizer.request-logging.enabled:true}")
    private boolean enabled;

    @Value("${organizer.request-logging.max-body-length:2048}")
    private int maxBodyLength;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (!enabled) {
            filterChain.doFilter(request, response);
            return;
        }
        ContentCachingRequestWrapper wrappedRequest = new ContentCachingRequestWrapper(request, 65536);
        try {
            filterChain.doFilter(wrappedRequest, response);
        } finally {
            logRequest(wrappedRequest);
            log.info("[RESPONSE] status={} path={}", response.getStatus(), wrappedRequest.getRequestURI());
        }
    }

    private void logRequest(ContentCachingRequestWrapper request) {
        try {
            String uri = request.getRequestURI();
            String query = request.getQueryString();
            String fullUri = query != null && !query.isBlank() ? uri + "?" + query : uri;
            log.info("[REQUEST] {} {}", request.getMethod(), fullUri);

            byte[] buf = request.getContentAsByteArray();
            if (buf == null || buf.length == 0) {
                return;
            }
            String contentType = request.getContentType();
            if (contentType != null && contentType.toLowerCase().startsWith("multipart/")) {
                log.info("[REQUEST] Multipart body of {} bytes", buf.length);
                return;
            }
            String body = new String(buf, StandardCharsets.UTF_8);
            if (body.length() > maxBodyLength) {
                body = body.substring(0, maxBodyLength) + "... [truncated, total " + buf.length + " bytes]";
            }
            log.info("[REQUEST] Body (Content-Type: {}): {}", contentType != null ? contentType : "n/a", body);
        } catch (Exception e) {
            log.warn("[REQUEST] Could not log body: {}", e.getMessage());
        }
    }
}
