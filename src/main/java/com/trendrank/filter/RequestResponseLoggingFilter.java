package com.trendrank.filter;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Logs one line per API request with its status and duration.
 */
@Component
public class RequestResponseLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestResponseLoggingFilter.class);

    @Value("${logging.enabled:true}")
    private boolean isEnabled;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !isEnabled || !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long startNanos = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMicros = (System.nanoTime() - startNanos) / 1000;
            logger.info("Method={}, URI={}, Query={}, ClientIP={}, ResponseCode={}, Duration={}us",
                    request.getMethod(),
                    request.getRequestURI(),
                    request.getQueryString() != null ? request.getQueryString() : "None",
                    request.getRemoteAddr(),
                    response.getStatus(),
                    durationMicros);
        }
    }
}
