package com.sdclogin.auth.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

import java.io.IOException;

/**
 * Keeps a copy of each request body as it is read, so that error handling can log
 * the payload after the message converters have already consumed the stream.
 *
 * <p>Only bytes the application actually reads are cached, up to {@link #MAX_CACHED_BYTES}.
 *
 * @see RequestPayloadRedactor for how the cached body is made safe to log
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestBodyCachingFilter extends OncePerRequestFilter {

    static final int MAX_CACHED_BYTES = 64 * 1024;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        HttpServletRequest wrapped = request instanceof ContentCachingRequestWrapper
                ? request
                : new ContentCachingRequestWrapper(request, MAX_CACHED_BYTES);
        filterChain.doFilter(wrapped, response);
    }
}
