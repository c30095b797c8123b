package com.phillippitts.voicedispatch.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every log line written while serving an HTTP request with the request's context.
 *
 * <p>ThreadContext keys: {@code requestId}, {@code method} and {@code uri}. The request id is
 * taken from {@code X-Request-ID} when the caller sends a usable one and generated otherwise;
 * either way it is echoed back so a caller can match a queued utterance to the dispatch log.
 * Values present before the request are restored afterwards.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern USABLE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = requestId(request.getHeader(REQUEST_ID_HEADER));
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(Map.of(
                "requestId", requestId,
                "method", request.getMethod(),
                "uri", request.getRequestURI()))) {
            chain.doFilter(request, response);
        }
    }

    /** Header values with spaces, control characters or excessive length would corrupt log lines. */
    static String requestId(String header) {
        if (header != null && USABLE_ID.matcher(header.trim()).matches()) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }
}
