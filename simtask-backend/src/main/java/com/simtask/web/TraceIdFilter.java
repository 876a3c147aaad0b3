package com.simtask.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Puts the caller's {@code X-Request-Id} into the MDC for the request and echoes it back.
 *
 * <p>Incoming ids longer than {@value #MAX_TRACE_ID_LENGTH} characters or containing anything
 * other than letters, digits, {@code .}, {@code _} and {@code -} are replaced by a fresh UUID so
 * they never reach the response header or the log line verbatim.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String MDC_TRACE_ID = "trace_id";
    static final int MAX_TRACE_ID_LENGTH = 64;

    private static final Pattern TRACE_ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]{1," + MAX_TRACE_ID_LENGTH + "}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (request instanceof HttpServletRequest httpServletRequest) {
            String traceId = resolveTraceId(httpServletRequest.getHeader(TRACE_ID_HEADER));

            MDC.put(MDC_TRACE_ID, traceId);

            if (response instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(TRACE_ID_HEADER, traceId);
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
        }
    }

    static String resolveTraceId(String incoming) {
        if (incoming != null && TRACE_ID_PATTERN.matcher(incoming).matches()) {
            return incoming;
        }
        return UUID.randomUUID().toString();
    }
}
