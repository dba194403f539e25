package com.phillippitts.fonemas.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every log line written while serving an HTTP request with that request's context.
 *
 * <p>Context keys: {@code requestId} (the {@value #REQUEST_ID_HEADER} header, or a fresh UUID
 * when it is missing or blank), {@code method} and {@code uri}. The request id is also
 * returned to the client in the same header. The keys are removed when the request
 * completes, whether or not the chain throws.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }

        String requestId = requestId(http);
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext
                .put("requestId", requestId)
                .put("method", http.getMethod())
                .put("uri", http.getRequestURI())) {
            chain.doFilter(request, response);
        }
    }

    private static String requestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        return header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
    }
}
