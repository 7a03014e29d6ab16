package com.phillippitts.meetingrouter.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) and logs every request.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>webhookId: from the provider's webhook-id header (if present)</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>Completion is logged at ERROR for status 400 and above. The context is always cleared after
 * the request to avoid leakage across threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class WebhookMdcFilter implements Filter {

    private static final Logger LOG = LogManager.getLogger(WebhookMdcFilter.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String WEBHOOK_ID_HEADER = "webhook-id";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        long startNanos = System.nanoTime();
        try {
            ThreadContext.put("requestId", headerOrGenerate(http, REQUEST_ID_HEADER));
            String webhookId = http.getHeader(WEBHOOK_ID_HEADER);
            if (webhookId != null && !webhookId.isBlank()) {
                ThreadContext.put("webhookId", webhookId);
            }
            ThreadContext.put("method", http.getMethod());
            ThreadContext.put("uri", http.getRequestURI());

            LOG.info("Incoming request {} {} from {} ({} bytes)", http.getMethod(), http.getRequestURI(),
                    http.getRemoteAddr(), http.getContentLengthLong());
            chain.doFilter(request, response);
        } finally {
            logCompletion(http, response, startNanos);
            ThreadContext.clearAll();
        }
    }

    private static void logCompletion(HttpServletRequest http, ServletResponse response, long startNanos) {
        int status = response instanceof HttpServletResponse httpResponse ? httpResponse.getStatus() : 0;
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        if (status >= 400) {
            LOG.error("Request completed {} {} status={} duration={}ms",
                    http.getMethod(), http.getRequestURI(), status, durationMs);
        } else {
            LOG.info("Request completed {} {} status={} duration={}ms",
                    http.getMethod(), http.getRequestURI(), status, durationMs);
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
