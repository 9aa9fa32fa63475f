package com.phillippitts.worktracker.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>deviceId: from X-Device-ID header (if present)</li>
 *   <li>siteId: from the {@code /api/sites/{siteId}} path segment, else the X-Site-ID header</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>The context is always cleared after the request to avoid leakage across threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    private static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final String DEVICE_ID_HEADER = "X-Device-ID";
    private static final String SITE_ID_HEADER = "X-Site-ID";
    private static final Pattern SITE_PATH = Pattern.compile("^/api/sites/([^/]+)");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                ThreadContext.put("requestId", headerOrGenerate(http, REQUEST_ID_HEADER));

                String deviceId = http.getHeader(DEVICE_ID_HEADER);
                if (deviceId != null && !deviceId.isBlank()) {
                    ThreadContext.put("deviceId", deviceId);
                }

                String siteId = siteIdOf(http);
                if (siteId != null) {
                    ThreadContext.put("siteId", siteId);
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String siteIdOf(HttpServletRequest req) {
        String uri = req.getRequestURI();
        if (uri != null) {
            Matcher m = SITE_PATH.matcher(uri);
            if (m.find()) {
                return m.group(1);
            }
        }
        String header = req.getHeader(SITE_ID_HEADER);
        return (header == null || header.isBlank()) ? null : header;
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
