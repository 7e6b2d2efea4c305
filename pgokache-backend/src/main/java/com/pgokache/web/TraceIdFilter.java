package com.pgokache.web;

import com.pgokache.logging.MdcKeys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the logging context of each HTTP request.
 *
 * <ul>
 *   <li>{@link MdcKeys#TRACE_ID}: the caller's {@code X-Request-Id} if it is short and made of safe
 *   characters, otherwise a fresh UUID. Always echoed in the response header.</li>
 *   <li>{@link MdcKeys#INSTANCE_ID}: the id from {@code /v1/instances/{id}/...} paths, so on-demand
 *   probes and collections log like scheduled ones.</li>
 * </ul>
 * Both keys are removed when the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    static final String TRACE_ID_HEADER = "X-Request-Id";
    private static final Pattern SAFE_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern INSTANCE_PATH = Pattern.compile("^/v1/instances/(\\d{1,18})(?:/.*)?$");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_ID_HEADER));
        MDC.put(MdcKeys.TRACE_ID, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        String instanceId = instanceIdFromPath(request.getRequestURI());
        if (instanceId != null) {
            MDC.put(MdcKeys.INSTANCE_ID, instanceId);
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MdcKeys.TRACE_ID);
            MDC.remove(MdcKeys.INSTANCE_ID);
        }
    }

    static String resolveTraceId(String requested) {
        if (requested != null && SAFE_TRACE_ID.matcher(requested).matches()) {
            return requested;
        }
        return UUID.randomUUID().toString();
    }

    static String instanceIdFromPath(String path) {
        if (path == null) {
            return null;
        }
        Matcher m = INSTANCE_PATH.matcher(path);
        return m.matches() ? m.group(1) : null;
    }
}
