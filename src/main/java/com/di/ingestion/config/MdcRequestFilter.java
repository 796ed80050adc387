package com.di.ingestion.config;

import com.di.ingestion.load.IngestionOrchestrator;
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
 * Tags every HTTP request in the MDC so API-triggered runs can be told apart in the logs.
 * <ul>
 *   <li>{@code requestId}: the caller's {@value #REQUEST_ID_HEADER} when it is a plain token,
 *       otherwise a short random id. Echoed back in the same response header.</li>
 *   <li>{@code requestPath}: request URI, also echoed by
 *       {@link com.di.ingestion.exception.GlobalExceptionHandler}.</li>
 *   <li>{@code ingestionId}: the id segment of {@code /api/ingestions/{id}/...}, so the
 *       controller's own log lines carry it before the run starts.</li>
 * </ul>
 * All keys are removed in {@code finally}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String REQUEST_ID = "requestId";
    static final String REQUEST_PATH = "requestPath";
    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final Pattern INGESTION_PATH = Pattern.compile("^/api/ingestions/(\\d+)(/.*)?$");
    private static final Pattern CALLER_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String path = request.getRequestURI() != null ? request.getRequestURI() : "";
        String requestId = requestId(request.getHeader(REQUEST_ID_HEADER));
        String ingestionId = ingestionId(path);

        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, path);
        if (ingestionId != null) {
            MDC.put(IngestionOrchestrator.MDC_KEY, ingestionId);
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
            MDC.remove(IngestionOrchestrator.MDC_KEY);
        }
    }

    static String requestId(String callerValue) {
        if (callerValue != null && CALLER_REQUEST_ID.matcher(callerValue).matches()) {
            return callerValue;
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }

    static String ingestionId(String path) {
        Matcher m = INGESTION_PATH.matcher(path);
        return m.matches() ? m.group(1) : null;
    }
}
