package com.devgate.gateway.infrastructure.web;

import com.devgate.observability.CorrelationContext;
import com.devgate.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Gives every request a correlation id and binds it for logging.
 *
 * <p>A caller-supplied {@value #CORRELATION_ID_HEADER} is reused when it is a plain token of at
 * most {@value #MAX_LENGTH} characters; anything else (empty, oversized, or carrying characters
 * that could forge log lines) is replaced by a random UUID. The id goes into
 * {@link CorrelationContextHolder} and back out on the response.
 *
 * <p>Ordered first so that authentication rejections already carry the id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final int MAX_LENGTH = 128;

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1," + MAX_LENGTH + "}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = resolve(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        CorrelationContextHolder.set(CorrelationContext.forRequest(
                correlationId, request.getMethod(), AuthenticationFilter.pathWithinApplication(request)));
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    static String resolve(String supplied) {
        if (supplied != null && SAFE_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }
}
