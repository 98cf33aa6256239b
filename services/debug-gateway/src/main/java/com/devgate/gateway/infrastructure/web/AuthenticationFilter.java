package com.devgate.gateway.infrastructure.web;

import com.devgate.observability.CorrelationContextHolder;
import com.devgate.observability.MetricFactory;
import com.devgate.observability.SensitiveDataRedactor;
import com.devgate.security.AuthFailure;
import com.devgate.security.AuthenticatedPrincipal;
import com.devgate.security.AuthenticationException;
import com.devgate.security.BearerTokenExtractor;
import com.devgate.security.TokenValidationResult;
import com.devgate.security.TokenValidator;
import com.devgate.security.context.ExecutionContext;
import com.devgate.security.context.ExecutionContextPropagator;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.PathContainer;
import org.springframework.http.server.RequestPath;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Requires a valid bearer token on protected routes.
 *
 * <p>Unprotected requests (see {@link RouteAuthenticationTable}) pass straight through. For
 * protected ones the token is validated; a refusal is written here as
 * {@code {"error": reason, "detail": message}} with the failure's status, because the request
 * never reaches a controller. On success the principal and raw token become request attributes
 * and the caller is bound in the {@link ExecutionContextPropagator} for the rest of the chain.
 */
public class AuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);

    public static final String PRINCIPAL_ATTRIBUTE = AuthenticationFilter.class.getName() + ".principal";
    public static final String ACCESS_TOKEN_ATTRIBUTE = AuthenticationFilter.class.getName() + ".accessToken";

    static final String OUTCOME_ACCEPTED = "accepted";
    static final String OUTCOME_REJECTED = "rejected";

    private final RouteAuthenticationTable routes;
    private final TokenValidator validator;
    private final ExecutionContextPropagator propagator;
    private final MetricFactory metrics;
    private final ObjectMapper objectMapper;
    private final SensitiveDataRedactor redactor;

    public AuthenticationFilter(
            RouteAuthenticationTable routes,
            TokenValidator validator,
            ExecutionContextPropagator propagator,
            MetricFactory metrics,
            ObjectMapper objectMapper,
            SensitiveDataRedactor redactor) {
        this.routes = routes;
        this.validator = validator;
        this.propagator = propagator;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.redactor = redactor;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !routes.requiresAuthentication(request.getMethod(), pathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token;
        try {
            token = BearerTokenExtractor.require(request.getHeader(HttpHeaders.AUTHORIZATION));
        } catch (AuthenticationException e) {
            reject(request, response, e.failure());
            return;
        }

        TokenValidationResult result = validator.validate(token);
        if (result instanceof TokenValidationResult.Rejected rejected) {
            reject(request, response, rejected.failure());
            return;
        }

        AuthenticatedPrincipal principal = ((TokenValidationResult.Valid) result).principal();
        metrics.recordAuthentication(OUTCOME_ACCEPTED, "ok");
        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        request.setAttribute(ACCESS_TOKEN_ATTRIBUTE, token);
        CorrelationContextHolder.attachPrincipal(principal.objectId(), principal.tenantId());
        if (log.isDebugEnabled()) {
            log.debug("Authenticated {} {} as {} with claims {}", request.getMethod(), request.getRequestURI(),
                    principal.objectId(), redactor.redact(principal.claims()));
        }

        try (ExecutionContextPropagator.Scope ignored = propagator.open(new ExecutionContext(principal, token))) {
            filterChain.doFilter(request, response);
        }
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, AuthFailure failure)
            throws IOException {
        log.warn("Authentication failed for {} {}: {} ({})",
                request.getMethod(), request.getRequestURI(), failure.message(), failure.reason());
        metrics.recordAuthentication(OUTCOME_REJECTED, failure.reason());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", failure.reason());
        body.put("detail", failure.message());
        CorrelationContextHolder.correlationId().ifPresent(id -> body.put("correlationId", id));

        response.setStatus(failure.status());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        if (failure.status() == HttpServletResponse.SC_UNAUTHORIZED) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        }
        objectMapper.writeValue(response.getOutputStream(), body);
    }

    /**
     * The path MVC matches handlers against: percent-decoded, with {@code ;} parameters removed
     * and empty segments dropped. Route decisions must use this form; on the raw URI,
     * {@code /v1;x=1/entities} and {@code /%76%31/entities} would not start with {@code /v1}.
     */
    static String pathWithinApplication(HttpServletRequest request) {
        RequestPath path = RequestPath.parse(request.getRequestURI(), request.getContextPath());
        StringBuilder canonical = new StringBuilder();
        for (PathContainer.Element element : path.pathWithinApplication().elements()) {
            if (element instanceof PathContainer.PathSegment segment && !segment.valueToMatch().isEmpty()) {
                canonical.append('/').append(segment.valueToMatch());
            }
        }
        return canonical.length() == 0 ? "/" : canonical.toString();
    }
}
