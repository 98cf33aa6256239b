package com.devgate.gateway.config;

import com.devgate.gateway.infrastructure.web.AuthenticationFilter;
import com.devgate.gateway.infrastructure.web.RouteAuthenticationTable;
import com.devgate.observability.MetricFactory;
import com.devgate.observability.SensitiveDataRedactor;
import com.devgate.security.AuthSettings;
import com.devgate.security.AuthSettingsLoader;
import com.devgate.security.DocumentFetcher;
import com.devgate.security.HttpDocumentFetcher;
import com.devgate.security.TokenValidator;
import com.devgate.security.context.ExecutionContextPropagator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.env.Environment;

/**
 * Wires bearer-token authentication.
 *
 * <p>The validator is initialized while the context starts: a missing setting or an
 * unreachable identity provider fails startup, so the server never admits traffic it cannot
 * authenticate.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    /** Runs right after {@code CorrelationIdFilter}. */
    static final int AUTHENTICATION_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    @Bean
    public AuthSettings authSettings(Environment environment) {
        AuthSettings settings = AuthSettingsLoader.load(environment::getProperty);
        log.info("Authentication configured: tenant={}, audiences={}, requiredScopes={}, requiredRoles={}",
                settings.tenantId(), settings.audiences(), settings.requiredScopes(), settings.requiredRoles());
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DocumentFetcher documentFetcher() {
        return new HttpDocumentFetcher();
    }

    @Bean
    public TokenValidator tokenValidator(AuthSettings settings, DocumentFetcher fetcher, Clock clock) {
        TokenValidator validator = new TokenValidator(settings, fetcher, clock);
        log.info("Fetching identity provider metadata from {}", validator.configurationUri());
        validator.initialize();
        return validator;
    }

    @Bean
    public ExecutionContextPropagator executionContextPropagator() {
        return new ExecutionContextPropagator();
    }

    @Bean
    public RouteAuthenticationTable routeAuthenticationTable(GatewayProperties properties) {
        RouteAuthenticationTable.Builder builder = RouteAuthenticationTable.builder();
        properties.protectedPrefixes().forEach(builder::protectedPrefix);
        properties.anonymousRoutes().forEach(builder::allowAnonymous);
        return builder.build();
    }

    @Bean
    public FilterRegistrationBean<AuthenticationFilter> authenticationFilter(
            RouteAuthenticationTable routes,
            TokenValidator validator,
            ExecutionContextPropagator propagator,
            MetricFactory metrics,
            ObjectMapper objectMapper,
            SensitiveDataRedactor redactor) {
        FilterRegistrationBean<AuthenticationFilter> registration = new FilterRegistrationBean<>(
                new AuthenticationFilter(routes, validator, propagator, metrics, objectMapper, redactor));
        registration.setOrder(AUTHENTICATION_FILTER_ORDER);
        registration.addUrlPatterns("/*");
        return registration;
    }
}
