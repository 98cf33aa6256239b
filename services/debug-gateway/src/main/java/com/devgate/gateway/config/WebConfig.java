package com.devgate.gateway.config;

import com.devgate.gateway.infrastructure.web.CorrelationIdFilter;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for browser front ends.
 *
 * <p>Origins come from {@code devgate.gateway.cors-origins}; with none configured no CORS
 * mapping is registered. Pre-flight requests are let through by the authentication filter.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final String[] API_METHODS = {"GET", "POST", "DELETE", "OPTIONS"};
    private static final long PREFLIGHT_CACHE_SECONDS = 3600;

    private final GatewayProperties properties;

    public WebConfig(GatewayProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (properties.corsOrigins().isEmpty()) {
            return;
        }
        String[] origins = properties.corsOrigins().toArray(String[]::new);
        registry.addMapping("/v1/**")
                .allowedOrigins(origins)
                .allowedMethods(API_METHODS)
                .allowedHeaders("Authorization", "Content-Type", CorrelationIdFilter.CORRELATION_ID_HEADER)
                .exposedHeaders(CorrelationIdFilter.CORRELATION_ID_HEADER)
                .allowCredentials(true)
                .maxAge(PREFLIGHT_CACHE_SECONDS);
        registry.addMapping("/health")
                .allowedOrigins(origins)
                .allowedMethods("GET");
    }
}
