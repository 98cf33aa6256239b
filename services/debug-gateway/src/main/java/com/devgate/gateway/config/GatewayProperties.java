package com.devgate.gateway.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe settings for the debug gateway, bound from {@code devgate.gateway.*}.
 *
 * <pre>
 * devgate:
 *   gateway:
 *     name: debug-gateway
 *     environment: local
 *     protected-prefixes: [/v1]
 *     anonymous-routes: [/health]
 *     cors-origins: [http://localhost:5173]
 * </pre>
 *
 * <p>Identity-provider settings are not here; they come from the {@code DEVUI_AZURE_AD_*}
 * variables.
 *
 * @param name              service name used in logs and metrics. Required.
 * @param environment       deployment environment, {@code development} when unset
 * @param protectedPrefixes path prefixes that require a bearer token, {@code /v1} when unset
 * @param anonymousRoutes   path patterns that never require a token, {@code /health} when unset
 * @param corsOrigins       origins allowed to call {@code /v1/**} from a browser
 */
@ConfigurationProperties(prefix = "devgate.gateway")
@Validated
public record GatewayProperties(
        @NotBlank String name,
        String environment,
        List<String> protectedPrefixes,
        List<String> anonymousRoutes,
        List<String> corsOrigins) {

    public GatewayProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (protectedPrefixes == null || protectedPrefixes.isEmpty()) {
            protectedPrefixes = List.of("/v1");
        }
        if (anonymousRoutes == null || anonymousRoutes.isEmpty()) {
            anonymousRoutes = List.of("/health");
        }
        if (corsOrigins == null) {
            corsOrigins = List.of();
        }
    }
}
