package com.devgate.security;

import java.net.URI;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Settings required to validate tokens issued by the identity provider.
 * <p>
 * Built by {@link AuthSettingsLoader} from the environment; the compact constructor enforces the
 * invariants so hand-built instances (tests, embedding) get the same guarantees.
 *
 * @param tenantId              directory tenant whose tokens are accepted
 * @param audiences             accepted {@code aud} values; never empty
 * @param requiredScopes        if non-empty, a token must carry at least one of these scopes
 * @param requiredRoles         if non-empty, a token must carry at least one of these roles
 * @param authorityHost         identity provider base URL, without trailing slash
 * @param keyCacheTtlSeconds    how long a fetched signing-key set is trusted
 * @param clockSkewSeconds      leeway applied to {@code exp} and {@code nbf}
 */
public record AuthSettings(
        String tenantId,
        Set<String> audiences,
        Set<String> requiredScopes,
        Set<String> requiredRoles,
        String authorityHost,
        long keyCacheTtlSeconds,
        long clockSkewSeconds
) {

    public static final String DEFAULT_AUTHORITY_HOST = "https://login.microsoftonline.com";
    public static final long DEFAULT_KEY_CACHE_TTL_SECONDS = 60 * 60;
    public static final long DEFAULT_CLOCK_SKEW_SECONDS = 60;

    public AuthSettings {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ConfigurationException("tenantId must not be null or blank");
        }
        if (audiences == null || audiences.isEmpty()) {
            throw new ConfigurationException("audiences must contain at least one value");
        }
        if (keyCacheTtlSeconds < 0) {
            throw new ConfigurationException("keyCacheTtlSeconds must not be negative");
        }
        if (clockSkewSeconds < 0) {
            throw new ConfigurationException("clockSkewSeconds must not be negative");
        }
        audiences = copyOf(audiences);
        requiredScopes = copyOf(requiredScopes);
        requiredRoles = copyOf(requiredRoles);
        authorityHost = stripTrailingSlashes(
                authorityHost == null || authorityHost.isBlank() ? DEFAULT_AUTHORITY_HOST : authorityHost.strip());
    }

    /**
     * Settings with the default authority host, cache TTL and clock skew, and no scope or role
     * requirements.
     */
    public static AuthSettings of(String tenantId, Set<String> audiences) {
        return new AuthSettings(tenantId, audiences, Set.of(), Set.of(), DEFAULT_AUTHORITY_HOST,
                DEFAULT_KEY_CACHE_TTL_SECONDS, DEFAULT_CLOCK_SKEW_SECONDS);
    }

    /**
     * The provider metadata document for this tenant.
     */
    public URI metadataUri() {
        return URI.create(authorityHost + "/" + tenantId + "/v2.0/.well-known/openid-configuration");
    }

    private static Set<String> copyOf(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private static String stripTrailingSlashes(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
