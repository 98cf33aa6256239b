package com.devgate.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The caller behind a validated bearer token.
 * <p>
 * Immutable: the collections are unmodifiable copies. Insertion order of roles
 * and scopes follows the token so projections are deterministic.
 *
 * @param objectId           directory object id ({@code oid}, falling back to {@code sub})
 * @param tenantId           tenant the token belongs to
 * @param name               display name, if present
 * @param preferredUsername  {@code preferred_username}, falling back to {@code upn}
 * @param roles              application roles from the {@code roles} claim
 * @param scopes             delegated scopes from the {@code scp} claim
 * @param claims             every claim of the verified token
 * @param tenantVerification whether the tenant came from a checked claim
 */
public record AuthenticatedPrincipal(
        String objectId,
        String tenantId,
        String name,
        String preferredUsername,
        Set<String> roles,
        Set<String> scopes,
        Map<String, Object> claims,
        TenantVerification tenantVerification
) {

    public AuthenticatedPrincipal {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("objectId must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        roles = copyOf(roles);
        scopes = copyOf(scopes);
        // claim values may legitimately be null, which Map.copyOf rejects
        claims = claims == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
        if (tenantVerification == null) {
            tenantVerification = TenantVerification.VERIFIED;
        }
    }

    public Optional<String> displayName() {
        return Optional.ofNullable(name);
    }

    public Optional<String> username() {
        return Optional.ofNullable(preferredUsername);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }

    public boolean tenantVerified() {
        return tenantVerification == TenantVerification.VERIFIED;
    }

    private static Set<String> copyOf(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
