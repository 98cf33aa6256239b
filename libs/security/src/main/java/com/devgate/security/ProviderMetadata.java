package com.devgate.security;

import java.net.URI;

/**
 * The parts of the provider's OpenID configuration the validator relies on.
 * Fetched once and kept for the process lifetime.
 *
 * @param issuer  expected {@code iss} claim
 * @param jwksUri location of the signing-key set
 */
public record ProviderMetadata(String issuer, URI jwksUri) {

    public ProviderMetadata {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        if (jwksUri == null) {
            throw new IllegalArgumentException("jwksUri must not be null");
        }
    }
}
