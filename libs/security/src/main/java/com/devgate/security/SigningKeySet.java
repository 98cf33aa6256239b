package com.devgate.security;

import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;
import io.jsonwebtoken.security.PublicJwk;

import java.security.Key;
import java.security.PublicKey;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the provider's signing keys, indexed by key id.
 * <p>
 * A refresh builds a new instance and swaps the validator's reference; an instance is never
 * modified after construction, so concurrent readers need no locking.
 *
 * @param keys      public keys by {@code kid}
 * @param expiresAt instant after which the set must be re-fetched
 */
public record SigningKeySet(Map<String, PublicKey> keys, Instant expiresAt) {

    public SigningKeySet {
        keys = keys == null ? Map.of() : Map.copyOf(keys);
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt must not be null");
        }
    }

    /**
     * Builds a key set from a JWKS document. Entries without a {@code kid}, private keys and
     * key types the JWT library does not support are skipped.
     *
     * @throws IllegalArgumentException if the document is not a valid JWKS
     */
    public static SigningKeySet parse(String jwksJson, Instant expiresAt) {
        if (jwksJson == null || jwksJson.isBlank()) {
            throw new IllegalArgumentException("JWKS document is empty");
        }
        JwkSet jwkSet;
        try {
            jwkSet = Jwks.setParser().build().parse(jwksJson);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid JWKS document: " + e.getMessage(), e);
        }
        Map<String, PublicKey> keys = new LinkedHashMap<>();
        for (Jwk<?> jwk : jwkSet.getKeys()) {
            String keyId = jwk.getId();
            if (keyId == null || keyId.isBlank() || !(jwk instanceof PublicJwk<?> publicJwk)) {
                continue;
            }
            Key key = publicJwk.toKey();
            if (key instanceof PublicKey publicKey) {
                keys.put(keyId, publicKey);
            }
        }
        return new SigningKeySet(keys, expiresAt);
    }

    public Optional<PublicKey> find(String keyId) {
        return Optional.ofNullable(keys.get(keyId));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Set<String> keyIds() {
        return keys.keySet();
    }
}
