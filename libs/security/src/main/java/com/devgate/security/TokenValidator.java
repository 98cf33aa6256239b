package com.devgate.security;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.InvalidClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.security.SecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Collections;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Validates RS256 bearer tokens issued by the configured identity provider.
 * <p>
 * Provider metadata is fetched once and kept for the process lifetime. The signing-key set is
 * cached for {@link AuthSettings#keyCacheTtlSeconds()} and replaced wholesale on refresh. A token
 * whose {@code kid} is unknown triggers exactly one forced refresh before it is refused.
 * <p>
 * WHY a lock plus volatile snapshots: validation runs on many request threads at once. Readers
 * only dereference the current immutable snapshot; the lock serializes fetches so a burst of
 * requests with a rotated key results in a single upstream call.
 * <p>
 * Thread-safe. One instance per process.
 */
public class TokenValidator {

    private static final Logger log = LoggerFactory.getLogger(TokenValidator.class);

    static final String REQUIRED_ALGORITHM = "RS256";

    /** Lifecycle of the provider caches. */
    public enum State {
        UNINITIALIZED,
        CONFIGURING,
        READY
    }

    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
    };

    private final AuthSettings settings;
    private final DocumentFetcher fetcher;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile State state = State.UNINITIALIZED;
    private volatile ProviderMetadata metadata;
    private volatile SigningKeySet keySet;

    public TokenValidator(AuthSettings settings) {
        this(settings, new HttpDocumentFetcher(), Clock.systemUTC());
    }

    public TokenValidator(AuthSettings settings, DocumentFetcher fetcher, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.settings = settings;
        this.fetcher = fetcher;
        this.clock = clock;
    }

    /**
     * Fetches provider metadata and the signing-key set. Idempotent.
     *
     * @throws UpstreamFetchException if either document cannot be fetched or parsed
     */
    public void initialize() {
        lock.lock();
        try {
            if (state == State.READY) {
                return;
            }
            state = State.CONFIGURING;
            try {
                ProviderMetadata md = loadMetadata();
                metadata = md;
                keySet = loadKeySet(md);
                state = State.READY;
                log.info("Token validator ready: issuer={}, signingKeys={}", md.issuer(), keySet.keyIds().size());
            } catch (RuntimeException e) {
                state = State.UNINITIALIZED;
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    public State state() {
        return state;
    }

    public AuthSettings settings() {
        return settings;
    }

    public URI configurationUri() {
        return settings.metadataUri();
    }

    /** Issuer from the provider metadata, once fetched. */
    public Optional<String> issuer() {
        ProviderMetadata md = metadata;
        return md == null ? Optional.empty() : Optional.of(md.issuer());
    }

    /**
     * Returns the principal for a valid token or throws the matching failure.
     *
     * @throws AuthenticationException on a 401 or 500 failure
     * @throws AuthorizationException  on a 403 failure
     */
    public AuthenticatedPrincipal authenticate(String token) {
        return validate(token).orElseThrow();
    }

    /**
     * Validates a compact JWS. Never throws for a bad token; every refusal is a
     * {@link TokenValidationResult.Rejected}.
     */
    public TokenValidationResult validate(String token) {
        if (token == null || token.isBlank()) {
            return TokenValidationResult.rejected(AuthFailureKind.MALFORMED_TOKEN, "Bearer token required.");
        }

        ProviderMetadata md;
        try {
            md = ensureMetadata();
        } catch (UpstreamFetchException e) {
            log.error("Provider metadata unavailable from {}: {}", e.uri(), e.getMessage());
            return TokenValidationResult.rejected(AuthFailureKind.AUTH_NOT_CONFIGURED,
                    "Authentication is not configured on the server.");
        }

        SigningKeySet keys;
        try {
            keys = ensureKeySet(md);
        } catch (UpstreamFetchException e) {
            log.warn("Signing keys unavailable from {}: {}", e.uri(), e.getMessage());
            return TokenValidationResult.rejected(AuthFailureKind.UPSTREAM_UNAVAILABLE,
                    "Unable to retrieve token signing keys.");
        }

        Map<String, Object> header;
        try {
            header = decodeSegment(token, 0);
        } catch (IllegalArgumentException e) {
            log.debug("Rejecting token with unparseable header: {}", e.getMessage());
            return TokenValidationResult.rejected(AuthFailureKind.MALFORMED_TOKEN, "Unable to parse token header.");
        }

        Object kid = header.get("kid");
        if (!(kid instanceof String keyId) || keyId.isBlank()) {
            return TokenValidationResult.rejected(AuthFailureKind.MISSING_KEY_ID, "Token header missing 'kid' claim.");
        }
        if (!REQUIRED_ALGORITHM.equals(header.get("alg"))) {
            return TokenValidationResult.rejected(AuthFailureKind.UNSUPPORTED_ALGORITHM,
                    "Token signing algorithm is not supported.");
        }

        Optional<PublicKey> signingKey = keys.find(keyId);
        if (signingKey.isEmpty()) {
            log.info("Unknown signing key id {}, refreshing key set once", keyId);
            try {
                signingKey = refreshKeySet(md, keys).find(keyId);
            } catch (UpstreamFetchException e) {
                log.warn("Forced key refresh from {} failed: {}", e.uri(), e.getMessage());
                return TokenValidationResult.rejected(AuthFailureKind.UPSTREAM_UNAVAILABLE,
                        "Unable to retrieve token signing keys.");
            }
            if (signingKey.isEmpty()) {
                return TokenValidationResult.rejected(AuthFailureKind.UNKNOWN_SIGNING_KEY,
                        "Signing key not found for token.");
            }
        }

        Claims verified;
        try {
            verified = Jwts.parser()
                    .verifyWith(signingKey.get())
                    .requireIssuer(md.issuer())
                    .clockSkewSeconds(settings.clockSkewSeconds())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            return TokenValidationResult.rejected(AuthFailureKind.TOKEN_EXPIRED, "Token has expired.");
        } catch (PrematureJwtException e) {
            return TokenValidationResult.rejected(AuthFailureKind.TOKEN_NOT_YET_VALID, "Token is not yet valid.");
        } catch (InvalidClaimException e) {
            if (Claims.ISSUER.equals(e.getClaimName())) {
                return TokenValidationResult.rejected(AuthFailureKind.INVALID_ISSUER, "Token issuer is not trusted.");
            }
            return TokenValidationResult.rejected(AuthFailureKind.INVALID_CLAIMS, "Token claims are invalid.");
        } catch (SecurityException e) {
            return TokenValidationResult.rejected(AuthFailureKind.INVALID_SIGNATURE, "Token signature is invalid.");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejecting token: {}", e.getMessage());
            return TokenValidationResult.rejected(AuthFailureKind.MALFORMED_TOKEN, "Token validation failed.");
        }

        Set<String> audiences = verified.getAudience();
        if (audiences == null || Collections.disjoint(audiences, settings.audiences())) {
            return TokenValidationResult.rejected(AuthFailureKind.INVALID_AUDIENCE, "Token audience not accepted.");
        }

        // signature verified; re-read the payload so claim values keep their JSON types
        Map<String, Object> claims = decodeSegment(token, 1);
        return buildPrincipal(claims);
    }

    private TokenValidationResult buildPrincipal(Map<String, Object> claims) {
        TenantVerification tenantVerification = TenantVerification.VERIFIED;
        String tenantId = ClaimValues.firstString(claims, "tid");
        if (tenantId == null) {
            log.debug("Token carries no tid claim; assuming configured tenant {}", settings.tenantId());
            tenantVerification = TenantVerification.CLAIM_ABSENT;
            tenantId = settings.tenantId();
        } else if (!tenantId.toLowerCase(Locale.ROOT).equals(settings.tenantId().toLowerCase(Locale.ROOT))) {
            return TokenValidationResult.rejected(AuthFailureKind.TENANT_MISMATCH,
                    "Token tenant does not match configured tenant.");
        }

        String objectId = ClaimValues.firstString(claims, "oid", "sub");
        if (objectId == null) {
            return TokenValidationResult.rejected(AuthFailureKind.MISSING_SUBJECT,
                    "Token does not contain required subject identifiers.");
        }

        // scp is space-delimited; a string-valued roles claim is comma-delimited
        Set<String> roles = ClaimValues.asSet(claims.get("roles"), ",");
        Set<String> scopes = ClaimValues.asSet(claims.get("scp"), " ");

        if (!settings.requiredScopes().isEmpty() && Collections.disjoint(scopes, settings.requiredScopes())) {
            return TokenValidationResult.rejected(AuthFailureKind.MISSING_SCOPE, "Token missing required scope.");
        }
        if (!settings.requiredRoles().isEmpty() && Collections.disjoint(roles, settings.requiredRoles())) {
            return TokenValidationResult.rejected(AuthFailureKind.MISSING_ROLE,
                    "Token missing required application role.");
        }

        return TokenValidationResult.valid(new AuthenticatedPrincipal(
                objectId,
                tenantId,
                ClaimValues.firstString(claims, "name"),
                ClaimValues.firstString(claims, "preferred_username", "upn"),
                roles,
                scopes,
                claims,
                tenantVerification));
    }

    // ---- Provider caches ----

    private ProviderMetadata ensureMetadata() {
        ProviderMetadata md = metadata;
        if (md != null) {
            return md;
        }
        lock.lock();
        try {
            if (metadata == null) {
                metadata = loadMetadata();
            }
            return metadata;
        } finally {
            lock.unlock();
        }
    }

    private SigningKeySet ensureKeySet(ProviderMetadata md) {
        SigningKeySet current = keySet;
        if (current != null && !current.isExpired(clock.instant())) {
            return current;
        }
        lock.lock();
        try {
            if (keySet == null || keySet.isExpired(clock.instant())) {
                keySet = loadKeySet(md);
                if (state != State.READY) {
                    state = State.READY;
                }
            }
            return keySet;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the key set unless another thread already replaced {@code observed}, in which case
     * the newer set is returned without another fetch.
     */
    private SigningKeySet refreshKeySet(ProviderMetadata md, SigningKeySet observed) {
        lock.lock();
        try {
            if (keySet == observed) {
                keySet = loadKeySet(md);
            }
            return keySet;
        } finally {
            lock.unlock();
        }
    }

    private ProviderMetadata loadMetadata() {
        URI uri = settings.metadataUri();
        String body = fetcher.fetch(uri);
        JsonNode document;
        try {
            document = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UpstreamFetchException(uri, "Provider metadata is not valid JSON", e);
        }
        String issuer = document == null ? null : document.path("issuer").asText(null);
        String jwksUri = document == null ? null : document.path("jwks_uri").asText(null);
        if (issuer == null || issuer.isBlank() || jwksUri == null || jwksUri.isBlank()) {
            throw new UpstreamFetchException(uri, "Provider metadata is missing issuer or jwks_uri");
        }
        try {
            return new ProviderMetadata(issuer, URI.create(jwksUri));
        } catch (IllegalArgumentException e) {
            throw new UpstreamFetchException(uri, "Provider metadata has an invalid jwks_uri", e);
        }
    }

    private SigningKeySet loadKeySet(ProviderMetadata md) {
        String body = fetcher.fetch(md.jwksUri());
        Instant expiresAt = clock.instant().plusSeconds(settings.keyCacheTtlSeconds());
        try {
            SigningKeySet loaded = SigningKeySet.parse(body, expiresAt);
            log.debug("Loaded {} signing keys from {}", loaded.keyIds().size(), md.jwksUri());
            return loaded;
        } catch (IllegalArgumentException e) {
            throw new UpstreamFetchException(md.jwksUri(), "Signing key set could not be parsed", e);
        }
    }

    private Map<String, Object> decodeSegment(String token, int index) {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("expected three token segments, got " + parts.length);
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(parts[index]);
            Map<String, Object> decoded = objectMapper.readValue(new String(json, StandardCharsets.UTF_8), CLAIMS_TYPE);
            if (decoded == null) {
                throw new IllegalArgumentException("token segment is not a JSON object");
            }
            return decoded;
        } catch (IOException e) {
            throw new IllegalArgumentException("token segment is not valid JSON", e);
        }
    }
}
