package com.devgate.security;

/**
 * Every way a bearer token can be refused, with the HTTP status and the machine-readable
 * reason code reported to the client.
 * <p>
 * 401 means "not authenticated", 403 means "authenticated but not allowed here", 500 means
 * the gateway itself is misconfigured.
 */
public enum AuthFailureKind {

    // ---- Request shape ----
    MISSING_AUTHORIZATION(401, "missing_authorization"),
    INVALID_AUTHORIZATION_SCHEME(401, "invalid_authorization_scheme"),

    // ---- Token structure and signature ----
    MALFORMED_TOKEN(401, "malformed_token"),
    MISSING_KEY_ID(401, "missing_key_id"),
    UNSUPPORTED_ALGORITHM(401, "unsupported_algorithm"),
    UNKNOWN_SIGNING_KEY(401, "unknown_signing_key"),
    INVALID_SIGNATURE(401, "invalid_signature"),

    // ---- Standard claims ----
    TOKEN_EXPIRED(401, "token_expired"),
    TOKEN_NOT_YET_VALID(401, "token_not_yet_valid"),
    INVALID_AUDIENCE(401, "invalid_audience"),
    INVALID_ISSUER(401, "invalid_issuer"),
    INVALID_CLAIMS(401, "invalid_claims"),
    MISSING_SUBJECT(401, "missing_subject"),

    // ---- Authorization ----
    TENANT_MISMATCH(403, "tenant_mismatch"),
    MISSING_SCOPE(403, "missing_scope"),
    MISSING_ROLE(403, "missing_role"),

    // ---- Provider availability ----
    UPSTREAM_UNAVAILABLE(401, "upstream_unavailable"),
    AUTH_NOT_CONFIGURED(500, "auth_not_configured");

    private final int status;
    private final String reason;

    AuthFailureKind(int status, String reason) {
        this.status = status;
        this.reason = reason;
    }

    /** HTTP status returned to the client. */
    public int status() {
        return status;
    }

    /** Stable reason code used in response bodies and metrics. */
    public String reason() {
        return reason;
    }

    /** True for failures where the caller is known but not permitted (HTTP 403). */
    public boolean isAuthorizationFailure() {
        return status == 403;
    }
}
