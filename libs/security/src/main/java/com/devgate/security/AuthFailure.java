package com.devgate.security;

/**
 * A typed refusal: what went wrong and a short, client-safe message.
 * <p>
 * The message never contains token material or upstream exception text.
 *
 * @param kind    failure kind (carries status and reason code)
 * @param message short human-readable explanation
 */
public record AuthFailure(AuthFailureKind kind, String message) {

    public AuthFailure {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
    }

    public int status() {
        return kind.status();
    }

    public String reason() {
        return kind.reason();
    }

    /**
     * Converts this failure into the matching exception type: {@link AuthorizationException}
     * for 403 kinds, {@link AuthenticationException} otherwise.
     */
    public AuthenticationException toException() {
        return kind.isAuthorizationFailure()
                ? new AuthorizationException(this)
                : new AuthenticationException(this);
    }
}
