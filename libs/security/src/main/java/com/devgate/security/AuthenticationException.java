package com.devgate.security;

/**
 * Thrown by {@link TokenValidator#authenticate(String)} when a bearer token is refused.
 * <p>
 * Carries the {@link AuthFailure} so callers can report the exact status and reason code.
 */
public class AuthenticationException extends RuntimeException {

    private final AuthFailure failure;

    public AuthenticationException(AuthFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public AuthFailure failure() {
        return failure;
    }

    public AuthFailureKind kind() {
        return failure.kind();
    }

    public int status() {
        return failure.status();
    }
}
