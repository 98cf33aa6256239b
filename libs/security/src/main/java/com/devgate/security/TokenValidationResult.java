package com.devgate.security;

/**
 * Outcome of validating a bearer token: either a principal or a typed refusal.
 * <p>
 * Callers switch over the two cases instead of catching exceptions, so every failure kind
 * reaches an explicit branch.
 */
public sealed interface TokenValidationResult {

    /** The token was accepted. */
    record Valid(AuthenticatedPrincipal principal) implements TokenValidationResult {
        public Valid {
            if (principal == null) {
                throw new IllegalArgumentException("principal must not be null");
            }
        }
    }

    /** The token was refused. */
    record Rejected(AuthFailure failure) implements TokenValidationResult {
        public Rejected {
            if (failure == null) {
                throw new IllegalArgumentException("failure must not be null");
            }
        }
    }

    static TokenValidationResult valid(AuthenticatedPrincipal principal) {
        return new Valid(principal);
    }

    static TokenValidationResult rejected(AuthFailureKind kind, String message) {
        return new Rejected(new AuthFailure(kind, message));
    }

    default boolean isValid() {
        return this instanceof Valid;
    }

    /**
     * Returns the principal or throws the exception matching the failure.
     *
     * @throws AuthenticationException (or {@link AuthorizationException}) when rejected
     */
    default AuthenticatedPrincipal orElseThrow() {
        if (this instanceof Valid valid) {
            return valid.principal();
        }
        throw ((Rejected) this).failure().toException();
    }
}
