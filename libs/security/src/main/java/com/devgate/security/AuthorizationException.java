package com.devgate.security;

/**
 * A valid token that is not allowed here: wrong tenant, or no required scope or role (HTTP 403).
 */
public class AuthorizationException extends AuthenticationException {

    public AuthorizationException(AuthFailure failure) {
        super(failure);
        if (!failure.kind().isAuthorizationFailure()) {
            throw new IllegalArgumentException("not an authorization failure: " + failure.kind());
        }
    }
}
