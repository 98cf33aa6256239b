package com.devgate.security;

import java.net.URI;

/**
 * Thrown when the identity provider's metadata or signing-key document cannot be fetched
 * or parsed.
 * <p>
 * At startup this aborts readiness. During a live validation it is converted into a rejected
 * {@link TokenValidationResult} and never reaches the request path as an exception.
 */
public class UpstreamFetchException extends RuntimeException {

    private final URI uri;

    public UpstreamFetchException(URI uri, String message) {
        super(message);
        this.uri = uri;
    }

    public UpstreamFetchException(URI uri, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    /** The document location that failed. */
    public URI uri() {
        return uri;
    }
}
