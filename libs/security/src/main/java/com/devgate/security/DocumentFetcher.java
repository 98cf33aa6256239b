package com.devgate.security;

import java.net.URI;

/**
 * Fetches a JSON document from the identity provider.
 */
@FunctionalInterface
public interface DocumentFetcher {

    /**
     * Returns the response body of a successful GET.
     *
     * @throws UpstreamFetchException on network failure, timeout or a non-2xx status
     */
    String fetch(URI uri);
}
