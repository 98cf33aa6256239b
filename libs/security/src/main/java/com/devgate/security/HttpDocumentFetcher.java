package com.devgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link DocumentFetcher} backed by the JDK HTTP client with a fixed timeout.
 */
public final class HttpDocumentFetcher implements DocumentFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpDocumentFetcher.class);

    /** Timeout applied to connecting and to the whole request. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;
    private final Duration timeout;

    public HttpDocumentFetcher() {
        this(DEFAULT_TIMEOUT);
    }

    public HttpDocumentFetcher(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String fetch(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        log.debug("Fetching {}", uri);
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.error("Timed out fetching {} after {}", uri, timeout);
            throw new UpstreamFetchException(uri, "Timed out fetching authentication metadata from " + uri, e);
        } catch (IOException e) {
            log.error("Network error fetching {}: {}", uri, e.toString());
            throw new UpstreamFetchException(uri, "Unable to reach authentication metadata endpoint " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException(uri, "Interrupted while fetching " + uri, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.error("HTTP {} fetching {}", status, uri);
            throw new UpstreamFetchException(uri, "Failed to fetch authentication metadata from " + uri + ": HTTP " + status);
        }
        return response.body();
    }
}
