package com.devgate.security;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the credential out of an {@code Authorization: Bearer <token>} header.
 * <p>
 * The scheme is case-insensitive and must be followed by whitespace; {@code "Bearerabc"} is not
 * a bearer header. The credential is everything after the separator, trimmed, and may not
 * itself contain whitespace.
 */
public final class BearerTokenExtractor {

    static final String MISSING_HEADER_MESSAGE = "Authorization header missing.";
    static final String BEARER_REQUIRED_MESSAGE = "Bearer token required.";

    private static final Pattern HEADER = Pattern.compile("^(\\S+)\\s+(\\S+)$");

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader the raw header value, may be null
     * @return the token, or empty when the header is absent, uses another scheme or is malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        Matcher matcher = HEADER.matcher(authorizationHeader.strip());
        if (!matcher.matches() || !"bearer".equals(matcher.group(1).toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(2));
    }

    /**
     * Like {@link #extract(String)}, but says why there is no token.
     *
     * @throws AuthenticationException {@link AuthFailureKind#MISSING_AUTHORIZATION} when the header
     *                                 is absent or blank, {@link AuthFailureKind#INVALID_AUTHORIZATION_SCHEME}
     *                                 when it is not a usable bearer header
     */
    public static String require(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new AuthFailure(AuthFailureKind.MISSING_AUTHORIZATION, MISSING_HEADER_MESSAGE).toException();
        }
        return extract(authorizationHeader).orElseThrow(() ->
                new AuthFailure(AuthFailureKind.INVALID_AUTHORIZATION_SCHEME, BEARER_REQUIRED_MESSAGE).toException());
    }
}
