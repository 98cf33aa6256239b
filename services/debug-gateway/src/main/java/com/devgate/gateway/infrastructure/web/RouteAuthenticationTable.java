package com.devgate.gateway.infrastructure.web;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

/**
 * Declares which requests must carry a bearer token.
 *
 * <p>Built once when the web layer is configured. A request needs authentication when it is not
 * a pre-flight {@code OPTIONS}, matches no anonymous route, and its path equals a protected
 * prefix or starts with the prefix followed by {@code /}. Everything else passes through
 * without touching the token validator.
 *
 * <p>Paths are expected in the decoded, parameter-free form that handler mapping uses (see
 * {@code AuthenticationFilter.pathWithinApplication}).
 *
 * <pre>
 * RouteAuthenticationTable.builder()
 *     .protectedPrefix("/v1")
 *     .allowAnonymous("/health")
 *     .build();
 * </pre>
 */
public final class RouteAuthenticationTable {

    private static final PathPatternParser PARSER = new PathPatternParser();

    private final List<String> protectedPrefixes;
    private final List<AnonymousRoute> anonymousRoutes;

    private RouteAuthenticationTable(List<String> protectedPrefixes, List<AnonymousRoute> anonymousRoutes) {
        this.protectedPrefixes = Collections.unmodifiableList(protectedPrefixes);
        this.anonymousRoutes = Collections.unmodifiableList(anonymousRoutes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean requiresAuthentication(String method, String path) {
        if ("OPTIONS".equalsIgnoreCase(method)) {
            return false;
        }
        String normalized = path == null || path.isEmpty() ? "/" : path;
        if (isAnonymous(method, normalized)) {
            return false;
        }
        return isProtected(normalized);
    }

    boolean isProtected(String path) {
        for (String prefix : protectedPrefixes) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    boolean isAnonymous(String method, String path) {
        PathContainer container = PathContainer.parsePath(path);
        for (AnonymousRoute route : anonymousRoutes) {
            if (route.matches(method, container)) {
                return true;
            }
        }
        return false;
    }

    public List<String> protectedPrefixes() {
        return protectedPrefixes;
    }

    private record AnonymousRoute(String method, PathPattern pattern) {

        boolean matches(String requestMethod, PathContainer path) {
            boolean methodMatches = method == null || method.equalsIgnoreCase(requestMethod);
            return methodMatches && pattern.matches(path);
        }
    }

    public static final class Builder {

        private final List<String> protectedPrefixes = new ArrayList<>();
        private final List<AnonymousRoute> anonymousRoutes = new ArrayList<>();

        private Builder() {}

        /**
         * Protects {@code prefix} and everything below it. A trailing slash is ignored.
         */
        public Builder protectedPrefix(String prefix) {
            if (prefix == null || !prefix.startsWith("/")) {
                throw new IllegalArgumentException("protected prefix must start with '/': " + prefix);
            }
            String normalized = prefix;
            while (normalized.length() > 1 && normalized.endsWith("/")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            protectedPrefixes.add(normalized);
            return this;
        }

        /** Lets any method reach paths matching {@code pattern} without a token. */
        public Builder allowAnonymous(String pattern) {
            return allowAnonymous(null, pattern);
        }

        /**
         * Lets {@code method} (any method when null) reach paths matching the Spring
         * {@link PathPattern} {@code pattern} without a token.
         */
        public Builder allowAnonymous(String method, String pattern) {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("anonymous route pattern must not be blank");
            }
            String upper = method == null ? null : method.toUpperCase(Locale.ROOT);
            anonymousRoutes.add(new AnonymousRoute(upper, PARSER.parse(pattern)));
            return this;
        }

        public RouteAuthenticationTable build() {
            return new RouteAuthenticationTable(new ArrayList<>(protectedPrefixes), new ArrayList<>(anonymousRoutes));
        }
    }
}
