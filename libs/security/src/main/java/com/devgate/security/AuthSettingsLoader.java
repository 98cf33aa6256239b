package com.devgate.security;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads {@link AuthSettings} from environment-style variables.
 * <p>
 * The lookup function is pluggable so the gateway can read through Spring's
 * {@code Environment} (OS environment, system properties and YAML) and tests can pass a plain
 * map. Every failure names the variable to fix.
 */
public final class AuthSettingsLoader {

    public static final String TENANT_ID = "DEVUI_AZURE_AD_TENANT_ID";
    public static final String ALLOWED_AUDIENCES = "DEVUI_AZURE_AD_ALLOWED_AUDIENCES";
    public static final String REQUIRED_SCOPES = "DEVUI_AZURE_AD_REQUIRED_SCOPES";
    public static final String REQUIRED_APP_ROLES = "DEVUI_AZURE_AD_REQUIRED_APP_ROLES";
    public static final String AUTHORITY_HOST = "DEVUI_AZURE_AD_AUTHORITY_HOST";
    public static final String KEY_CACHE_TTL = "DEVUI_AZURE_AD_JWKS_CACHE_TTL";
    public static final String CLOCK_SKEW = "DEVUI_AZURE_AD_CLOCK_SKEW";

    private static final Pattern AUDIENCE_SEPARATORS = Pattern.compile("[,;]");
    private static final Pattern LIST_SEPARATORS = Pattern.compile("[,;\\s]+");

    private AuthSettingsLoader() {
        // utility class
    }

    /**
     * Loads settings from the process environment.
     */
    public static AuthSettings fromSystemEnvironment() {
        return load(System::getenv);
    }

    /**
     * Loads settings from a map of variables.
     */
    public static AuthSettings fromMap(Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables");
        return load(variables::get);
    }

    /**
     * Loads settings through the given variable lookup.
     *
     * @throws ConfigurationException if a required variable is missing or a value is invalid
     */
    public static AuthSettings load(Function<String, String> lookup) {
        String tenantId = trimToNull(lookup.apply(TENANT_ID));
        if (tenantId == null) {
            throw new ConfigurationException(TENANT_ID + " is not configured on the server.");
        }

        String rawAudiences = trimToNull(lookup.apply(ALLOWED_AUDIENCES));
        if (rawAudiences == null) {
            throw new ConfigurationException(ALLOWED_AUDIENCES + " is not configured on the server.");
        }
        Set<String> audiences = split(rawAudiences, AUDIENCE_SEPARATORS);
        if (audiences.isEmpty()) {
            throw new ConfigurationException(ALLOWED_AUDIENCES + " must contain at least one audience value.");
        }

        Set<String> requiredScopes = parseList(lookup.apply(REQUIRED_SCOPES));
        Set<String> requiredRoles = parseList(lookup.apply(REQUIRED_APP_ROLES));

        String authorityHost = trimToNull(lookup.apply(AUTHORITY_HOST));
        long cacheTtl = parseSeconds(lookup.apply(KEY_CACHE_TTL), KEY_CACHE_TTL, AuthSettings.DEFAULT_KEY_CACHE_TTL_SECONDS);
        long clockSkew = parseSeconds(lookup.apply(CLOCK_SKEW), CLOCK_SKEW, AuthSettings.DEFAULT_CLOCK_SKEW_SECONDS);

        return new AuthSettings(
                tenantId,
                audiences,
                requiredScopes,
                requiredRoles,
                authorityHost == null ? AuthSettings.DEFAULT_AUTHORITY_HOST : authorityHost,
                cacheTtl,
                clockSkew);
    }

    /**
     * Splits a comma, semicolon or whitespace separated list, collapsing repeated separators.
     */
    static Set<String> parseList(String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return Set.of();
        }
        return split(value, LIST_SEPARATORS);
    }

    private static Set<String> split(String value, Pattern separators) {
        return Arrays.stream(separators.split(value))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static long parseSeconds(String raw, String variable, long defaultValue) {
        String value = trimToNull(raw);
        if (value == null) {
            return defaultValue;
        }
        long seconds;
        try {
            seconds = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(variable + " must be a whole number of seconds, got '" + value + "'.", e);
        }
        if (seconds < 0) {
            throw new ConfigurationException(variable + " must not be negative, got " + seconds + ".");
        }
        return seconds;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
