package com.devgate.observability;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials in claim maps and tool arguments before they reach a log line.
 *
 * <p>A value is masked when its key contains one of the configured fragments (case-insensitive),
 * or when the value itself looks like a compact JWT, whatever its key. Maps and lists are
 * walked recursively; the input is never modified.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    static final Set<String> DEFAULT_KEY_FRAGMENTS = Set.of(
            "token", "secret", "password", "authorization", "assertion", "credential", "apikey");

    /** header.payload.signature, each base64url; the header of a JSON JWT always starts with "eyJ". */
    private static final Pattern COMPACT_JWT = Pattern.compile("^eyJ[\\w-]*\\.[\\w-]+\\.[\\w-]*$");

    private final List<String> keyFragments;

    public SensitiveDataRedactor() {
        this(DEFAULT_KEY_FRAGMENTS);
    }

    public SensitiveDataRedactor(Collection<String> keyFragments) {
        if (keyFragments == null || keyFragments.isEmpty()) {
            throw new IllegalArgumentException("keyFragments must not be empty");
        }
        this.keyFragments = keyFragments.stream().map(f -> f.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * Copy of {@code data} with sensitive values replaced by {@value #REDACTED}. Null gives an
     * empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        data.forEach((key, value) -> copy.put(key, isSensitiveKey(key) ? REDACTED : redactValue(value)));
        return copy;
    }

    public boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return keyFragments.stream().anyMatch(lower::contains);
    }

    public static boolean looksLikeJwt(Object value) {
        return value instanceof String text && COMPACT_JWT.matcher(text).matches();
    }

    private Object redactValue(Object value) {
        if (looksLikeJwt(value)) {
            return REDACTED;
        }
        if (value instanceof Map<?, ?> nested) {
            Map<String, Object> keyed = new LinkedHashMap<>();
            nested.forEach((k, v) -> keyed.put(String.valueOf(k), v));
            return redact(keyed);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            items.forEach(item -> copy.add(redactValue(item)));
            return copy;
        }
        return value;
    }
}
