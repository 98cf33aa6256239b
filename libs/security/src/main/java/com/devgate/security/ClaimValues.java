package com.devgate.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Helpers for reading loosely-typed token claims.
 */
final class ClaimValues {

    private ClaimValues() {
        // utility class
    }

    /**
     * Normalizes a multi-valued claim. Arrays keep their elements, strings are split on the
     * separator, anything else becomes a single value. Blank entries are dropped.
     */
    static Set<String> asSet(Object value, String separator) {
        Set<String> result = new LinkedHashSet<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString());
                }
            }
        } else if (value instanceof String text) {
            for (String segment : text.split(Pattern.quote(separator))) {
                if (!segment.isBlank()) {
                    result.add(segment.strip());
                }
            }
        } else {
            result.add(value.toString());
        }
        return result;
    }

    /**
     * Returns the first non-blank string claim among the given names.
     */
    static String firstString(Map<String, Object> claims, String... names) {
        for (String name : names) {
            Object value = claims.get(name);
            if (value instanceof String text && !text.isBlank()) {
                return text;
            }
        }
        return null;
    }
}
