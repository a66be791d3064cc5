package com.gateway.cli;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses repeated {@code name=value} shell arguments.
 */
final class KeyValueOptions {

    private KeyValueOptions() {
    }

    static Map<String, String> parse(String[] pairs) {
        Map<String, String> values = new LinkedHashMap<>();
        if (pairs == null) {
            return values;
        }
        for (String pair : pairs) {
            if (pair == null || pair.isBlank()) {
                continue;
            }
            int separator = pair.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Expected name=value but got '" + pair + "'");
            }
            values.put(pair.substring(0, separator).trim(), pair.substring(separator + 1));
        }
        return values;
    }
}
