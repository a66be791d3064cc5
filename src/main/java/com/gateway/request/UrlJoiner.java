package com.gateway.request;

/**
 * Joins a base address and a relative address. The path of the base is kept and exactly one
 * {@code /} separates the two parts, so {@code http://host/v1} and {@code /pets} give
 * {@code http://host/v1/pets}.
 */
public final class UrlJoiner {

    private UrlJoiner() {
    }

    public static String join(String base, String relative) {
        if (base == null || base.isEmpty()) {
            return relative;
        }
        String trimmedBase = base;
        while (trimmedBase.endsWith("/")) {
            trimmedBase = trimmedBase.substring(0, trimmedBase.length() - 1);
        }
        if (relative == null || relative.isEmpty()) {
            return trimmedBase;
        }
        int start = 0;
        while (start < relative.length() && relative.charAt(start) == '/') {
            start++;
        }
        return trimmedBase + "/" + relative.substring(start);
    }
}
