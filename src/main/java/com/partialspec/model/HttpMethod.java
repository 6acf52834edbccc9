package com.partialspec.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The eight HTTP verbs an OpenAPI path item may declare operations for.
 * Declaration order is the order operations are listed in within a path.
 */
public enum HttpMethod {
    GET, PUT, POST, DELETE, PATCH, OPTIONS, HEAD, TRACE;

    /**
     * Maps a path item field name (e.g. {@code "get"} or {@code "PATCH"}) to a verb.
     *
     * @param token The field name found under a path item.
     * @return The matching verb, or an empty Optional for non-operation fields such as
     *         {@code parameters} or {@code summary}.
     */
    public static Optional<HttpMethod> fromToken(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        String upper = token.toUpperCase(Locale.ROOT);
        for (HttpMethod method : values()) {
            if (method.name().equals(upper)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
