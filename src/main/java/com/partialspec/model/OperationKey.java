package com.partialspec.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * The canonical identity of an API operation: an HTTP verb plus the exact path key
 * under which it is declared.
 * <p>
 * Paths are compared byte-for-byte, including {@code {param}} placeholders; trailing
 * slashes are not normalised. Every inclusion decision is made per key, never per path,
 * so a new verb on a legacy path is judged on its own.
 *
 * @param method The HTTP verb.
 * @param path   The path as it appears in the document's {@code paths} mapping.
 */
public record OperationKey(HttpMethod method, String path) implements Comparable<OperationKey> {

    private static final Comparator<OperationKey> ORDER = Comparator
            .comparing(OperationKey::path)
            .thenComparing(OperationKey::method);

    public OperationKey {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
    }

    /**
     * Creates a key from a raw verb token, upper-casing it.
     *
     * @throws IllegalArgumentException if the token is not one of the eight recognised verbs.
     */
    public static OperationKey of(String method, String path) {
        HttpMethod httpMethod = HttpMethod.fromToken(method)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported HTTP method: " + method));
        return new OperationKey(httpMethod, path);
    }

    /**
     * Parses the textual form produced by {@link #toString()}, e.g. {@code GET@/pet/{petId}}.
     */
    public static OperationKey parse(String text) {
        int separator = text == null ? -1 : text.indexOf('@');
        if (separator <= 0) {
            throw new IllegalArgumentException("Not an operation key: " + text);
        }
        return of(text.substring(0, separator), text.substring(separator + 1));
    }

    @Override
    public int compareTo(OperationKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return method.name() + "@" + path;
    }
}
