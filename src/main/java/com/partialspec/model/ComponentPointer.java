package com.partialspec.model;

import java.util.Optional;

/**
 * A local reference into the component table, e.g. {@code #/components/schemas/Pet}.
 *
 * @param type The component type ({@code schemas}, {@code responses}, {@code parameters}, ...).
 * @param name The component name, with JSON pointer escapes decoded.
 */
public record ComponentPointer(String type, String name) {

    private static final String PREFIX = "#/components/";

    /**
     * Parses a reference string. Pointers deeper than the component itself
     * ({@code #/components/schemas/Pet/properties/id}) resolve to the owning component.
     *
     * @return The pointer, or an empty Optional for external or non-component references.
     */
    public static Optional<ComponentPointer> parse(String ref) {
        if (ref == null || !ref.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String[] parts = ref.substring(PREFIX.length()).split("/", -1);
        if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ComponentPointer(unescape(parts[0]), unescape(parts[1])));
    }

    private static String unescape(String token) {
        return token.replace("~1", "/").replace("~0", "~");
    }
}
