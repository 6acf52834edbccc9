package com.partialspec.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * The minimal component table reachable from the assembled paths.
 *
 * @param components           The {@code components} mapping to emit; always holds a {@code schemas} entry.
 * @param unresolvedReferences References that could not be resolved against the after document,
 *                             in discovery order.
 */
public record ClosureResult(ObjectNode components, List<String> unresolvedReferences) {

    public ClosureResult {
        unresolvedReferences = List.copyOf(unresolvedReferences);
    }
}
