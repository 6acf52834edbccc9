package com.partialspec.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.partialspec.model.ClosureResult;

/**
 * Computes the minimal component table needed by a set of paths.
 */
public interface ComponentClosureResolver {

    /**
     * Follows references breadth-first from {@code paths} through the after document's
     * component table and copies exactly the reachable definitions.
     *
     * @param paths The assembled paths mapping.
     * @param after The document whose {@code components} supply the definitions.
     * @return The component table plus the references that could not be resolved.
     */
    ClosureResult resolve(JsonNode paths, JsonNode after);
}
