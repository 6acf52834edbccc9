package com.partialspec.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.partialspec.model.AffectedOperations;

/**
 * Finds every operation that changed between two versions of a document.
 */
public interface ChangeDetector {

    /**
     * Runs both detection phases and returns their union.
     * <ol>
     *   <li>Diff-driven: maps every entity location in the diff artifact to its owning operation.</li>
     *   <li>Exhaustive: compares every operation of {@code after} with its counterpart in {@code before};
     *       new operations and any structural difference are flagged.</li>
     * </ol>
     *
     * @param diff   The diff artifact; {@code null} or a missing node contributes nothing.
     * @param before The previous version.
     * @param after  The new version.
     * @return The affected operations with the sources that flagged them.
     */
    AffectedOperations detect(JsonNode diff, JsonNode before, JsonNode after);
}
