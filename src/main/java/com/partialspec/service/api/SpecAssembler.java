package com.partialspec.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.partialspec.model.AffectedOperations;
import com.partialspec.model.AssembledPaths;
import com.partialspec.model.Baseline;

/**
 * Decides, per operation key, what goes into the partial spec and copies it from the after document.
 */
public interface SpecAssembler {

    /**
     * Evaluates every affected key against the baseline and builds the filtered {@code paths}
     * mapping. Included operations are deep copies of their after-document bodies; references
     * inside them are kept as references.
     *
     * @param affected The detected operations.
     * @param baseline The legacy operations.
     * @param after    The new version of the document.
     * @return The filtered paths and the decision log.
     */
    AssembledPaths assemble(AffectedOperations affected, Baseline baseline, JsonNode after);
}
