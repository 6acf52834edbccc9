package com.partialspec.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything one generator run produces.
 *
 * @param document             The minimal partial spec.
 * @param affected             The operations either detection phase flagged.
 * @param decisions            The decision log, one entry per affected operation.
 * @param unresolvedReferences References left dangling in the document.
 * @param warnings             Non-fatal conditions the caller should surface.
 */
public record PartialSpecResult(ObjectNode document,
                                AffectedOperations affected,
                                List<Decision> decisions,
                                List<String> unresolvedReferences,
                                List<String> warnings) {

    public PartialSpecResult {
        decisions = List.copyOf(decisions);
        unresolvedReferences = List.copyOf(unresolvedReferences);
        warnings = List.copyOf(warnings);
    }

    public List<Decision> decisionsOf(DecisionType type) {
        return decisions.stream().filter(d -> d.type() == type).collect(Collectors.toList());
    }
}
