package com.partialspec.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Output of the spec assembler: the filtered {@code paths} mapping and the decisions
 * that produced it, in evaluation order.
 */
public record AssembledPaths(ObjectNode paths, List<Decision> decisions) {

    public AssembledPaths {
        decisions = List.copyOf(decisions);
    }
}
