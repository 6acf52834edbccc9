package com.partialspec.model;

/**
 * Counts of what the partial spec kept, for the caller's reporting.
 */
public record PartialSpecSummary(int pathsKept, int operationsKept, int schemasKept, int componentsKept) {

    @Override
    public String toString() {
        return "paths=" + pathsKept + ", operations=" + operationsKept
                + ", schemas=" + schemasKept + ", components=" + componentsKept;
    }
}
