package com.partialspec.model;

/**
 * Outcome of evaluating one affected operation against the baseline.
 */
public enum DecisionType {
    /** Non-legacy operation present in the after document; copied into the partial spec. */
    INCLUDE,
    /** Legacy operation; its change surfaces only as a non-blocking finding downstream. */
    IGNORE,
    /** Legacy operation that no longer exists in the after document. */
    LEGACY_REMOVED,
    /** Non-legacy operation that no longer exists in the after document. */
    REMOVED
}
