package com.partialspec.model;

/**
 * Why the change detector flagged an operation.
 */
public enum DetectionSource {
    DIFF("structural diff"),
    NEW_OPERATION("new operation"),
    MODIFIED_OPERATION("modified operation");

    private final String description;

    DetectionSource(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
