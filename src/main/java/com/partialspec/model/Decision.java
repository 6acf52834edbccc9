package com.partialspec.model;

/**
 * One entry of the decision log.
 *
 * @param key    The operation that was evaluated.
 * @param type   What was decided.
 * @param reason Why, in a short phrase.
 */
public record Decision(OperationKey key, DecisionType type, String reason) {

    public String toLogLine() {
        return type + " " + key + ": " + reason;
    }
}
