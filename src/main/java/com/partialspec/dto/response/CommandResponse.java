package com.partialspec.dto.response;

/**
 * The outcome of a shell command, rendered as a single colored status line.
 *
 * @param success Whether the command succeeded.
 * @param message What happened.
 */
public record CommandResponse(boolean success, String message) {

    /**
     * @return The message in green on success, red on failure.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
