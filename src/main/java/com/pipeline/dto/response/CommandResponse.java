package com.pipeline.dto.response;

/**
 * Outcome of a shell command, rendered green on success and red on failure.
 *
 * @param success whether the command did what was asked
 * @param message confirmation or error text shown to the user
 */
public record CommandResponse(boolean success, String message) {

    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
