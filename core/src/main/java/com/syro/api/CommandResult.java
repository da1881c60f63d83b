package com.syro.api;

/**
 * What a handler reports back after running. A non-null message is sent to
 * the channel the command came from; a failure is recorded as a fault.
 */
public record CommandResult(boolean success, String message) {

    private static final CommandResult OK = new CommandResult(true, null);

    public static CommandResult ok() {
        return OK;
    }

    public static CommandResult ok(String message) {
        return new CommandResult(true, message);
    }

    public static CommandResult failure(String message) {
        return new CommandResult(false, message);
    }
}
