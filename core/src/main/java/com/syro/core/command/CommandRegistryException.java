package com.syro.core.command;

/**
 * Base type for registry contract violations.
 */
public class CommandRegistryException extends RuntimeException {
    public CommandRegistryException(String message) {
        super(message);
    }
}
