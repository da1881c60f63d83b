package com.syro.api;

/**
 * Business logic of a single command. Anything implementing this can be
 * registered through a {@link com.syro.core.command.CommandDescriptor}.
 * Implementations may throw; the executor isolates the failure.
 */
@FunctionalInterface
public interface CommandHandler {
    CommandResult run(CommandContext context) throws Exception;
}
