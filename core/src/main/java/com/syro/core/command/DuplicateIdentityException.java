package com.syro.core.command;

/**
 * A name or alias is already taken by another command.
 */
public class DuplicateIdentityException extends CommandRegistryException {
    private final String identifier;
    private final String existingCommand;

    public DuplicateIdentityException(String identifier, String existingCommand) {
        super("Identifier '" + identifier + "' is already used by command '" + existingCommand + "'");
        this.identifier = identifier;
        this.existingCommand = existingCommand;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getExistingCommand() {
        return existingCommand;
    }
}
