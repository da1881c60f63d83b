package com.syro.core.command;

public class CommandNotFoundException extends CommandRegistryException {
    private final String identifier;

    public CommandNotFoundException(String identifier) {
        super("Command not found: " + identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
