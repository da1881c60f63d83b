package com.syro.api;

import com.syro.core.CommandsSystem;
import com.syro.core.command.CommandDescriptor;

import java.util.List;

/**
 * A bundle of commands contributed to the dispatcher. Modules are asked for
 * their descriptors at start-up and again on every reload.
 */
public interface CommandModule {
    // Name of the module (e.g. "CoreCommands")
    String getName();

    String getVersion();

    List<CommandDescriptor> createCommands(CommandsSystem system);
}
