package com.syro.api;

import java.util.List;
import java.util.function.Consumer;

/**
 * Everything a handler gets to see about one invocation.
 */
public final class CommandContext {
    private final String executionId;
    private final String commandName;
    private final String invokedAs;
    private final String prefix;
    private final String argumentText;
    private final List<String> args;
    private final InboundMessage message;
    private final Consumer<String> replier;

    public CommandContext(String executionId, String commandName, String invokedAs, String prefix,
                          String argumentText, List<String> args, InboundMessage message,
                          Consumer<String> replier) {
        this.executionId = executionId;
        this.commandName = commandName;
        this.invokedAs = invokedAs;
        this.prefix = prefix;
        this.argumentText = argumentText == null ? "" : argumentText;
        this.args = args == null ? List.of() : List.copyOf(args);
        this.message = message;
        this.replier = replier;
    }

    public String getExecutionId() { return executionId; }

    /** Primary name of the resolved command. */
    public String getCommandName() { return commandName; }

    /** Identifier as typed by the user, may be an alias. */
    public String getInvokedAs() { return invokedAs; }

    public String getPrefix() { return prefix; }
    public String getArgumentText() { return argumentText; }
    public List<String> getArgs() { return args; }
    public InboundMessage getMessage() { return message; }
    public String getActorId() { return message.actorId(); }
    public String getGuildId() { return message.guildId(); }

    public String arg(int index, String def) {
        return index < args.size() ? args.get(index) : def;
    }

    public void reply(String text) {
        if (replier != null) replier.accept(text);
    }
}
