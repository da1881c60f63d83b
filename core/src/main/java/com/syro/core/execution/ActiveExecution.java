package com.syro.core.execution;

import java.time.Instant;
import java.util.UUID;

/**
 * An invocation that has not reached a terminal state yet.
 */
public class ActiveExecution {
    private final UUID executionId;
    private final String invokedAs;
    private final String actorId;
    private final String guildId;
    private final Instant startedAt;
    private volatile String commandName;
    private volatile ExecutionState state = ExecutionState.RESOLVING;

    ActiveExecution(UUID executionId, String invokedAs, String actorId, String guildId, Instant startedAt) {
        this.executionId = executionId;
        this.invokedAs = invokedAs;
        this.actorId = actorId;
        this.guildId = guildId;
        this.startedAt = startedAt;
        this.commandName = invokedAs;
    }

    void advance(ExecutionState next) {
        this.state = next;
    }

    void resolvedTo(String name) {
        this.commandName = name;
    }

    public UUID getExecutionId() { return executionId; }
    public String getInvokedAs() { return invokedAs; }
    public String getCommandName() { return commandName; }
    public String getActorId() { return actorId; }
    public String getGuildId() { return guildId; }
    public Instant getStartedAt() { return startedAt; }
    public ExecutionState getState() { return state; }

    @Override
    public String toString() {
        return "ActiveExecution{" + executionId + ", " + commandName + ", " + state + "}";
    }
}
