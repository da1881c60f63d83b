package com.syro.core.execution;

import java.time.Instant;

/**
 * Criteria for {@link CommandExecutor#getExecutionHistory(ExecutionFilter)}.
 * Unset fields match everything; the time range is inclusive.
 */
public class ExecutionFilter {
    private String actorId;
    private String guildId;
    private String commandName;
    private ExecutionOutcome outcome;
    private DenialReason denialReason;
    private Instant from;
    private Instant to;
    private int limit;

    public static ExecutionFilter all() {
        return new ExecutionFilter();
    }

    public ExecutionFilter actor(String actorId) {
        this.actorId = actorId;
        return this;
    }

    public ExecutionFilter guild(String guildId) {
        this.guildId = guildId;
        return this;
    }

    public ExecutionFilter command(String commandName) {
        this.commandName = commandName;
        return this;
    }

    public ExecutionFilter outcome(ExecutionOutcome outcome) {
        this.outcome = outcome;
        return this;
    }

    public ExecutionFilter denialReason(DenialReason denialReason) {
        this.denialReason = denialReason;
        return this;
    }

    public ExecutionFilter between(Instant from, Instant to) {
        this.from = from;
        this.to = to;
        return this;
    }

    /**
     * Keep only the newest {@code limit} matches, 0 for no limit.
     */
    public ExecutionFilter limit(int limit) {
        this.limit = limit;
        return this;
    }

    public int getLimit() {
        return limit;
    }

    boolean matches(ExecutionRecord r) {
        return (actorId == null || actorId.equals(r.actorId()))
                && (guildId == null || guildId.equals(r.guildId()))
                && (commandName == null || commandName.equalsIgnoreCase(r.commandName()))
                && (outcome == null || outcome == r.outcome())
                && (denialReason == null || denialReason == r.denialReason())
                && (from == null || !r.timestamp().isBefore(from))
                && (to == null || !r.timestamp().isAfter(to));
    }
}
