package com.syro.core.execution;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable result of one invocation attempt.
 *
 * @param guildId      {@code null} for direct messages
 * @param commandName  primary name, or the identifier as typed for unknown commands
 * @param denialReason set only for {@link ExecutionOutcome#DENIED}
 * @param detail       permission reason, remaining cooldown or fault message
 */
public record ExecutionRecord(UUID executionId,
                              Instant timestamp,
                              String actorId,
                              String guildId,
                              String commandName,
                              ExecutionOutcome outcome,
                              DenialReason denialReason,
                              String detail,
                              long durationMs) {

    /**
     * {@code success}, {@code denied:<Reason>} or {@code fault}.
     */
    public String outcomeLabel() {
        switch (outcome) {
            case SUCCEEDED:
                return "success";
            case DENIED:
                return "denied:" + (denialReason == null ? "Unknown" : denialReason.getLabel());
            default:
                return "fault";
        }
    }
}
