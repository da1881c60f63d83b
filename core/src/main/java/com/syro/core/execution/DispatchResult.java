package com.syro.core.execution;

import com.syro.api.CommandResult;
import com.syro.core.cooldown.CooldownResult;
import com.syro.core.permission.PermissionDecision;

/**
 * What happened to one inbound message.
 *
 * @param handled    false when the message was not a command (no prefix match)
 * @param permission set once the permission check ran
 * @param cooldown   set once the cooldown check ran
 * @param result     handler result, set only when the handler returned normally
 */
public record DispatchResult(boolean handled,
                             ExecutionRecord record,
                             PermissionDecision permission,
                             CooldownResult cooldown,
                             CommandResult result) {

    private static final DispatchResult IGNORED = new DispatchResult(false, null, null, null, null);

    public static DispatchResult ignored() {
        return IGNORED;
    }

    public ExecutionOutcome outcome() {
        return record == null ? null : record.outcome();
    }

    public DenialReason denialReason() {
        return record == null ? null : record.denialReason();
    }
}
