package com.syro.core.execution;

/**
 * Lifecycle of one invocation attempt. There is no retry: every attempt ends
 * in exactly one terminal state.
 */
public enum ExecutionState {
    RESOLVING,
    PERMISSION_CHECK,
    COOLDOWN_CHECK,
    RUNNING,
    SUCCEEDED,
    DENIED,
    FAULTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == DENIED || this == FAULTED;
    }
}
