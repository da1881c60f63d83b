package com.syro.core.execution;

public enum ExecutionOutcome {
    SUCCEEDED,
    DENIED,
    FAULTED
}
