package com.syro.core.permission;

public enum AuditAction {
    SET,
    REMOVE
}
