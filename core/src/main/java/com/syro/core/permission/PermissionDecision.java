package com.syro.core.permission;

/**
 * @param roleId role whose override decided the outcome, {@code null} otherwise
 */
public record PermissionDecision(boolean allowed, PermissionReason reason, String roleId) {

    static PermissionDecision allow(PermissionReason reason) {
        return new PermissionDecision(true, reason, null);
    }

    static PermissionDecision deny(PermissionReason reason) {
        return new PermissionDecision(false, reason, null);
    }
}
