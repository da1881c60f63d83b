package com.syro.core.permission;

/**
 * Why a permission decision came out the way it did.
 */
public enum PermissionReason {
    ADMINISTRATOR,
    ROLE_OVERRIDE_ALLOW,
    ROLE_OVERRIDE_DENY,
    DEFAULT_REQUIREMENT_MET,
    MISSING_CAPABILITY,
    /** Overrides could not be loaded; denied fail-closed. */
    STORE_UNAVAILABLE
}
