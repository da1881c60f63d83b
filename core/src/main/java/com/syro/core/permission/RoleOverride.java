package com.syro.core.permission;

import java.time.Instant;

/**
 * One per-guild, per-role exception to a command's default requirement.
 */
public record RoleOverride(boolean allowed, String setBy, Instant setAt) {
}
