package com.syro.core.cooldown;

import java.time.Instant;

/**
 * An active cooldown as seen at query time.
 */
public record CooldownInfo(String userId, String commandName, CooldownScope scope,
                           Instant expiresAt, long remainingMs) {
}
