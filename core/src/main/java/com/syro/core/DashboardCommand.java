package com.syro.core;

import com.syro.api.Capability;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * One command as shown on the guild dashboard.
 *
 * @param roleOverrides role id → allowed, for the requested guild
 */
public record DashboardCommand(String name,
                               Set<String> aliases,
                               String description,
                               String usage,
                               String category,
                               Set<Capability> requiredCapabilities,
                               long cooldownMs,
                               boolean guildOnly,
                               Map<String, Boolean> roleOverrides,
                               long usageCount,
                               Instant lastUsed) {
}
