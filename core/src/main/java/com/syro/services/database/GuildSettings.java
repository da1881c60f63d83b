package com.syro.services.database;

import com.syro.core.permission.RoleOverride;

import java.util.Map;

/**
 * Persisted state of one guild.
 *
 * @param prefix    configured prefix, {@code null} when the guild uses the default
 * @param overrides command name → role id → override
 */
public record GuildSettings(String prefix, Map<String, Map<String, RoleOverride>> overrides) {

    public static GuildSettings empty() {
        return new GuildSettings(null, Map.of());
    }
}
