package com.syro.services.database;

import com.syro.core.permission.RoleOverride;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store used when the database is disabled and in tests.
 */
public class InMemoryGuildSettingsStore implements GuildSettingsStore {
    private final Map<String, String> prefixes = new ConcurrentHashMap<>();
    // guild -> command -> role -> override
    private final Map<String, Map<String, Map<String, RoleOverride>>> overrides = new ConcurrentHashMap<>();

    @Override
    public GuildSettings load(String guildId) {
        Map<String, Map<String, RoleOverride>> copy = new HashMap<>();
        Map<String, Map<String, RoleOverride>> guild = overrides.get(guildId);
        if (guild != null) {
            guild.forEach((cmd, roles) -> copy.put(cmd, new HashMap<>(roles)));
        }
        return new GuildSettings(prefixes.get(guildId), copy);
    }

    @Override
    public void saveRolePermission(String guildId, String commandName, String roleId, RoleOverride override) {
        overrides.computeIfAbsent(guildId, g -> new ConcurrentHashMap<>())
                .computeIfAbsent(commandName, c -> new ConcurrentHashMap<>())
                .put(roleId, override);
    }

    @Override
    public boolean deleteRolePermission(String guildId, String commandName, String roleId) {
        Map<String, Map<String, RoleOverride>> guild = overrides.get(guildId);
        if (guild == null) return false;
        Map<String, RoleOverride> roles = guild.get(commandName);
        return roles != null && roles.remove(roleId) != null;
    }

    @Override
    public void savePrefix(String guildId, String prefix) {
        if (prefix == null) prefixes.remove(guildId);
        else prefixes.put(guildId, prefix);
    }

    @Override
    public void deleteGuild(String guildId) {
        prefixes.remove(guildId);
        overrides.remove(guildId);
    }
}
