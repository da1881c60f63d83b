package com.syro.services.database;

import com.syro.core.permission.RoleOverride;

/**
 * Durable per-guild settings: permission overrides and the command prefix.
 * Implementations throw {@link GuildStoreException} on storage failures.
 */
public interface GuildSettingsStore {

    /**
     * @return the guild's settings, {@link GuildSettings#empty()} for unknown guilds
     */
    GuildSettings load(String guildId);

    void saveRolePermission(String guildId, String commandName, String roleId, RoleOverride override);

    /**
     * @return true if an override was deleted
     */
    boolean deleteRolePermission(String guildId, String commandName, String roleId);

    /**
     * @param prefix new prefix, {@code null} to fall back to the default
     */
    void savePrefix(String guildId, String prefix);

    void deleteGuild(String guildId);

    default void close() {
    }
}
