package com.syro.services.database;

import com.syro.core.permission.RoleOverride;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link GuildSettingsStore} on top of the embedded H2 database.
 */
public class JdbiGuildSettingsStore implements GuildSettingsStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbiGuildSettingsStore.class);

    private final DatabaseService database;
    private final Jdbi jdbi;

    public JdbiGuildSettingsStore(DatabaseService database) {
        this.database = database;
        this.jdbi = database.getJdbi();
    }

    @Override
    public GuildSettings load(String guildId) {
        try {
            return jdbi.withHandle(handle -> {
                String prefix = handle.createQuery("SELECT prefix FROM guild_settings WHERE guild_id = ?")
                        .bind(0, guildId)
                        .mapTo(String.class)
                        .findOne()
                        .orElse(null);

                Map<String, Map<String, RoleOverride>> overrides = new HashMap<>();
                handle.createQuery("""
                            SELECT command_name, role_id, allowed, set_by, set_at
                            FROM command_permissions WHERE guild_id = ?
                        """)
                        .bind(0, guildId)
                        .map((rs, ctx) -> {
                            Timestamp ts = rs.getTimestamp("set_at");
                            RoleOverride o = new RoleOverride(rs.getBoolean("allowed"), rs.getString("set_by"),
                                    ts == null ? null : ts.toInstant());
                            overrides.computeIfAbsent(rs.getString("command_name"), c -> new HashMap<>())
                                    .put(rs.getString("role_id"), o);
                            return o;
                        })
                        .list();

                return new GuildSettings(prefix, overrides);
            });
        } catch (JdbiException e) {
            throw failure("load settings of guild " + guildId, e);
        }
    }

    @Override
    public void saveRolePermission(String guildId, String commandName, String roleId, RoleOverride override) {
        try {
            jdbi.useHandle(handle -> handle.createUpdate("""
                        MERGE INTO command_permissions (guild_id, command_name, role_id, allowed, set_by, set_at)
                        KEY(guild_id, command_name, role_id)
                        VALUES (?, ?, ?, ?, ?, ?)
                    """)
                    .bind(0, guildId)
                    .bind(1, commandName)
                    .bind(2, roleId)
                    .bind(3, override.allowed())
                    .bind(4, override.setBy())
                    .bind(5, toTimestamp(override.setAt()))
                    .execute());
        } catch (JdbiException e) {
            throw failure("save permission " + guildId + "/" + commandName + "/" + roleId, e);
        }
    }

    @Override
    public boolean deleteRolePermission(String guildId, String commandName, String roleId) {
        try {
            int rows = jdbi.withHandle(handle -> handle.createUpdate("""
                        DELETE FROM command_permissions
                        WHERE guild_id = ? AND command_name = ? AND role_id = ?
                    """)
                    .bind(0, guildId)
                    .bind(1, commandName)
                    .bind(2, roleId)
                    .execute());
            return rows > 0;
        } catch (JdbiException e) {
            throw failure("delete permission " + guildId + "/" + commandName + "/" + roleId, e);
        }
    }

    @Override
    public void savePrefix(String guildId, String prefix) {
        try {
            jdbi.useHandle(handle -> handle.createUpdate("""
                        MERGE INTO guild_settings (guild_id, prefix, updated_at)
                        KEY(guild_id)
                        VALUES (?, ?, CURRENT_TIMESTAMP)
                    """)
                    .bind(0, guildId)
                    .bind(1, prefix)
                    .execute());
        } catch (JdbiException e) {
            throw failure("save prefix of guild " + guildId, e);
        }
    }

    @Override
    public void deleteGuild(String guildId) {
        try {
            jdbi.useTransaction(handle -> {
                handle.execute("DELETE FROM command_permissions WHERE guild_id = ?", guildId);
                handle.execute("DELETE FROM guild_settings WHERE guild_id = ?", guildId);
            });
            logger.info("🧹 Guild data deleted: {}", guildId);
        } catch (JdbiException e) {
            throw failure("delete guild " + guildId, e);
        }
    }

    @Override
    public void close() {
        database.shutdown();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static GuildStoreException failure(String what, JdbiException e) {
        logger.error("❌ Guild store failed to {}: {}", what, e.getMessage());
        return new GuildStoreException("Failed to " + what, e);
    }
}
