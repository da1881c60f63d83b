package com.syro.test;

import com.syro.core.permission.RoleOverride;
import com.syro.services.database.GuildSettings;
import com.syro.services.database.GuildStoreException;
import com.syro.services.database.InMemoryGuildSettingsStore;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory store that can be switched into a failing mode, or made to run
 * an action right before its next permission write reaches storage.
 */
public class FailingGuildSettingsStore extends InMemoryGuildSettingsStore {
    private volatile boolean failing;
    private final AtomicReference<Runnable> beforeNextWrite = new AtomicReference<>();

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public void beforeNextWrite(Runnable action) {
        beforeNextWrite.set(action);
    }

    private void runHook() {
        Runnable action = beforeNextWrite.getAndSet(null);
        if (action != null) action.run();
    }

    private void check(String what) {
        if (failing) throw new GuildStoreException("Failed to " + what, new SQLException("connection refused"));
    }

    @Override
    public GuildSettings load(String guildId) {
        check("load " + guildId);
        return super.load(guildId);
    }

    @Override
    public void saveRolePermission(String guildId, String commandName, String roleId, RoleOverride override) {
        check("save permission");
        runHook();
        super.saveRolePermission(guildId, commandName, roleId, override);
    }

    @Override
    public boolean deleteRolePermission(String guildId, String commandName, String roleId) {
        check("delete permission");
        runHook();
        return super.deleteRolePermission(guildId, commandName, roleId);
    }

    @Override
    public void savePrefix(String guildId, String prefix) {
        check("save prefix");
        super.savePrefix(guildId, prefix);
    }
}
