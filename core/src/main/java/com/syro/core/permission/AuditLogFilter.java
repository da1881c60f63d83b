package com.syro.core.permission;

/**
 * Criteria for {@link PermissionManager#getAuditLog(AuditLogFilter)}. Unset fields match everything.
 */
public class AuditLogFilter {
    private String guildId;
    private String commandName;
    private AuditAction action;
    private String actorId;
    private int limit;

    public static AuditLogFilter all() {
        return new AuditLogFilter();
    }

    public AuditLogFilter guild(String guildId) {
        this.guildId = guildId;
        return this;
    }

    public AuditLogFilter command(String commandName) {
        this.commandName = commandName;
        return this;
    }

    public AuditLogFilter action(AuditAction action) {
        this.action = action;
        return this;
    }

    public AuditLogFilter actor(String actorId) {
        this.actorId = actorId;
        return this;
    }

    /**
     * Keep only the newest {@code limit} matches, 0 for no limit.
     */
    public AuditLogFilter limit(int limit) {
        this.limit = limit;
        return this;
    }

    public int getLimit() {
        return limit;
    }

    boolean matches(AuditLogEntry e) {
        return (guildId == null || guildId.equals(e.guildId()))
                && (commandName == null || commandName.equalsIgnoreCase(e.commandName()))
                && (action == null || action == e.action())
                && (actorId == null || actorId.equals(e.actorId()));
    }
}
