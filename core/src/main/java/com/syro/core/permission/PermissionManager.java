package com.syro.core.permission;

import com.syro.api.Capability;
import com.syro.api.InboundMessage;
import com.syro.common.util.BoundedHistory;
import com.syro.core.command.CommandDescriptor;
import com.syro.services.database.GuildSettings;
import com.syro.services.database.GuildSettingsStore;
import com.syro.services.database.GuildStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

/**
 * Evaluates per-guild role overrides on top of a command's default capability
 * requirement, and owns the override cache and the mutation audit log.
 * <p>
 * Overrides are read through a per-guild cache filled from the
 * {@link GuildSettingsStore}; mutations write the store first and the cache
 * second while holding the guild's write lock. The admission path never takes
 * that lock.
 * <p>
 * A reload only publishes its snapshot if no mutation or invalidation
 * happened while it was reading the store, and mutations apply their change
 * to whichever snapshot is cached at that moment. Both steps go through
 * {@code guilds.compute}, so a write can never land in a snapshot that has
 * already been replaced.
 */
public class PermissionManager {
    private static final Logger logger = LoggerFactory.getLogger(PermissionManager.class);
    public static final String SYSTEM_ACTOR = "system";

    private final GuildSettingsStore store;
    private final Clock clock;
    private final Map<String, GuildOverrides> guilds = new ConcurrentHashMap<>();
    private final Map<String, Object> writeLocks = new ConcurrentHashMap<>();
    // bumped by every cache mutation and invalidation
    private final AtomicLong cacheEpoch = new AtomicLong();
    private final BoundedHistory<AuditLogEntry> auditLog;

    private final LongAdder checks = new LongAdder();
    private final LongAdder granted = new LongAdder();
    private final LongAdder denied = new LongAdder();
    private final LongAdder storeFailures = new LongAdder();
    private final Map<PermissionReason, LongAdder> byReason = new EnumMap<>(PermissionReason.class);
    private volatile boolean degraded = false;

    /** command name -> role id -> override, for one guild */
    private static final class GuildOverrides {
        final Map<String, Map<String, RoleOverride>> commands = new ConcurrentHashMap<>();

        GuildOverrides(GuildSettings settings) {
            settings.overrides().forEach((cmd, roles) -> {
                if (!roles.isEmpty()) {
                    commands.put(cmd.toLowerCase(Locale.ROOT), new ConcurrentHashMap<>(roles));
                }
            });
        }
    }

    public PermissionManager(GuildSettingsStore store, int auditCapacity, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.auditLog = new BoundedHistory<>(auditCapacity);
        for (PermissionReason r : PermissionReason.values()) byReason.put(r, new LongAdder());
        logger.info("🛡️ Permission Manager ready (audit capacity {})", auditCapacity);
    }

    /**
     * Decision for a message's author against a descriptor's default requirement.
     */
    public PermissionDecision isAllowed(CommandDescriptor descriptor, InboundMessage message) {
        return isAllowed(message.guildId(), descriptor.getName(), descriptor.getRequiredCapabilities(),
                message.actorRoleIds(), message.actorCapabilities());
    }

    /**
     * Admission decision. Order: administer capability, then role overrides
     * (any deny beats any allow), then the default requirement. Never throws;
     * a store failure yields a {@link PermissionReason#STORE_UNAVAILABLE} denial.
     *
     * @param guildId {@code null} for direct messages, which have no overrides
     */
    public PermissionDecision isAllowed(String guildId, String commandName, Set<Capability> requiredCapabilities,
                                        Collection<String> actorRoleIds, Set<Capability> actorCapabilities) {
        PermissionDecision decision = evaluate(guildId, commandName, requiredCapabilities, actorRoleIds,
                actorCapabilities);
        checks.increment();
        (decision.allowed() ? granted : denied).increment();
        byReason.get(decision.reason()).increment();
        return decision;
    }

    private PermissionDecision evaluate(String guildId, String commandName, Set<Capability> required,
                                        Collection<String> roleIds, Set<Capability> caps) {
        Set<Capability> actorCaps = caps == null ? Set.of() : caps;
        if (actorCaps.contains(Capability.ADMINISTER)) {
            return PermissionDecision.allow(PermissionReason.ADMINISTRATOR);
        }

        if (guildId != null && roleIds != null && !roleIds.isEmpty() && commandName != null) {
            GuildOverrides overrides;
            try {
                overrides = overridesFor(guildId);
            } catch (GuildStoreException e) {
                logger.warn("⚠️ Overrides of guild {} unavailable, denying {}: {}", guildId, commandName,
                        e.getMessage());
                return PermissionDecision.deny(PermissionReason.STORE_UNAVAILABLE);
            }

            Map<String, RoleOverride> roles = overrides.commands.get(commandName.toLowerCase(Locale.ROOT));
            if (roles != null && !roles.isEmpty()) {
                String allowingRole = null;
                for (String roleId : roleIds) {
                    RoleOverride o = roles.get(roleId);
                    if (o == null) continue;
                    if (!o.allowed()) {
                        return new PermissionDecision(false, PermissionReason.ROLE_OVERRIDE_DENY, roleId);
                    }
                    if (allowingRole == null) allowingRole = roleId;
                }
                if (allowingRole != null) {
                    return new PermissionDecision(true, PermissionReason.ROLE_OVERRIDE_ALLOW, allowingRole);
                }
            }
        }

        Set<Capability> needed = required == null ? Set.of() : required;
        return actorCaps.containsAll(needed)
                ? PermissionDecision.allow(PermissionReason.DEFAULT_REQUIREMENT_MET)
                : PermissionDecision.deny(PermissionReason.MISSING_CAPABILITY);
    }

    public boolean setRolePermission(String guildId, String commandName, String roleId, boolean allowed) {
        return setRolePermission(guildId, commandName, roleId, allowed, SYSTEM_ACTOR);
    }

    /**
     * Creates or replaces an override. Every call is audited, including
     * failed and no-op ones.
     *
     * @return false if the arguments are invalid or the store rejected the write
     */
    public boolean setRolePermission(String guildId, String commandName, String roleId, boolean allowed,
                                     String actorId) {
        String actor = actorId == null ? SYSTEM_ACTOR : actorId;
        if (isBlank(guildId) || isBlank(commandName) || isBlank(roleId)) {
            audit(AuditAction.SET, actor, guildId, commandName, roleId, null, false, "invalid arguments");
            return false;
        }
        String cmd = commandName.toLowerCase(Locale.ROOT);
        try {
            synchronized (writeLockFor(guildId)) {
                GuildOverrides overrides = overridesFor(guildId);
                Map<String, RoleOverride> roles = overrides.commands.get(cmd);
                RoleOverride existing = roles == null ? null : roles.get(roleId);
                if (existing != null && existing.allowed() == allowed) {
                    audit(AuditAction.SET, actor, guildId, cmd, roleId, allowed, true, "unchanged");
                    return true;
                }
                RoleOverride updated = new RoleOverride(allowed, actor, clock.instant());
                store.saveRolePermission(guildId, cmd, roleId, updated);
                applyToCache(guildId,
                        cached -> cached.commands.computeIfAbsent(cmd, c -> new ConcurrentHashMap<>())
                                .put(roleId, updated));
            }
            audit(AuditAction.SET, actor, guildId, cmd, roleId, allowed, true, null);
            logger.info("🔐 Permission set: guild={} command={} role={} allowed={} by {}",
                    guildId, cmd, roleId, allowed, actor);
            return true;
        } catch (GuildStoreException e) {
            RoleOverride still = currentOverride(guildId, cmd, roleId);
            audit(AuditAction.SET, actor, guildId, cmd, roleId, still == null ? null : still.allowed(), false,
                    e.getMessage());
            return false;
        }
    }

    public boolean removeRolePermission(String guildId, String commandName, String roleId) {
        return removeRolePermission(guildId, commandName, roleId, SYSTEM_ACTOR);
    }

    /**
     * @return true if an override existed and was removed
     */
    public boolean removeRolePermission(String guildId, String commandName, String roleId, String actorId) {
        String actor = actorId == null ? SYSTEM_ACTOR : actorId;
        if (isBlank(guildId) || isBlank(commandName) || isBlank(roleId)) {
            audit(AuditAction.REMOVE, actor, guildId, commandName, roleId, null, false, "invalid arguments");
            return false;
        }
        String cmd = commandName.toLowerCase(Locale.ROOT);
        try {
            boolean removed;
            synchronized (writeLockFor(guildId)) {
                GuildOverrides overrides = overridesFor(guildId);
                Map<String, RoleOverride> roles = overrides.commands.get(cmd);
                if (roles == null || !roles.containsKey(roleId)) {
                    audit(AuditAction.REMOVE, actor, guildId, cmd, roleId, null, false, "no override");
                    return false;
                }
                store.deleteRolePermission(guildId, cmd, roleId);
                applyToCache(guildId, cached -> {
                    Map<String, RoleOverride> cachedRoles = cached.commands.get(cmd);
                    if (cachedRoles == null) return;
                    cachedRoles.remove(roleId);
                    if (cachedRoles.isEmpty()) cached.commands.remove(cmd);
                });
                removed = true;
            }
            audit(AuditAction.REMOVE, actor, guildId, cmd, roleId, null, removed, null);
            logger.info("🔓 Permission removed: guild={} command={} role={} by {}", guildId, cmd, roleId, actor);
            return removed;
        } catch (GuildStoreException e) {
            RoleOverride still = currentOverride(guildId, cmd, roleId);
            audit(AuditAction.REMOVE, actor, guildId, cmd, roleId, still == null ? null : still.allowed(), false,
                    e.getMessage());
            return false;
        }
    }

    /**
     * Deep, read-only copy of a guild's overrides (command → role → override).
     * Empty when the guild has none or the store is unavailable.
     */
    public Map<String, Map<String, RoleOverride>> getGuildPermissions(String guildId) {
        if (guildId == null) return Map.of();
        try {
            GuildOverrides overrides = overridesFor(guildId);
            Map<String, Map<String, RoleOverride>> copy = new HashMap<>();
            overrides.commands.forEach((cmd, roles) -> {
                if (!roles.isEmpty()) copy.put(cmd, Collections.unmodifiableMap(new HashMap<>(roles)));
            });
            return Collections.unmodifiableMap(copy);
        } catch (GuildStoreException e) {
            logger.warn("⚠️ Cannot read permissions of guild {}: {}", guildId, e.getMessage());
            return Map.of();
        }
    }

    public List<AuditLogEntry> getAuditLog(AuditLogFilter filter) {
        AuditLogFilter f = filter == null ? AuditLogFilter.all() : filter;
        return auditLog.filter(f::matches, f.getLimit());
    }

    public void clearAuditLog() {
        auditLog.clear();
        logger.info("🧹 Permission audit log cleared");
    }

    /**
     * Drops the cached overrides of a guild; the next access reloads them.
     */
    public void invalidateGuild(String guildId) {
        if (guildId == null) return;
        GuildOverrides[] dropped = new GuildOverrides[1];
        guilds.compute(guildId, (id, cached) -> {
            cacheEpoch.incrementAndGet();
            dropped[0] = cached;
            return null;
        });
        if (dropped[0] != null) {
            logger.debug("Permission cache invalidated for guild {}", guildId);
        }
    }

    public boolean isDegraded() {
        return degraded;
    }

    public PermissionStats getStats() {
        Map<PermissionReason, Long> reasons = new LinkedHashMap<>();
        byReason.forEach((r, n) -> reasons.put(r, n.sum()));
        return new PermissionStats(checks.sum(), granted.sum(), denied.sum(), reasons, guilds.size(),
                auditLog.size(), storeFailures.sum(), degraded);
    }

    // --- internals ---

    private GuildOverrides overridesFor(String guildId) {
        GuildOverrides cached = guilds.get(guildId);
        if (cached != null) return cached;

        long epoch = cacheEpoch.get();
        GuildSettings settings;
        try {
            settings = store.load(guildId);
            degraded = false;
        } catch (GuildStoreException e) {
            storeFailures.increment();
            if (!degraded) logger.error("❌ Permission store unavailable, failing closed", e);
            degraded = true;
            throw e;
        }
        GuildOverrides loaded = new GuildOverrides(settings == null ? GuildSettings.empty() : settings);
        // a mutation or invalidation during the load may have made it stale: serve it once, don't cache it
        GuildOverrides published = guilds.compute(guildId, (id, current) -> {
            if (current != null) return current;
            return cacheEpoch.get() == epoch ? loaded : null;
        });
        return published != null ? published : loaded;
    }

    private Object writeLockFor(String guildId) {
        return writeLocks.computeIfAbsent(guildId, g -> new Object());
    }

    /**
     * Applies a change to the currently cached snapshot, if any. Without one,
     * the next load reads the already written store.
     */
    private void applyToCache(String guildId, Consumer<GuildOverrides> change) {
        guilds.compute(guildId, (id, cached) -> {
            cacheEpoch.incrementAndGet();
            if (cached != null) change.accept(cached);
            return cached;
        });
    }

    private RoleOverride currentOverride(String guildId, String cmd, String roleId) {
        GuildOverrides cached = guilds.get(guildId);
        if (cached == null) return null;
        Map<String, RoleOverride> roles = cached.commands.get(cmd);
        return roles == null ? null : roles.get(roleId);
    }

    private void audit(AuditAction action, String actor, String guildId, String cmd, String roleId,
                       Boolean resultingAllowed, boolean applied, String detail) {
        auditLog.add(new AuditLogEntry(clock.instant(), action, actor, guildId, cmd, roleId, resultingAllowed,
                applied, detail));
        if (!applied && detail != null && !"no override".equals(detail)) {
            logger.warn("⚠️ Permission {} failed: guild={} command={} role={}: {}", action, guildId, cmd, roleId,
                    detail);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
