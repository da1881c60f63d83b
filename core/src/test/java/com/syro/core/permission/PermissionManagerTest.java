package com.syro.core.permission;

import com.syro.api.Capability;
import com.syro.test.FailingGuildSettingsStore;
import com.syro.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PermissionManager
 */
class PermissionManagerTest extends TestBase {

    private static final String GUILD = "guild-1";
    private static final Set<Capability> MODERATE = EnumSet.of(Capability.MODERATE);

    private FailingGuildSettingsStore store;
    private PermissionManager permissions;

    @BeforeEach
    void createManager() {
        store = new FailingGuildSettingsStore();
        permissions = new PermissionManager(store, 100, clock);
    }

    @Test
    void testDenyOverrideWinsOverAllowOverride() {
        permissions.setRolePermission(GUILD, "purge", "helpers", true);
        permissions.setRolePermission(GUILD, "purge", "muted", false);

        PermissionDecision decision = permissions.isAllowed(GUILD, "purge", MODERATE,
                List.of("helpers", "muted"), Set.of());

        assertFalse(decision.allowed(), "An explicit deny must beat an explicit allow");
        assertEquals(PermissionReason.ROLE_OVERRIDE_DENY, decision.reason());
        assertEquals("muted", decision.roleId());

        // order of roles must not matter
        assertFalse(permissions.isAllowed(GUILD, "purge", MODERATE, List.of("muted", "helpers"), Set.of()).allowed());
    }

    @Test
    void testAdministratorAlwaysAllowed() {
        permissions.setRolePermission(GUILD, "nuke", "admins", false);

        PermissionDecision decision = permissions.isAllowed(GUILD, "nuke", EnumSet.of(Capability.ADMINISTER),
                List.of("admins"), EnumSet.of(Capability.ADMINISTER));

        assertTrue(decision.allowed());
        assertEquals(PermissionReason.ADMINISTRATOR, decision.reason());
    }

    @Test
    void testAllowOverrideGrantsMissingCapability() {
        assertFalse(permissions.isAllowed(GUILD, "purge", MODERATE, List.of("helpers"), Set.of()).allowed());

        permissions.setRolePermission(GUILD, "purge", "helpers", true);
        PermissionDecision decision = permissions.isAllowed(GUILD, "purge", MODERATE, List.of("helpers"), Set.of());

        assertTrue(decision.allowed());
        assertEquals(PermissionReason.ROLE_OVERRIDE_ALLOW, decision.reason());
    }

    @Test
    void testFallsBackToDefaultRequirement() {
        PermissionDecision missing = permissions.isAllowed(GUILD, "purge", MODERATE, List.of("anyone"), Set.of());
        assertEquals(PermissionReason.MISSING_CAPABILITY, missing.reason());

        PermissionDecision met = permissions.isAllowed(GUILD, "purge", MODERATE, List.of(), MODERATE);
        assertTrue(met.allowed());
        assertEquals(PermissionReason.DEFAULT_REQUIREMENT_MET, met.reason());

        assertTrue(permissions.isAllowed(GUILD, "ping", Set.of(), List.of(), Set.of()).allowed(),
                "Empty requirement admits everyone");
    }

    @Test
    void testUnknownRolesAndCommandsProduceNoOverride() {
        permissions.setRolePermission(GUILD, "purge", "helpers", true);

        PermissionDecision decision = permissions.isAllowed(GUILD, "does-not-exist", Set.of(),
                List.of("unknown-role"), Set.of());
        assertTrue(decision.allowed());
        assertEquals(PermissionReason.DEFAULT_REQUIREMENT_MET, decision.reason());
    }

    @Test
    void testDirectMessagesIgnoreOverrides() {
        permissions.setRolePermission(GUILD, "purge", "helpers", true);

        PermissionDecision decision = permissions.isAllowed(null, "purge", MODERATE, List.of("helpers"), Set.of());
        assertFalse(decision.allowed());
        assertEquals(PermissionReason.MISSING_CAPABILITY, decision.reason());
    }

    @Test
    void testStoreFailureDeniesFailClosed() {
        store.setFailing(true);

        PermissionDecision decision = permissions.isAllowed(GUILD, "ping", Set.of(), List.of("member"), Set.of());

        assertFalse(decision.allowed(), "Missing override information must never grant access");
        assertEquals(PermissionReason.STORE_UNAVAILABLE, decision.reason());
        assertTrue(permissions.isDegraded());

        store.setFailing(false);
        assertTrue(permissions.isAllowed(GUILD, "ping", Set.of(), List.of("member"), Set.of()).allowed());
        assertFalse(permissions.isDegraded(), "Recovered after a successful load");
    }

    @Test
    void testCachedOverridesSurviveStoreOutage() {
        permissions.setRolePermission(GUILD, "purge", "helpers", true);
        store.setFailing(true);

        assertTrue(permissions.isAllowed(GUILD, "purge", MODERATE, List.of("helpers"), Set.of()).allowed(),
                "Hot path is served from the cache");
    }

    @Test
    void testEveryMutationIsAudited() {
        permissions.setRolePermission(GUILD, "purge", "helpers", true, "owner");
        permissions.setRolePermission(GUILD, "purge", "helpers", true, "owner");
        permissions.removeRolePermission(GUILD, "purge", "helpers", "owner");
        permissions.removeRolePermission(GUILD, "purge", "helpers", "owner");
        store.setFailing(true);
        permissions.invalidateGuild(GUILD);
        assertFalse(permissions.setRolePermission(GUILD, "purge", "helpers", false, "owner"));

        List<AuditLogEntry> log = permissions.getAuditLog(AuditLogFilter.all());
        assertEquals(5, log.size(), "Every call is audited regardless of outcome");

        assertEquals(AuditAction.SET, log.get(0).action());
        assertTrue(log.get(0).applied());
        assertEquals(Boolean.TRUE, log.get(0).resultingAllowed());
        assertEquals("owner", log.get(0).actorId());

        assertEquals("unchanged", log.get(1).detail(), "Repeating a set is a no-op but still audited");
        assertTrue(log.get(2).applied());
        assertNull(log.get(2).resultingAllowed());
        assertFalse(log.get(3).applied(), "Removing a missing override changes nothing");
        assertFalse(log.get(4).applied());
        assertNotNull(log.get(4).detail());
    }

    @Test
    void testAuditLogFilterAndCapacity() {
        PermissionManager small = new PermissionManager(store, 3, clock);
        for (int i = 0; i < 5; i++) {
            small.setRolePermission(GUILD, "cmd" + i, "role", true);
        }
        small.setRolePermission("other", "cmd0", "role", true);

        assertEquals(3, small.getAuditLog(AuditLogFilter.all()).size(), "Audit log is bounded");
        assertEquals(1, small.getAuditLog(AuditLogFilter.all().guild("other")).size());
        assertEquals(1, small.getAuditLog(AuditLogFilter.all().guild(GUILD).limit(1)).size());
        assertEquals("cmd4", small.getAuditLog(AuditLogFilter.all().guild(GUILD).limit(1)).get(0).commandName());

        small.clearAuditLog();
        assertTrue(small.getAuditLog(null).isEmpty());
    }

    @Test
    void testGuildPermissionsSnapshotIsReadOnly() {
        permissions.setRolePermission(GUILD, "purge", "helpers", true);
        permissions.setRolePermission(GUILD, "ban", "muted", false);

        Map<String, Map<String, RoleOverride>> snapshot = permissions.getGuildPermissions(GUILD);
        assertEquals(2, snapshot.size());
        assertTrue(snapshot.get("purge").get("helpers").allowed());
        assertFalse(snapshot.get("ban").get("muted").allowed());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove("purge"));

        permissions.removeRolePermission(GUILD, "ban", "muted");
        assertEquals(2, snapshot.size(), "Snapshot does not follow later changes");
        assertEquals(1, permissions.getGuildPermissions(GUILD).size());
    }

    @Test
    void testOverridesAreWrittenThroughToStore() {
        permissions.setRolePermission(GUILD, "Purge", "helpers", false);

        assertFalse(store.load(GUILD).overrides().get("purge").get("helpers").allowed());

        PermissionManager fresh = new PermissionManager(store, 10, clock);
        assertFalse(fresh.isAllowed(GUILD, "purge", Set.of(), List.of("helpers"), Set.of()).allowed(),
                "A new manager reads the persisted override");
    }

    @Test
    void testReloadDuringWriteDoesNotHideNewDeny() {
        // another thread invalidates and re-reads the guild while the write is in flight
        store.beforeNextWrite(() -> {
            permissions.invalidateGuild(GUILD);
            assertTrue(permissions.isAllowed(GUILD, "ping", Set.of(), List.of("muted"), Set.of()).allowed());
        });

        assertTrue(permissions.setRolePermission(GUILD, "ping", "muted", false));

        PermissionDecision decision = permissions.isAllowed(GUILD, "ping", Set.of(), List.of("muted"), Set.of());
        assertFalse(decision.allowed(), "The deny that reached the store must be enforced");
        assertEquals(PermissionReason.ROLE_OVERRIDE_DENY, decision.reason());
        assertFalse(permissions.getGuildPermissions(GUILD).get("ping").get("muted").allowed());
    }

    @Test
    void testReloadDuringRemoveDoesNotResurrectOverride() {
        permissions.setRolePermission(GUILD, "ping", "muted", false);
        store.beforeNextWrite(() -> {
            permissions.invalidateGuild(GUILD);
            assertFalse(permissions.isAllowed(GUILD, "ping", Set.of(), List.of("muted"), Set.of()).allowed());
        });

        assertTrue(permissions.removeRolePermission(GUILD, "ping", "muted"));

        assertTrue(permissions.isAllowed(GUILD, "ping", Set.of(), List.of("muted"), Set.of()).allowed(),
                "A removed override must not linger in the cache");
        assertTrue(permissions.getGuildPermissions(GUILD).isEmpty());
    }

    @Test
    void testConcurrentMutationsChecksAndInvalidationsStayConsistent() throws Exception {
        int threads = 12;
        int rounds = 200;
        permissions = new PermissionManager(store, 10_000, clock);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);

        for (int i = 0; i < threads; i++) {
            int worker = i;
            pool.submit(() -> {
                ready.countDown();
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int n = 0; n < rounds; n++) {
                    switch (worker % 4) {
                        case 0:
                            permissions.setRolePermission(GUILD, "ping", "muted", n % 2 == 0);
                            break;
                        case 1:
                            permissions.removeRolePermission(GUILD, "ping", "muted");
                            break;
                        case 2:
                            permissions.invalidateGuild(GUILD);
                            break;
                        default:
                            permissions.isAllowed(GUILD, "ping", Set.of(), List.of("muted"), Set.of());
                    }
                }
            });
        }

        assertTrue(ready.await(5, TimeUnit.SECONDS));
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        Map<String, RoleOverride> stored = store.load(GUILD).overrides().get("ping");
        RoleOverride persisted = stored == null ? null : stored.get("muted");
        boolean expected = persisted == null || persisted.allowed();

        assertEquals(expected,
                permissions.isAllowed(GUILD, "ping", Set.of(), List.of("muted"), Set.of()).allowed(),
                "Cached decision must match the store");
        Map<String, RoleOverride> cached = permissions.getGuildPermissions(GUILD).get("ping");
        assertEquals(persisted, cached == null ? null : cached.get("muted"));
        assertEquals(threads / 4 * rounds * 2, permissions.getAuditLog(AuditLogFilter.all().limit(0)).size(),
                "Every mutation is audited");
    }

    @Test
    void testInvalidArgumentsRejected() {
        assertFalse(permissions.setRolePermission(" ", "purge", "helpers", true));
        assertFalse(permissions.removeRolePermission(GUILD, null, "helpers"));
        assertEquals(2, permissions.getAuditLog(null).size());
    }

    @Test
    void testStats() {
        permissions.isAllowed(GUILD, "ping", Set.of(), List.of(), Set.of());
        permissions.isAllowed(GUILD, "purge", MODERATE, List.of(), Set.of());

        PermissionStats stats = permissions.getStats();
        assertEquals(2, stats.totalChecks());
        assertEquals(1, stats.granted());
        assertEquals(1, stats.denied());
        assertEquals(1L, stats.byReason().get(PermissionReason.MISSING_CAPABILITY));
    }
}
