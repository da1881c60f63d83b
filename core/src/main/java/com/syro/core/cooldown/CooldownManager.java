package com.syro.core.cooldown;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-user and per-command rate limits.
 * <p>
 * An entry is active while {@code now < expiry}. Expired entries are dropped
 * lazily when they are next looked at; a size cap bounds the maps in between.
 * {@link #checkAndStart} runs under a per-command monitor so two concurrent
 * invocations of the same command cannot both pass.
 */
public class CooldownManager {
    private static final Logger logger = LoggerFactory.getLogger(CooldownManager.class);

    private record Key(String userId, String command) {
    }

    private record Candidate(Key user, String command, long expiry) {
    }

    private final Clock clock;
    private final int maxEntries;

    // expiry timestamps in epoch millis
    private final Map<Key, Long> userExpiry = new ConcurrentHashMap<>();
    private final Map<String, Long> globalExpiry = new ConcurrentHashMap<>();
    // administrative duration overrides
    private final Map<Key, Long> userDurations = new ConcurrentHashMap<>();
    private final Map<String, Long> globalDurations = new ConcurrentHashMap<>();

    private final Map<String, Object> commandLocks = new ConcurrentHashMap<>();
    private final Object evictionLock = new Object();

    private final LongAdder checks = new LongAdder();
    private final LongAdder allowed = new LongAdder();
    private final LongAdder deniedUser = new LongAdder();
    private final LongAdder deniedGlobal = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public CooldownManager(int maxEntries, Clock clock) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be positive");
        this.maxEntries = maxEntries;
        this.clock = clock;
        logger.info("⏰ Cooldown Manager ready (max {} entries)", maxEntries);
    }

    /**
     * Atomic check-then-set. When neither the user's nor the command's global
     * cooldown is active, starts both (where their duration is positive) and
     * allows; otherwise reports the remaining wait of the blocking one.
     */
    public CooldownResult checkAndStart(String userId, String commandName, long baseCooldownMs) {
        String cmd = normalize(commandName);
        Key key = new Key(userId, cmd);
        checks.increment();

        CooldownResult result;
        synchronized (lockFor(cmd)) {
            long now = clock.millis();

            Long global = globalExpiry.get(cmd);
            if (global != null) {
                if (now < global) {
                    deniedGlobal.increment();
                    return CooldownResult.denied(global - now, CooldownScope.GLOBAL);
                }
                globalExpiry.remove(cmd, global);
            }

            Long user = userExpiry.get(key);
            if (user != null) {
                if (now < user) {
                    deniedUser.increment();
                    return CooldownResult.denied(user - now, CooldownScope.USER);
                }
                userExpiry.remove(key, user);
            }

            long userMs = userDurations.getOrDefault(key, Math.max(0, baseCooldownMs));
            long globalMs = globalDurations.getOrDefault(cmd, 0L);
            if (userMs > 0) userExpiry.put(key, now + userMs);
            if (globalMs > 0) globalExpiry.put(cmd, now + globalMs);
            result = CooldownResult.ALLOWED;
        }
        allowed.increment();

        if (userExpiry.size() + globalExpiry.size() > maxEntries) {
            evictOverflow();
        }
        return result;
    }

    /**
     * Overrides the cooldown duration of one user for one command, taking effect
     * on the next successful check. 0 exempts the user.
     */
    public void setCooldown(String userId, String commandName, long durationMs) {
        if (durationMs < 0) throw new IllegalArgumentException("durationMs must be >= 0");
        userDurations.put(new Key(userId, normalize(commandName)), durationMs);
        logger.debug("⏰ Cooldown override: {} -> {} ({}ms)", userId, commandName, durationMs);
    }

    /**
     * Sets the command-wide cooldown started by every successful invocation.
     * 0 removes it.
     */
    public void setGlobalCooldown(String commandName, long durationMs) {
        if (durationMs < 0) throw new IllegalArgumentException("durationMs must be >= 0");
        String cmd = normalize(commandName);
        if (durationMs == 0) {
            globalDurations.remove(cmd);
            globalExpiry.remove(cmd);
        } else {
            globalDurations.put(cmd, durationMs);
        }
        logger.info("⏰ Global cooldown set: {} ({}ms)", cmd, durationMs);
    }

    /**
     * @return the longest active cooldown blocking this user on this command, or {@code null}
     */
    public CooldownInfo getCooldown(String userId, String commandName) {
        String cmd = normalize(commandName);
        long now = clock.millis();
        CooldownInfo best = null;

        Long user = userExpiry.get(new Key(userId, cmd));
        if (user != null && now < user) {
            best = new CooldownInfo(userId, cmd, CooldownScope.USER, Instant.ofEpochMilli(user), user - now);
        }
        Long global = globalExpiry.get(cmd);
        if (global != null && now < global && (best == null || global - now > best.remainingMs())) {
            best = new CooldownInfo(userId, cmd, CooldownScope.GLOBAL, Instant.ofEpochMilli(global), global - now);
        }
        return best;
    }

    /**
     * @return true if an active or expired entry was dropped
     */
    public boolean removeCooldown(String userId, String commandName) {
        boolean removed = userExpiry.remove(new Key(userId, normalize(commandName))) != null;
        if (removed) logger.debug("⏰ Cooldown removed: {} -> {}", userId, commandName);
        return removed;
    }

    /**
     * Active per-user cooldowns of one user, keyed by command name.
     */
    public Map<String, CooldownInfo> getUserCooldowns(String userId) {
        long now = clock.millis();
        Map<String, CooldownInfo> out = new LinkedHashMap<>();
        userExpiry.forEach((key, expiry) -> {
            if (key.userId().equals(userId) && now < expiry) {
                out.put(key.command(), new CooldownInfo(userId, key.command(), CooldownScope.USER,
                        Instant.ofEpochMilli(expiry), expiry - now));
            }
        });
        return out;
    }

    /**
     * @return number of entries dropped
     */
    public int clearUserCooldowns(String userId) {
        int[] n = {0};
        userExpiry.keySet().removeIf(k -> {
            boolean match = k.userId().equals(userId);
            if (match) n[0]++;
            return match;
        });
        return n[0];
    }

    /**
     * Drops every running cooldown. Duration overrides are configuration and stay.
     */
    public void clearAll() {
        int n = userExpiry.size() + globalExpiry.size();
        userExpiry.clear();
        globalExpiry.clear();
        logger.info("🧹 Cleared {} cooldown entries", n);
    }

    public CooldownStats getStats() {
        return new CooldownStats(checks.sum(), allowed.sum(), deniedUser.sum(), deniedGlobal.sum(),
                userExpiry.size(), globalExpiry.size(), userDurations.size(), globalDurations.size(),
                evictions.sum(), maxEntries);
    }

    public int getTrackedEntries() {
        return userExpiry.size() + globalExpiry.size();
    }

    /**
     * Shrinks the maps to 90% of the cap: expired entries go first, then the
     * active ones closest to expiry. Removal is conditional on the expiry still
     * being the one we sorted on, so a concurrent restart of a cooldown wins.
     */
    private void evictOverflow() {
        synchronized (evictionLock) {
            int total = userExpiry.size() + globalExpiry.size();
            if (total <= maxEntries) return;
            int target = Math.max(1, maxEntries - maxEntries / 10);

            List<Candidate> candidates = new ArrayList<>(total);
            userExpiry.forEach((k, v) -> candidates.add(new Candidate(k, null, v)));
            globalExpiry.forEach((k, v) -> candidates.add(new Candidate(null, k, v)));
            candidates.sort(Comparator.comparingLong(Candidate::expiry));

            int removed = 0;
            for (Candidate c : candidates) {
                if (total - removed <= target) break;
                boolean gone = c.user() != null
                        ? userExpiry.remove(c.user(), c.expiry())
                        : globalExpiry.remove(c.command(), c.expiry());
                if (gone) removed++;
            }
            evictions.add(removed);
            logger.debug("⏰ Evicted {} cooldown entries (cap {})", removed, maxEntries);
        }
    }

    private Object lockFor(String cmd) {
        return commandLocks.computeIfAbsent(cmd, c -> new Object());
    }

    private static String normalize(String commandName) {
        return commandName.toLowerCase(Locale.ROOT);
    }
}
