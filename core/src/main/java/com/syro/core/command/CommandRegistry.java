package com.syro.core.command;

import com.syro.common.util.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Name/alias to descriptor mapping.
 * <p>
 * Readers work on an immutable snapshot published through a volatile field, so
 * {@link #resolve(String)} never waits for a registration. Writers are
 * serialized and swap in a fresh snapshot, which makes every mutation
 * all-or-nothing for readers.
 */
public class CommandRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CommandRegistry.class);
    private static final int CHANGE_HISTORY = 50;

    public enum ChangeType { REGISTER, UNREGISTER, ADD_ALIAS, REMOVE_ALIAS }

    public record Change(Instant timestamp, ChangeType type, String command, String detail) {
    }

    public record RegistryStats(int commands, int aliases, Map<String, Integer> byCategory,
                                long lookups, long misses, List<Change> recentChanges) {
    }

    private record Snapshot(Map<String, CommandDescriptor> byIdentifier,
                            Map<String, CommandDescriptor> byName) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());
    }

    private volatile Snapshot snapshot = Snapshot.EMPTY;
    private final Object writeLock = new Object();

    private final LongAdder lookups = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final BoundedHistory<Change> changes = new BoundedHistory<>(CHANGE_HISTORY);
    private final Clock clock;

    public CommandRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws DuplicateIdentityException if the name or an alias is already taken;
     *                                    the registry is left unchanged
     */
    public void register(CommandDescriptor descriptor) {
        synchronized (writeLock) {
            Snapshot current = snapshot;
            checkFree(current, descriptor.getName());
            for (String alias : descriptor.getAliases()) {
                checkFree(current, alias);
            }

            Map<String, CommandDescriptor> ids = new HashMap<>(current.byIdentifier());
            Map<String, CommandDescriptor> names = new LinkedHashMap<>(current.byName());
            putAll(ids, descriptor);
            names.put(descriptor.getName(), descriptor);
            publish(ids, names);
        }
        changes.add(new Change(clock.instant(), ChangeType.REGISTER, descriptor.getName(),
                "aliases=" + descriptor.getAliases()));
        logger.info("📝 Command registered: {} (aliases: {})", descriptor.getName(), descriptor.getAliases());
    }

    /**
     * Removes the command and all of its aliases.
     *
     * @return the removed descriptor
     * @throws CommandNotFoundException if no command has that name
     */
    public CommandDescriptor unregister(String name) {
        String key = key(name);
        CommandDescriptor removed;
        synchronized (writeLock) {
            Snapshot current = snapshot;
            removed = current.byName().get(key);
            if (removed == null) throw new CommandNotFoundException(name);

            Map<String, CommandDescriptor> ids = new HashMap<>(current.byIdentifier());
            Map<String, CommandDescriptor> names = new LinkedHashMap<>(current.byName());
            removeAll(ids, removed);
            names.remove(key);
            publish(ids, names);
        }
        changes.add(new Change(clock.instant(), ChangeType.UNREGISTER, removed.getName(), null));
        logger.info("🗑️ Command unregistered: {}", removed.getName());
        return removed;
    }

    /**
     * Case-insensitive lookup by name or alias.
     */
    public Optional<CommandDescriptor> resolve(String identifier) {
        lookups.increment();
        if (identifier == null) {
            misses.increment();
            return Optional.empty();
        }
        CommandDescriptor d = snapshot.byIdentifier().get(key(identifier));
        if (d == null) misses.increment();
        return Optional.ofNullable(d);
    }

    /**
     * Like {@link #resolve(String)} but throws for unknown identifiers.
     */
    public CommandDescriptor require(String identifier) {
        return resolve(identifier).orElseThrow(() -> new CommandNotFoundException(identifier));
    }

    public boolean has(String identifier) {
        return identifier != null && snapshot.byIdentifier().containsKey(key(identifier));
    }

    public List<CommandDescriptor> listByCategory(String category) {
        if (category == null) return List.of();
        String c = category.toLowerCase(Locale.ROOT);
        List<CommandDescriptor> out = new ArrayList<>();
        for (CommandDescriptor d : snapshot.byName().values()) {
            if (d.getCategory().equals(c)) out.add(d);
        }
        return out;
    }

    /**
     * All registered commands in registration order.
     */
    public List<CommandDescriptor> getAll() {
        return List.copyOf(snapshot.byName().values());
    }

    public Set<String> getAliases(String name) {
        CommandDescriptor d = snapshot.byName().get(key(name));
        return d == null ? Set.of() : d.getAliases();
    }

    /**
     * Adds an alias to a registered command. The descriptor is replaced by a
     * copy carrying the extra alias.
     */
    public void addAlias(String name, String alias) {
        String a = key(alias);
        synchronized (writeLock) {
            Snapshot current = snapshot;
            CommandDescriptor existing = current.byName().get(key(name));
            if (existing == null) throw new CommandNotFoundException(name);
            checkFree(current, a);

            CommandDescriptor updated = existing.toBuilder().alias(a).build();
            replace(current, existing, updated);
        }
        changes.add(new Change(clock.instant(), ChangeType.ADD_ALIAS, key(name), a));
        logger.info("🔗 Alias '{}' added to {}", a, name);
    }

    /**
     * @return false if the command exists but does not carry that alias
     */
    public boolean removeAlias(String name, String alias) {
        String a = key(alias);
        synchronized (writeLock) {
            Snapshot current = snapshot;
            CommandDescriptor existing = current.byName().get(key(name));
            if (existing == null) throw new CommandNotFoundException(name);
            if (!existing.getAliases().contains(a)) return false;

            replace(current, existing, existing.toBuilder().withoutAlias(a).build());
        }
        changes.add(new Change(clock.instant(), ChangeType.REMOVE_ALIAS, key(name), a));
        logger.info("✂️ Alias '{}' removed from {}", a, name);
        return true;
    }

    public int size() {
        return snapshot.byName().size();
    }

    public RegistryStats getStats() {
        Snapshot s = snapshot;
        Map<String, Integer> byCategory = new TreeMap<>();
        int aliasCount = 0;
        for (CommandDescriptor d : s.byName().values()) {
            byCategory.merge(d.getCategory(), 1, Integer::sum);
            aliasCount += d.getAliases().size();
        }
        return new RegistryStats(s.byName().size(), aliasCount, byCategory,
                lookups.sum(), misses.sum(), changes.snapshot());
    }

    // --- internals, callers hold writeLock ---

    private void replace(Snapshot current, CommandDescriptor old, CommandDescriptor updated) {
        Map<String, CommandDescriptor> ids = new HashMap<>(current.byIdentifier());
        Map<String, CommandDescriptor> names = new LinkedHashMap<>(current.byName());
        removeAll(ids, old);
        putAll(ids, updated);
        names.put(updated.getName(), updated);
        publish(ids, names);
    }

    private void publish(Map<String, CommandDescriptor> ids, Map<String, CommandDescriptor> names) {
        snapshot = new Snapshot(Collections.unmodifiableMap(ids), Collections.unmodifiableMap(names));
    }

    private static void putAll(Map<String, CommandDescriptor> ids, CommandDescriptor d) {
        ids.put(d.getName(), d);
        for (String alias : d.getAliases()) ids.put(alias, d);
    }

    private static void removeAll(Map<String, CommandDescriptor> ids, CommandDescriptor d) {
        ids.remove(d.getName());
        for (String alias : d.getAliases()) ids.remove(alias);
    }

    private static void checkFree(Snapshot s, String identifier) {
        CommandDescriptor owner = s.byIdentifier().get(identifier);
        if (owner != null) throw new DuplicateIdentityException(identifier, owner.getName());
    }

    private static String key(String identifier) {
        return identifier.strip().toLowerCase(Locale.ROOT);
    }
}
