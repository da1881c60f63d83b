package com.syro.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.syro.api.CommandModule;
import com.syro.api.InboundMessage;
import com.syro.api.MessageSender;
import com.syro.core.command.CommandCategory;
import com.syro.core.command.CommandDescriptor;
import com.syro.core.command.CommandRegistry;
import com.syro.core.config.Configuration;
import com.syro.core.cooldown.CooldownInfo;
import com.syro.core.cooldown.CooldownManager;
import com.syro.core.execution.ActiveExecution;
import com.syro.core.execution.CommandExecutor;
import com.syro.core.execution.DispatchResult;
import com.syro.core.execution.ExecutionFilter;
import com.syro.core.execution.ExecutionRecord;
import com.syro.core.permission.AuditLogEntry;
import com.syro.core.permission.AuditLogFilter;
import com.syro.core.permission.PermissionManager;
import com.syro.core.permission.RoleOverride;
import com.syro.services.database.DatabaseService;
import com.syro.services.database.GuildSettingsStore;
import com.syro.services.database.InMemoryGuildSettingsStore;
import com.syro.services.database.JdbiGuildSettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for the chat listener and the dashboard backend. One instance
 * per process, constructed explicitly and driven through {@link #init()} and
 * {@link #shutdown()}. The lifecycle is one-shot: after shutdown a new
 * instance is needed.
 */
public class CommandsSystem {
    private static final Logger logger = LoggerFactory.getLogger(CommandsSystem.class);

    private final Configuration config;
    private final Clock clock;
    private final GuildSettingsStore store;

    private final CommandRegistry registry;
    private final PermissionManager permissions;
    private final CooldownManager cooldowns;
    private final CommandExecutor executor;
    private final CommandManager manager;

    private final List<CommandModule> modules = new CopyOnWriteArrayList<>();
    // module name -> names of the commands it registered
    private final Map<String, List<String>> moduleCommands = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    // the store is closed on shutdown, so an instance cannot be started twice
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ExecutorService workers;
    private volatile Instant startedAt;
    private final Gson gson;

    public CommandsSystem(Configuration config, GuildSettingsStore store, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.store = store;

        this.registry = new CommandRegistry(clock);
        this.permissions = new PermissionManager(store, config.auditLogCapacity, clock);
        this.cooldowns = new CooldownManager(config.maxCooldownEntries, clock);
        this.executor = new CommandExecutor(registry, permissions, cooldowns, config.executionHistoryCapacity, clock);
        this.manager = new CommandManager(config, registry, permissions, cooldowns, executor, store);

        this.gson = new GsonBuilder()
                .setPrettyPrinting()
                .serializeNulls()
                .registerTypeAdapter(Instant.class,
                        (JsonSerializer<Instant>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
                .create();
    }

    /**
     * Builds the system with the store selected by the configuration.
     */
    public static CommandsSystem create(Configuration config) {
        GuildSettingsStore store;
        if (config.databaseEnabled) {
            store = new JdbiGuildSettingsStore(DatabaseService.forPath(config.databasePath));
        } else {
            logger.warn("⚠️ Database disabled, guild settings are kept in memory only");
            store = new InMemoryGuildSettingsStore();
        }
        return new CommandsSystem(config, store, Clock.systemUTC());
    }

    // --- Lifecycle ---

    public void init() {
        if (stopped.get()) {
            throw new IllegalStateException("Commands System was shut down and cannot be restarted");
        }
        if (running.getAndSet(true))
            return;
        logger.info("⚛️ Commands System booting...");
        this.startedAt = clock.instant();

        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.workerThreads), r -> {
            Thread t = new Thread(r, "command-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        for (CommandModule module : modules) {
            loadModule(module);
        }
        logger.info("✅ Commands System active: {} commands, {} modules, {} workers", registry.size(),
                modules.size(), config.workerThreads);
    }

    public void shutdown() {
        if (!running.getAndSet(false))
            return;
        stopped.set(true);
        logger.info("🛑 Commands System shutting down...");
        ExecutorService pool = workers;
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        try {
            store.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing guild store: {}", e.getMessage());
        }
        logger.info("✅ Commands System stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    // --- Modules ---

    /**
     * Adds a module. Its commands are registered now if the system is running,
     * otherwise on {@link #init()}.
     */
    public void registerModule(CommandModule module) {
        modules.add(module);
        logger.info("🧩 Module registered: {} v{}", module.getName(), module.getVersion());
        if (running.get()) loadModule(module);
    }

    /**
     * Asks every module for fresh descriptors and swaps them in. Commands
     * registered directly stay untouched.
     */
    public synchronized boolean reloadCommands() {
        boolean ok = true;
        for (CommandModule module : modules) {
            ok &= loadModule(module);
        }
        logger.info("🔄 Commands reloaded: {} commands", registry.size());
        return ok;
    }

    private synchronized boolean loadModule(CommandModule module) {
        List<CommandDescriptor> descriptors;
        try {
            descriptors = module.createCommands(this);
        } catch (RuntimeException e) {
            logger.error("❌ Module {} failed to create its commands", module.getName(), e);
            return false;
        }
        List<String> previous = moduleCommands.getOrDefault(module.getName(), List.of());
        List<String> registered = manager.replaceCommands(previous, descriptors);
        moduleCommands.put(module.getName(), registered);
        return registered.size() == descriptors.size();
    }

    public List<CommandModule> getModules() {
        return List.copyOf(modules);
    }

    // --- Dispatch ---

    /**
     * Handles one inbound message on the calling thread.
     */
    public DispatchResult executeCommand(InboundMessage message) {
        if (!running.get()) {
            logger.warn("⚠️ Commands System not running, dropping message from {}", message.actorId());
            return DispatchResult.ignored();
        }
        return manager.handleMessage(message);
    }

    /**
     * Handles one inbound message on the worker pool.
     */
    public CompletableFuture<DispatchResult> executeCommandAsync(InboundMessage message) {
        ExecutorService pool = workers;
        if (!running.get() || pool == null) {
            return CompletableFuture.completedFuture(DispatchResult.ignored());
        }
        return CompletableFuture.supplyAsync(() -> manager.handleMessage(message), pool);
    }

    public void registerMessageSender(MessageSender sender) {
        manager.registerMessageSender(sender);
    }

    // --- Commands ---

    public boolean registerCommand(CommandDescriptor descriptor) {
        return manager.registerCommand(descriptor);
    }

    public boolean unregisterCommand(String name) {
        return manager.unregisterCommand(name);
    }

    public Optional<CommandDescriptor> getCommand(String identifier) {
        return registry.resolve(identifier);
    }

    public List<CommandDescriptor> getAllCommands() {
        return registry.getAll();
    }

    public List<CommandDescriptor> getCommandsByCategory(String category) {
        return manager.getCommandsByCategory(category);
    }

    public List<CommandCategory> getAllCategories() {
        return manager.getAllCategories();
    }

    // --- Prefixes ---

    public String getServerPrefix(String guildId) {
        return manager.getServerPrefix(guildId);
    }

    public boolean setServerPrefix(String guildId, String prefix) {
        return manager.setServerPrefix(guildId, prefix);
    }

    // --- Permissions ---

    public boolean setRolePermission(String guildId, String commandName, String roleId, boolean allowed) {
        return setRolePermission(guildId, commandName, roleId, allowed, PermissionManager.SYSTEM_ACTOR);
    }

    public boolean setRolePermission(String guildId, String commandName, String roleId, boolean allowed,
                                     String actorId) {
        return manager.setRolePermission(guildId, commandName, roleId, allowed, actorId);
    }

    public boolean removeRolePermission(String guildId, String commandName, String roleId) {
        return removeRolePermission(guildId, commandName, roleId, PermissionManager.SYSTEM_ACTOR);
    }

    public boolean removeRolePermission(String guildId, String commandName, String roleId, String actorId) {
        return manager.removeRolePermission(guildId, commandName, roleId, actorId);
    }

    public Map<String, Map<String, RoleOverride>> getGuildPermissions(String guildId) {
        return permissions.getGuildPermissions(guildId);
    }

    public List<AuditLogEntry> getPermissionAuditLog(AuditLogFilter filter) {
        return permissions.getAuditLog(filter);
    }

    // --- Cooldowns ---

    public boolean setCooldown(String userId, String commandName, long durationMs) {
        return manager.setCooldown(userId, commandName, durationMs);
    }

    public boolean setGlobalCooldown(String commandName, long durationMs) {
        return manager.setGlobalCooldown(commandName, durationMs);
    }

    public CooldownInfo getCooldown(String userId, String commandName) {
        if (userId == null || commandName == null) return null;
        String name = registry.resolve(commandName).map(CommandDescriptor::getName).orElse(commandName);
        return cooldowns.getCooldown(userId, name);
    }

    public Map<String, CooldownInfo> getUserCooldowns(String userId) {
        return cooldowns.getUserCooldowns(userId);
    }

    // --- Dashboard projections ---

    public List<DashboardCommand> getCommandsForDashboard(String guildId) {
        return manager.getCommandsForDashboard(guildId);
    }

    public List<ExecutionRecord> getExecutionHistory(ExecutionFilter filter) {
        return executor.getExecutionHistory(filter);
    }

    public List<ActiveExecution> getActiveExecutions() {
        return executor.getActiveExecutions();
    }

    public SystemStats getStats() {
        return new SystemStats(registry.getStats(), permissions.getStats(), cooldowns.getStats(),
                executor.getStats(), modules.size(), uptimeMs());
    }

    public String getStatsJson() {
        return gson.toJson(getStats());
    }

    public HealthStatus getHealthStatus() {
        boolean up = running.get();
        boolean degraded = permissions.isDegraded();

        Map<String, String> components = new LinkedHashMap<>();
        components.put("registry", "operational");
        components.put("permissions", degraded ? "degraded" : "operational");
        components.put("cooldowns", "operational");
        components.put("executor", "operational");
        components.put("workers", up ? "operational" : "stopped");

        String status = !up ? "stopped" : degraded ? "degraded" : "healthy";
        Runtime rt = Runtime.getRuntime();
        return new HealthStatus(status, components, uptimeMs(), rt.totalMemory() - rt.freeMemory(),
                rt.maxMemory(), clock.instant());
    }

    /**
     * Drops cooldowns, execution history and statistics, and the permission
     * audit log. Registered commands, overrides and prefixes are kept.
     */
    public boolean clearAllData() {
        try {
            cooldowns.clearAll();
            executor.clearAllData();
            permissions.clearAuditLog();
            logger.info("🧹 All runtime data cleared");
            return true;
        } catch (RuntimeException e) {
            logger.error("❌ Failed to clear data", e);
            return false;
        }
    }

    private long uptimeMs() {
        Instant started = startedAt;
        return started == null || !running.get() ? 0 : clock.millis() - started.toEpochMilli();
    }

    // --- Getters ---

    public Configuration getConfig() { return config; }
    public CommandManager getManager() { return manager; }
    public CommandRegistry getRegistry() { return registry; }
    public PermissionManager getPermissions() { return permissions; }
    public CooldownManager getCooldowns() { return cooldowns; }
    public CommandExecutor getExecutor() { return executor; }
}
