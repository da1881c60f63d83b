package com.syro.core;

import com.syro.api.InboundMessage;
import com.syro.api.MessageSender;
import com.syro.core.command.CommandCategory;
import com.syro.core.command.CommandDescriptor;
import com.syro.core.command.CommandLine;
import com.syro.core.command.CommandNotFoundException;
import com.syro.core.command.CommandRegistry;
import com.syro.core.command.DuplicateIdentityException;
import com.syro.core.config.Configuration;
import com.syro.core.cooldown.CooldownManager;
import com.syro.core.execution.CommandExecutor;
import com.syro.core.execution.DispatchResult;
import com.syro.core.execution.ExecutionRecord;
import com.syro.core.execution.Invocation;
import com.syro.core.execution.CommandUsage;
import com.syro.core.permission.RoleOverride;
import com.syro.core.permission.PermissionManager;
import com.syro.services.database.GuildSettingsStore;
import com.syro.services.database.GuildStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Facade over registry, permissions, cooldowns and executor. Owns per-guild
 * prefixes, the category table and the replies sent for denials and faults.
 * Administrative methods return {@code false} instead of throwing.
 */
public class CommandManager {
    private static final Logger logger = LoggerFactory.getLogger(CommandManager.class);

    static final String NO_PERMISSION_REPLY = "❌ You do not have permission to use this command.";
    static final String GUILD_ONLY_REPLY = "❌ This command can only be used in a server.";
    static final String FAULT_REPLY = "❌ An error occurred while executing the command.";

    private final Configuration config;
    private final CommandRegistry registry;
    private final PermissionManager permissions;
    private final CooldownManager cooldowns;
    private final CommandExecutor executor;
    private final GuildSettingsStore store;

    // guild id -> configured prefix, empty when the guild uses the default
    private final Map<String, Optional<String>> prefixes = new ConcurrentHashMap<>();
    private volatile MessageSender messageSender;

    public CommandManager(Configuration config, CommandRegistry registry, PermissionManager permissions,
                          CooldownManager cooldowns, CommandExecutor executor, GuildSettingsStore store) {
        this.config = config;
        this.registry = registry;
        this.permissions = permissions;
        this.cooldowns = cooldowns;
        this.executor = executor;
        this.store = store;
    }

    // --- Dispatch ---

    /**
     * Parses and dispatches one message. Messages without the guild's prefix
     * are ignored and leave no record.
     */
    public DispatchResult handleMessage(InboundMessage message) {
        String prefix = getServerPrefix(message.guildId());
        CommandLine line = CommandLine.parse(message.rawText(), prefix);
        if (line == null) return DispatchResult.ignored();

        Invocation invocation = new Invocation(line.identifier(), line.argumentText(), line.args(), prefix, message,
                text -> sendMessage(message, text));
        DispatchResult result = executor.execute(invocation);
        replyToOutcome(message, result);
        return result;
    }

    private void replyToOutcome(InboundMessage message, DispatchResult result) {
        ExecutionRecord record = result.record();
        if (record == null) return;
        switch (record.outcome()) {
            case DENIED:
                switch (record.denialReason()) {
                    case INSUFFICIENT_PERMISSION:
                        sendMessage(message, NO_PERMISSION_REPLY);
                        break;
                    case GUILD_ONLY:
                        sendMessage(message, GUILD_ONLY_REPLY);
                        break;
                    case ON_COOLDOWN:
                        sendMessage(message, String.format(
                                "⏰ Please wait %d seconds before using this command again.",
                                result.cooldown().remainingSeconds()));
                        break;
                    default:
                        // unknown commands stay silent
                        break;
                }
                break;
            case FAULTED:
                if (result.result() != null && result.result().message() != null) {
                    sendMessage(message, "❌ " + result.result().message());
                } else {
                    sendMessage(message, FAULT_REPLY);
                }
                break;
            default:
                if (result.result() != null && result.result().message() != null) {
                    sendMessage(message, result.result().message());
                }
        }
    }

    public void registerMessageSender(MessageSender sender) {
        this.messageSender = sender;
    }

    public void sendMessage(InboundMessage origin, String text) {
        MessageSender sender = messageSender;
        if (sender == null) {
            logger.warn("No MessageSender registered. Msg to {} (channel {}): {}", origin.actorId(),
                    origin.channelId(), text);
            return;
        }
        try {
            sender.send(origin, text);
        } catch (RuntimeException e) {
            logger.error("❌ Failed to send reply to {}: {}", origin.actorId(), e.getMessage());
        }
    }

    // --- Registration ---

    public boolean registerCommand(CommandDescriptor descriptor) {
        if (descriptor == null) return false;
        if (config.categories == null || !config.categories.containsKey(descriptor.getCategory())) {
            logger.warn("⚠️ Rejected command {}: unknown category '{}'", descriptor.getName(),
                    descriptor.getCategory());
            return false;
        }
        try {
            registry.register(descriptor);
            return true;
        } catch (DuplicateIdentityException e) {
            logger.warn("⚠️ Rejected command {}: {}", descriptor.getName(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            logger.error("❌ Failed to register command {}", descriptor.getName(), e);
            return false;
        }
    }

    public boolean unregisterCommand(String name) {
        try {
            registry.unregister(name);
            return true;
        } catch (CommandNotFoundException e) {
            logger.warn("⚠️ Cannot unregister: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            logger.error("❌ Failed to unregister command {}", name, e);
            return false;
        }
    }

    public boolean addAlias(String name, String alias) {
        try {
            registry.addAlias(name, alias);
            return true;
        } catch (RuntimeException e) {
            logger.warn("⚠️ Cannot add alias '{}' to {}: {}", alias, name, e.getMessage());
            return false;
        }
    }

    public boolean removeAlias(String name, String alias) {
        try {
            return registry.removeAlias(name, alias);
        } catch (RuntimeException e) {
            logger.warn("⚠️ Cannot remove alias '{}' from {}: {}", alias, name, e.getMessage());
            return false;
        }
    }

    /**
     * Unregisters {@code previous} (ignoring names already gone) and registers
     * {@code replacements}.
     *
     * @return names that are registered afterwards
     */
    public List<String> replaceCommands(List<String> previous, List<CommandDescriptor> replacements) {
        for (String name : previous) {
            if (registry.has(name)) unregisterCommand(name);
        }
        List<String> registered = new ArrayList<>();
        for (CommandDescriptor d : replacements) {
            if (registerCommand(d)) registered.add(d.getName());
        }
        return registered;
    }

    // --- Prefixes ---

    /**
     * The guild's prefix, or the default for DMs, unset guilds and when the
     * store cannot be read.
     */
    public String getServerPrefix(String guildId) {
        if (guildId == null) return config.defaultPrefix;
        Optional<String> cached = prefixes.get(guildId);
        if (cached == null) {
            try {
                cached = Optional.ofNullable(store.load(guildId).prefix());
                prefixes.putIfAbsent(guildId, cached);
            } catch (GuildStoreException e) {
                logger.warn("⚠️ Prefix of guild {} unavailable, using default: {}", guildId, e.getMessage());
                return config.defaultPrefix;
            }
        }
        return cached.orElse(config.defaultPrefix);
    }

    /**
     * @param prefix new prefix; {@code null} or the default prefix resets the guild to the default
     */
    public boolean setServerPrefix(String guildId, String prefix) {
        if (guildId == null) return false;
        String value = prefix == null ? null : prefix.strip();
        if (value != null && !isValidPrefix(value)) {
            logger.warn("⚠️ Invalid prefix '{}' for guild {}", prefix, guildId);
            return false;
        }
        if (value != null && value.equals(config.defaultPrefix)) value = null;
        try {
            synchronized (prefixes) {
                store.savePrefix(guildId, value);
                prefixes.put(guildId, Optional.ofNullable(value));
            }
            logger.info("🔤 Prefix of guild {} set to '{}'", guildId, value == null ? config.defaultPrefix : value);
            return true;
        } catch (RuntimeException e) {
            logger.error("❌ Failed to set prefix of guild {}: {}", guildId, e.getMessage());
            return false;
        }
    }

    public boolean isValidPrefix(String prefix) {
        return prefix != null
                && !prefix.isBlank()
                && prefix.length() <= config.maxPrefixLength
                && prefix.chars().noneMatch(Character::isWhitespace);
    }

    // --- Permissions and cooldowns ---

    public boolean setRolePermission(String guildId, String commandName, String roleId, boolean allowed,
                                     String actorId) {
        try {
            return permissions.setRolePermission(guildId, canonicalName(commandName), roleId, allowed, actorId);
        } catch (RuntimeException e) {
            logger.error("❌ setRolePermission failed", e);
            return false;
        }
    }

    public boolean removeRolePermission(String guildId, String commandName, String roleId, String actorId) {
        try {
            return permissions.removeRolePermission(guildId, canonicalName(commandName), roleId, actorId);
        } catch (RuntimeException e) {
            logger.error("❌ removeRolePermission failed", e);
            return false;
        }
    }

    public boolean setCooldown(String userId, String commandName, long durationMs) {
        try {
            cooldowns.setCooldown(userId, canonicalName(commandName), durationMs);
            return true;
        } catch (RuntimeException e) {
            logger.warn("⚠️ Cannot set cooldown {} -> {}: {}", userId, commandName, e.getMessage());
            return false;
        }
    }

    public boolean setGlobalCooldown(String commandName, long durationMs) {
        try {
            cooldowns.setGlobalCooldown(canonicalName(commandName), durationMs);
            return true;
        } catch (RuntimeException e) {
            logger.warn("⚠️ Cannot set global cooldown {}: {}", commandName, e.getMessage());
            return false;
        }
    }

    /**
     * Aliases are stored under the command's primary name; unknown names pass through.
     */
    private String canonicalName(String identifier) {
        if (identifier == null) return null;
        return registry.resolve(identifier)
                .map(CommandDescriptor::getName)
                .orElse(identifier.strip().toLowerCase(Locale.ROOT));
    }

    // --- Read projections ---

    public List<DashboardCommand> getCommandsForDashboard(String guildId) {
        Map<String, Map<String, RoleOverride>> overrides = permissions.getGuildPermissions(guildId);
        List<DashboardCommand> out = new ArrayList<>();
        for (CommandDescriptor d : registry.getAll()) {
            Map<String, Boolean> roles = new HashMap<>();
            overrides.getOrDefault(d.getName(), Map.of()).forEach((role, o) -> roles.put(role, o.allowed()));
            CommandUsage used = executor.getUsage(d.getName());
            out.add(new DashboardCommand(d.getName(), d.getAliases(), d.getDescription(), d.getUsage(),
                    d.getCategory(), d.getRequiredCapabilities(), d.getCooldownMs(), d.isGuildOnly(), roles,
                    used.count(), used.lastUsed()));
        }
        return out;
    }

    public List<CommandCategory> getAllCategories() {
        List<CommandCategory> out = new ArrayList<>();
        if (config.categories == null) return out;
        config.categories.forEach((id, c) -> out.add(new CommandCategory(id, c.name, c.description,
                registry.listByCategory(id).size())));
        return out;
    }

    public List<CommandDescriptor> getCommandsByCategory(String category) {
        return registry.listByCategory(category);
    }

    /**
     * Forgets the cached prefix and overrides of a guild.
     */
    public void invalidateGuild(String guildId) {
        prefixes.remove(guildId);
        permissions.invalidateGuild(guildId);
    }

    public CommandRegistry getRegistry() { return registry; }
    public PermissionManager getPermissions() { return permissions; }
    public CooldownManager getCooldowns() { return cooldowns; }
    public CommandExecutor getExecutor() { return executor; }
    public Configuration getConfig() { return config; }
}
