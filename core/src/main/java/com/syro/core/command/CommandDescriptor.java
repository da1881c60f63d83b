package com.syro.core.command;

import com.syro.api.Capability;
import com.syro.api.CommandHandler;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Static metadata plus the handler of one command. Instances are immutable;
 * the registry hands out the same instance for the name and every alias.
 */
public final class CommandDescriptor {
    private final String name;
    private final Set<String> aliases;
    private final String description;
    private final String usage;
    private final String category;
    private final Set<Capability> requiredCapabilities;
    private final long cooldownMs;
    private final boolean guildOnly;
    private final CommandHandler handler;

    private CommandDescriptor(Builder b) {
        this.name = b.name;
        this.aliases = Collections.unmodifiableSet(new LinkedHashSet<>(b.aliases));
        this.description = b.description;
        this.usage = b.usage;
        this.category = b.category;
        this.requiredCapabilities = b.requiredCapabilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.requiredCapabilities));
        this.cooldownMs = b.cooldownMs;
        this.guildOnly = b.guildOnly;
        this.handler = b.handler;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder pre-filled with this descriptor's fields, used to derive alias
     * variants without touching the registered instance.
     */
    public Builder toBuilder() {
        Builder b = new Builder(name)
                .description(description)
                .usage(usage)
                .category(category)
                .cooldownMs(cooldownMs)
                .guildOnly(guildOnly)
                .handler(handler);
        aliases.forEach(b::alias);
        requiredCapabilities.forEach(b::requires);
        return b;
    }

    public String getName() { return name; }
    public Set<String> getAliases() { return aliases; }
    public String getDescription() { return description; }
    public String getUsage() { return usage; }
    public String getCategory() { return category; }
    public Set<Capability> getRequiredCapabilities() { return requiredCapabilities; }
    public long getCooldownMs() { return cooldownMs; }
    public boolean isGuildOnly() { return guildOnly; }
    public CommandHandler getHandler() { return handler; }

    @Override
    public String toString() {
        return "CommandDescriptor{" + name + ", aliases=" + aliases + ", category=" + category + "}";
    }

    public static final class Builder {
        private final String name;
        private final Set<String> aliases = new LinkedHashSet<>();
        private String description = "";
        private String usage = "";
        private String category = "utility";
        private final Set<Capability> requiredCapabilities = EnumSet.noneOf(Capability.class);
        private long cooldownMs = 0;
        private boolean guildOnly = false;
        private CommandHandler handler;

        private Builder(String name) {
            this.name = normalize(name, "name");
        }

        public Builder alias(String alias) {
            String a = normalize(alias, "alias");
            if (!a.equals(name)) aliases.add(a);
            return this;
        }

        public Builder withoutAlias(String alias) {
            aliases.remove(normalize(alias, "alias"));
            return this;
        }

        public Builder aliases(String... values) {
            for (String v : values) alias(v);
            return this;
        }

        public Builder description(String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        public Builder usage(String usage) {
            this.usage = usage == null ? "" : usage;
            return this;
        }

        public Builder category(String category) {
            this.category = Objects.requireNonNull(category, "category").toLowerCase(Locale.ROOT);
            return this;
        }

        public Builder requires(Capability capability) {
            requiredCapabilities.add(Objects.requireNonNull(capability, "capability"));
            return this;
        }

        public Builder cooldownMs(long cooldownMs) {
            if (cooldownMs < 0) throw new IllegalArgumentException("cooldownMs must be >= 0");
            this.cooldownMs = cooldownMs;
            return this;
        }

        public Builder guildOnly(boolean guildOnly) {
            this.guildOnly = guildOnly;
            return this;
        }

        public Builder handler(CommandHandler handler) {
            this.handler = handler;
            return this;
        }

        public CommandDescriptor build() {
            Objects.requireNonNull(handler, "handler for command " + name);
            return new CommandDescriptor(this);
        }

        private static String normalize(String value, String what) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(what + " must not be blank");
            }
            String v = value.strip().toLowerCase(Locale.ROOT);
            if (v.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException(what + " must not contain whitespace: '" + value + "'");
            }
            return v;
        }
    }
}
