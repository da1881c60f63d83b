package com.syro.modules;

import com.syro.api.Capability;
import com.syro.api.CommandContext;
import com.syro.api.CommandModule;
import com.syro.api.CommandResult;
import com.syro.core.CommandsSystem;
import com.syro.core.command.CommandCategory;
import com.syro.core.command.CommandDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Built-in commands: {@code help} and {@code prefix}.
 */
public class CoreCommandsModule implements CommandModule {

    @Override
    public String getName() {
        return "CoreCommands";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public List<CommandDescriptor> createCommands(CommandsSystem system) {
        CommandDescriptor help = CommandDescriptor.builder("help")
                .aliases("h", "commands")
                .category("info")
                .description("Lists commands, or shows details of one command")
                .usage("help [command]")
                .cooldownMs(3000)
                .handler(ctx -> help(system, ctx))
                .build();

        CommandDescriptor prefix = CommandDescriptor.builder("prefix")
                .category("admin")
                .description("Shows or changes the command prefix of this server")
                .usage("prefix [new prefix | reset]")
                .requires(Capability.ADMINISTER)
                .guildOnly(true)
                .handler(ctx -> prefix(system, ctx))
                .build();

        return List.of(help, prefix);
    }

    private CommandResult help(CommandsSystem system, CommandContext ctx) {
        String p = ctx.getPrefix();
        String target = ctx.arg(0, null);

        if (target != null) {
            Optional<CommandDescriptor> found = system.getCommand(target);
            if (found.isEmpty()) {
                return CommandResult.ok("🔍 Unknown command: " + target);
            }
            CommandDescriptor d = found.get();
            StringBuilder sb = new StringBuilder();
            sb.append("📖 ").append(p).append(d.getName()).append("\n");
            if (!d.getDescription().isEmpty()) sb.append(d.getDescription()).append("\n");
            if (!d.getUsage().isEmpty()) sb.append("Usage: ").append(p).append(d.getUsage()).append("\n");
            if (!d.getAliases().isEmpty()) sb.append("Aliases: ").append(String.join(", ", d.getAliases())).append("\n");
            if (d.getCooldownMs() > 0) sb.append("Cooldown: ").append(d.getCooldownMs() / 1000.0).append("s\n");
            return CommandResult.ok(sb.toString().trim());
        }

        StringBuilder sb = new StringBuilder("📚 Commands\n");
        for (CommandCategory category : system.getAllCategories()) {
            if (category.commandCount() == 0) continue;
            sb.append("\n").append(category.name()).append(": ");
            List<CommandDescriptor> commands = system.getCommandsByCategory(category.id());
            for (int i = 0; i < commands.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(p).append(commands.get(i).getName());
            }
        }
        sb.append("\n\nUse ").append(p).append("help <command> for details.");
        return CommandResult.ok(sb.toString());
    }

    private CommandResult prefix(CommandsSystem system, CommandContext ctx) {
        String guildId = ctx.getGuildId();
        String requested = ctx.arg(0, null);

        if (requested == null) {
            return CommandResult.ok("🔤 Current prefix: " + system.getServerPrefix(guildId));
        }
        if (requested.equalsIgnoreCase("reset")) {
            return system.setServerPrefix(guildId, null)
                    ? CommandResult.ok("🔤 Prefix reset to " + system.getConfig().defaultPrefix)
                    : CommandResult.failure("Could not reset the prefix.");
        }
        if (!system.getManager().isValidPrefix(requested)) {
            return CommandResult.ok("⚠️ A prefix must be 1-" + system.getConfig().maxPrefixLength
                    + " characters without spaces.");
        }
        return system.setServerPrefix(guildId, requested)
                ? CommandResult.ok("🔤 Prefix changed to " + requested)
                : CommandResult.failure("Could not save the prefix.");
    }
}
