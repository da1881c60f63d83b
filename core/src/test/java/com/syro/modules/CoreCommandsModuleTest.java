package com.syro.modules;

import com.syro.api.Capability;
import com.syro.api.InboundMessage;
import com.syro.core.CommandsSystem;
import com.syro.core.config.Configuration;
import com.syro.core.execution.DenialReason;
import com.syro.core.execution.ExecutionOutcome;
import com.syro.services.database.InMemoryGuildSettingsStore;
import com.syro.test.TestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the built-in help and prefix commands.
 */
class CoreCommandsModuleTest extends TestBase {

    private static final String GUILD = "guild-1";

    private CommandsSystem system;
    private final List<String> replies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void createSystem() {
        system = new CommandsSystem(new Configuration(), new InMemoryGuildSettingsStore(), clock);
        system.registerModule(new CoreCommandsModule());
        system.registerMessageSender((origin, text) -> replies.add(text));
        system.init();
    }

    @AfterEach
    void stopSystem() {
        system.shutdown();
    }

    @Test
    void testModuleCommandsRegisteredOnInit() {
        assertTrue(system.getCommand("help").isPresent());
        assertTrue(system.getCommand("commands").isPresent(), "Alias of help");
        assertTrue(system.getCommand("prefix").isPresent());
    }

    @Test
    void testHelpListsCategoriesAndCommands() {
        system.executeCommand(directMessage("xhelp", "alice"));

        assertEquals(1, replies.size());
        assertTrue(replies.get(0).contains("Information: xhelp"), replies.get(0));
        assertTrue(replies.get(0).contains("Administration: xprefix"), replies.get(0));
    }

    @Test
    void testHelpForSingleCommand() {
        system.executeCommand(directMessage("xh prefix", "alice"));

        assertTrue(replies.get(0).startsWith("📖 xprefix"));
        assertTrue(replies.get(0).contains("Usage: xprefix"));
    }

    @Test
    void testPrefixRequiresAdministrator() {
        var result = system.executeCommand(guildMessage("xprefix !", "alice", GUILD));

        assertEquals(DenialReason.INSUFFICIENT_PERMISSION, result.denialReason());
        assertEquals("x", system.getServerPrefix(GUILD));
    }

    @Test
    void testPrefixIsGuildOnly() {
        var result = system.executeCommand(new InboundMessage("xprefix !", "owner", List.of(),
                Set.of(Capability.ADMINISTER), null, "dm"));

        assertEquals(DenialReason.GUILD_ONLY, result.denialReason());
    }

    @Test
    void testAdministratorChangesAndResetsPrefix() {
        var owner = Set.of(Capability.ADMINISTER);

        var changed = system.executeCommand(guildMessage("xprefix !", "owner", List.of(), owner, GUILD));
        assertEquals(ExecutionOutcome.SUCCEEDED, changed.outcome());
        assertEquals("!", system.getServerPrefix(GUILD));
        assertEquals("🔤 Prefix changed to !", replies.get(0));

        system.executeCommand(guildMessage("!prefix", "owner", List.of(), owner, GUILD));
        assertEquals("🔤 Current prefix: !", replies.get(1));

        system.executeCommand(guildMessage("!prefix waytoolong", "owner", List.of(), owner, GUILD));
        assertEquals("!", system.getServerPrefix(GUILD), "Invalid prefix is rejected");

        system.executeCommand(guildMessage("!prefix reset", "owner", List.of(), owner, GUILD));
        assertEquals("x", system.getServerPrefix(GUILD));
    }
}
