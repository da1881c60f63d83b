package com.syro.core.command;

import com.syro.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineTest extends TestBase {

    @Test
    void testParsesIdentifierAndArguments() {
        CommandLine line = CommandLine.parse("xBan  @user   spamming links", "x");

        assertNotNull(line);
        assertEquals("ban", line.identifier(), "Identifier should be lower-cased");
        assertEquals("@user   spamming links", line.argumentText());
        assertEquals(List.of("@user", "spamming", "links"), line.args());
    }

    @Test
    void testSupportsMultiCharacterPrefixAndSpaceAfterPrefix() {
        CommandLine line = CommandLine.parse("!! help ping", "!!");

        assertNotNull(line);
        assertEquals("help", line.identifier());
        assertEquals(List.of("ping"), line.args());
    }

    @Test
    void testNoArguments() {
        CommandLine line = CommandLine.parse("xping", "x");

        assertEquals("", line.argumentText());
        assertTrue(line.args().isEmpty());
    }

    @Test
    void testNonMatchingOrEmptyTextIsNotACommand() {
        assertNull(CommandLine.parse("hello there", "x"));
        assertNull(CommandLine.parse("!ping", "x"));
        assertNull(CommandLine.parse("x", "x"), "Prefix alone is not a command");
        assertNull(CommandLine.parse("x   ", "x"));
        assertNull(CommandLine.parse(null, "x"));
    }
}
