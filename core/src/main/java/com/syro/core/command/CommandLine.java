package com.syro.core.command;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Prefix + identifier + argument split of a raw message.
 *
 * @param prefix       the prefix that matched
 * @param identifier   lower-cased command name or alias
 * @param argumentText everything after the identifier, trimmed
 * @param args         argumentText split on whitespace
 */
public record CommandLine(String prefix, String identifier, String argumentText, List<String> args) {

    /**
     * @return the parsed line, or {@code null} when the text does not start with
     *         the prefix or carries no identifier after it
     */
    public static CommandLine parse(String rawText, String prefix) {
        if (rawText == null || prefix == null || prefix.isEmpty()) return null;
        String text = rawText.stripLeading();
        if (!text.regionMatches(true, 0, prefix, 0, prefix.length())) return null;

        String body = text.substring(prefix.length()).strip();
        if (body.isEmpty()) return null;

        String[] parts = body.split("\\s+", 2);
        String identifier = parts[0].toLowerCase(Locale.ROOT);
        String argumentText = parts.length > 1 ? parts[1].strip() : "";
        List<String> args = argumentText.isEmpty()
                ? List.of()
                : Arrays.asList(argumentText.split("\\s+"));
        return new CommandLine(prefix, identifier, argumentText, List.copyOf(args));
    }
}
