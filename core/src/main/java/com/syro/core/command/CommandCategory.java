package com.syro.core.command;

/**
 * A configured command category together with how many commands use it.
 */
public record CommandCategory(String id, String name, String description, int commandCount) {
}
