package com.syro.core.config;

import java.util.LinkedHashMap;
import java.util.Map;

public class Configuration {
    // --- Dispatcher ---
    public boolean debugMode = false;
    public String defaultPrefix = "x";
    public int maxPrefixLength = 5;
    public int workerThreads = 4;

    // --- Bounded stores ---
    public int executionHistoryCapacity = 1000;
    public int auditLogCapacity = 1000;
    public int maxCooldownEntries = 10000;

    // --- Persistence of per-guild overrides and prefixes ---
    public boolean databaseEnabled = true;
    public String databasePath = "data/commands";

    // Key = category id, Value = display data
    public Map<String, CategorySettings> categories = new LinkedHashMap<>();

    public static class CategorySettings {
        public String name;
        public String description;

        public CategorySettings() {
        }

        public CategorySettings(String name, String description) {
            this.name = name;
            this.description = description;
        }
    }

    public Configuration() {
        // Defaults
        categories.put("admin", new CategorySettings("Administration", "Server administration commands"));
        categories.put("moderation", new CategorySettings("Moderation", "User moderation commands"));
        categories.put("utility", new CategorySettings("Utility", "Utility and helper commands"));
        categories.put("info", new CategorySettings("Information", "Information and status commands"));
        categories.put("fun", new CategorySettings("Fun", "Fun and entertainment commands"));
        categories.put("economy", new CategorySettings("Economy", "Economy and currency commands"));
        categories.put("music", new CategorySettings("Music", "Music playback commands"));
    }
}
