package com.syro.core.execution;

public enum DenialReason {
    UNKNOWN_COMMAND("UnknownCommand"),
    GUILD_ONLY("GuildOnly"),
    INSUFFICIENT_PERMISSION("InsufficientPermission"),
    ON_COOLDOWN("OnCooldown");

    private final String label;

    DenialReason(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
