package com.syro.api;

/**
 * Platform capability flags carried by an actor and required by a command.
 * An empty requirement set means "anyone".
 */
public enum Capability {
    MODERATE,
    ADMINISTER
}
