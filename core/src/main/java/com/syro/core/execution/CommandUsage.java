package com.syro.core.execution;

import java.time.Instant;

/**
 * How often a command's handler ran and when it last did.
 */
public record CommandUsage(long count, Instant lastUsed) {
}
