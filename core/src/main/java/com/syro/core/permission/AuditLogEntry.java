package com.syro.core.permission;

import java.time.Instant;

/**
 * One permission mutation call, whether or not it took effect.
 *
 * @param resultingAllowed override value after the call, {@code null} if no override remains
 * @param applied          false when the call failed or changed nothing
 * @param detail           failure message or note, may be {@code null}
 */
public record AuditLogEntry(Instant timestamp,
                            AuditAction action,
                            String actorId,
                            String guildId,
                            String commandName,
                            String roleId,
                            Boolean resultingAllowed,
                            boolean applied,
                            String detail) {
}
