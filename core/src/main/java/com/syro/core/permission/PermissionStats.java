package com.syro.core.permission;

import java.util.Map;

public record PermissionStats(long totalChecks,
                              long granted,
                              long denied,
                              Map<PermissionReason, Long> byReason,
                              int cachedGuilds,
                              int auditEntries,
                              long storeFailures,
                              boolean degraded) {
}
