package com.syro.core.cooldown;

public record CooldownStats(long checks,
                            long allowed,
                            long deniedUser,
                            long deniedGlobal,
                            int trackedUserEntries,
                            int trackedGlobalEntries,
                            int userOverrides,
                            int globalDurations,
                            long evictions,
                            int maxEntries) {
}
