package com.syro.core;

import com.syro.core.command.CommandRegistry;
import com.syro.core.cooldown.CooldownStats;
import com.syro.core.execution.ExecutorStats;
import com.syro.core.permission.PermissionStats;

public record SystemStats(CommandRegistry.RegistryStats registry,
                          PermissionStats permissions,
                          CooldownStats cooldowns,
                          ExecutorStats executor,
                          int modules,
                          long uptimeMs) {
}
