package com.syro.core.execution;

import java.util.Map;

public record ExecutorStats(long totalExecutions,
                            long succeeded,
                            long denied,
                            long faulted,
                            Map<DenialReason, Long> deniedByReason,
                            double successRate,
                            double averageRunMs,
                            long fastestRunMs,
                            long slowestRunMs,
                            Map<String, Long> faultTypes,
                            int activeExecutions,
                            int historySize,
                            int historyCapacity) {
}
