package com.syro.core.execution;

import com.syro.api.CommandContext;
import com.syro.api.CommandResult;
import com.syro.api.InboundMessage;
import com.syro.common.util.BoundedHistory;
import com.syro.core.command.CommandDescriptor;
import com.syro.core.command.CommandRegistry;
import com.syro.core.cooldown.CooldownManager;
import com.syro.core.cooldown.CooldownResult;
import com.syro.core.permission.PermissionDecision;
import com.syro.core.permission.PermissionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Runs the admission pipeline (resolve, guild scope, permission, cooldown) and
 * then the handler. Every attempt ends in one {@link ExecutionRecord} that is
 * appended to a bounded history. Handler failures are caught here and never
 * reach the caller.
 */
public class CommandExecutor {
    private static final Logger logger = LoggerFactory.getLogger(CommandExecutor.class);

    private final CommandRegistry registry;
    private final PermissionManager permissions;
    private final CooldownManager cooldowns;
    private final Clock clock;

    private final BoundedHistory<ExecutionRecord> history;
    private final Map<UUID, ActiveExecution> active = new ConcurrentHashMap<>();
    private final Map<String, UsageCounter> usage = new ConcurrentHashMap<>();

    // Statistics
    private final LongAdder total = new LongAdder();
    private final LongAdder succeeded = new LongAdder();
    private final LongAdder denied = new LongAdder();
    private final LongAdder faulted = new LongAdder();
    private final Map<DenialReason, LongAdder> deniedByReason = new EnumMap<>(DenialReason.class);
    private final LongAdder runs = new LongAdder();
    private final LongAdder totalRunMs = new LongAdder();
    private final AtomicLong fastestRunMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong slowestRunMs = new AtomicLong(0);
    private final Map<String, LongAdder> faultTypes = new ConcurrentHashMap<>();

    private static final class UsageCounter {
        final LongAdder count = new LongAdder();
        volatile Instant lastUsed;
    }

    public CommandExecutor(CommandRegistry registry, PermissionManager permissions, CooldownManager cooldowns,
                           int historyCapacity, Clock clock) {
        this.registry = registry;
        this.permissions = permissions;
        this.cooldowns = cooldowns;
        this.clock = clock;
        this.history = new BoundedHistory<>(historyCapacity);
        for (DenialReason r : DenialReason.values()) deniedByReason.put(r, new LongAdder());
        logger.info("⚡ Command Executor ready (history capacity {})", historyCapacity);
    }

    public DispatchResult execute(Invocation invocation) {
        InboundMessage message = invocation.message();
        UUID id = UUID.randomUUID();
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        ActiveExecution execution = new ActiveExecution(id, invocation.identifier(), message.actorId(),
                message.guildId(), startedAt);
        active.put(id, execution);

        try {
            Optional<CommandDescriptor> resolved = registry.resolve(invocation.identifier());
            if (resolved.isEmpty()) {
                ExecutionRecord r = deny(execution, startNanos, invocation.identifier(),
                        DenialReason.UNKNOWN_COMMAND, null);
                return new DispatchResult(true, r, null, null, null);
            }
            // from here on the descriptor reference is ours, whatever happens to the registry
            CommandDescriptor descriptor = resolved.get();
            execution.resolvedTo(descriptor.getName());

            if (descriptor.isGuildOnly() && !message.isFromGuild()) {
                ExecutionRecord r = deny(execution, startNanos, descriptor.getName(), DenialReason.GUILD_ONLY,
                        null);
                return new DispatchResult(true, r, null, null, null);
            }

            execution.advance(ExecutionState.PERMISSION_CHECK);
            PermissionDecision decision = permissions.isAllowed(descriptor, message);
            if (!decision.allowed()) {
                ExecutionRecord r = deny(execution, startNanos, descriptor.getName(),
                        DenialReason.INSUFFICIENT_PERMISSION, decision.reason().name());
                return new DispatchResult(true, r, decision, null, null);
            }

            execution.advance(ExecutionState.COOLDOWN_CHECK);
            CooldownResult cooldown = cooldowns.checkAndStart(message.actorId(), descriptor.getName(),
                    descriptor.getCooldownMs());
            if (!cooldown.allowed()) {
                ExecutionRecord r = deny(execution, startNanos, descriptor.getName(), DenialReason.ON_COOLDOWN,
                        "remainingMs=" + cooldown.remainingMs() + " scope=" + cooldown.scope());
                return new DispatchResult(true, r, decision, cooldown, null);
            }

            execution.advance(ExecutionState.RUNNING);
            return run(execution, descriptor, invocation, decision, cooldown, startNanos);
        } finally {
            active.remove(id);
        }
    }

    private DispatchResult run(ActiveExecution execution, CommandDescriptor descriptor, Invocation invocation,
                               PermissionDecision decision, CooldownResult cooldown, long startNanos) {
        CommandContext context = new CommandContext(execution.getExecutionId().toString(), descriptor.getName(),
                invocation.identifier(), invocation.prefix(), invocation.argumentText(), invocation.args(),
                invocation.message(), invocation.replier());
        countUsage(descriptor.getName());

        CommandResult result;
        try {
            result = descriptor.getHandler().run(context);
        } catch (OutOfMemoryError fatal) {
            // not recoverable in-process
            fault(execution, startNanos, descriptor, fatal);
            throw fatal;
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ExecutionRecord r = fault(execution, startNanos, descriptor, t);
            return new DispatchResult(true, r, decision, cooldown, null);
        }

        if (result == null) result = CommandResult.ok();
        long elapsed = elapsedMs(startNanos);
        recordRun(elapsed);

        if (!result.success()) {
            execution.advance(ExecutionState.FAULTED);
            faulted.increment();
            faultTypes.computeIfAbsent("CommandFailure", k -> new LongAdder()).increment();
            logger.warn("⚠️ Command {} reported failure for {} in {}: {}", descriptor.getName(),
                    execution.getActorId(), guildLabel(execution.getGuildId()), result.message());
            ExecutionRecord r = append(execution, descriptor.getName(), ExecutionOutcome.FAULTED, null,
                    result.message(), elapsed);
            return new DispatchResult(true, r, decision, cooldown, result);
        }

        execution.advance(ExecutionState.SUCCEEDED);
        succeeded.increment();
        logger.debug("✅ {} executed by {} in {}ms", descriptor.getName(), execution.getActorId(), elapsed);
        ExecutionRecord r = append(execution, descriptor.getName(), ExecutionOutcome.SUCCEEDED, null,
                result.message(), elapsed);
        return new DispatchResult(true, r, decision, cooldown, result);
    }

    private ExecutionRecord deny(ActiveExecution execution, long startNanos, String commandName,
                                 DenialReason reason, String detail) {
        execution.advance(ExecutionState.DENIED);
        denied.increment();
        deniedByReason.get(reason).increment();
        logger.debug("🚫 {} denied for {} ({}{})", commandName, execution.getActorId(), reason.getLabel(),
                detail == null ? "" : ": " + detail);
        return append(execution, commandName, ExecutionOutcome.DENIED, reason, detail, elapsedMs(startNanos));
    }

    private ExecutionRecord fault(ActiveExecution execution, long startNanos, CommandDescriptor descriptor,
                                  Throwable t) {
        long elapsed = elapsedMs(startNanos);
        recordRun(elapsed);
        execution.advance(ExecutionState.FAULTED);
        faulted.increment();
        faultTypes.computeIfAbsent(t.getClass().getSimpleName(), k -> new LongAdder()).increment();
        logger.error("❌ Command {} failed (actor={}, guild={}, execution={})", descriptor.getName(),
                execution.getActorId(), guildLabel(execution.getGuildId()), execution.getExecutionId(), t);
        String detail = t.getClass().getSimpleName() + (t.getMessage() == null ? "" : ": " + t.getMessage());
        return append(execution, descriptor.getName(), ExecutionOutcome.FAULTED, null, detail, elapsed);
    }

    private ExecutionRecord append(ActiveExecution execution, String commandName, ExecutionOutcome outcome,
                                   DenialReason reason, String detail, long durationMs) {
        total.increment();
        ExecutionRecord record = new ExecutionRecord(execution.getExecutionId(), execution.getStartedAt(),
                execution.getActorId(), execution.getGuildId(), commandName, outcome, reason, detail, durationMs);
        history.add(record);
        return record;
    }

    private void countUsage(String commandName) {
        UsageCounter counter = usage.computeIfAbsent(commandName, k -> new UsageCounter());
        counter.count.increment();
        counter.lastUsed = clock.instant();
    }

    private void recordRun(long elapsedMs) {
        runs.increment();
        totalRunMs.add(elapsedMs);
        fastestRunMs.accumulateAndGet(elapsedMs, Math::min);
        slowestRunMs.accumulateAndGet(elapsedMs, Math::max);
    }

    public List<ActiveExecution> getActiveExecutions() {
        return new ArrayList<>(active.values());
    }

    public List<ExecutionRecord> getExecutionHistory(ExecutionFilter filter) {
        ExecutionFilter f = filter == null ? ExecutionFilter.all() : filter;
        return history.filter(f::matches, f.getLimit());
    }

    public CommandUsage getUsage(String commandName) {
        UsageCounter counter = usage.get(commandName);
        return counter == null ? new CommandUsage(0, null) : new CommandUsage(counter.count.sum(), counter.lastUsed);
    }

    public int getHistoryCapacity() {
        return history.capacity();
    }

    public ExecutorStats getStats() {
        long totalCount = total.sum();
        long ok = succeeded.sum();
        long runCount = runs.sum();
        Map<DenialReason, Long> reasons = new LinkedHashMap<>();
        deniedByReason.forEach((r, n) -> reasons.put(r, n.sum()));
        Map<String, Long> faults = new TreeMap<>();
        faultTypes.forEach((k, v) -> faults.put(k, v.sum()));
        long fastest = fastestRunMs.get();

        return new ExecutorStats(totalCount, ok, denied.sum(), faulted.sum(), reasons,
                totalCount == 0 ? 0.0 : ok * 100.0 / totalCount,
                runCount == 0 ? 0.0 : (double) totalRunMs.sum() / runCount,
                fastest == Long.MAX_VALUE ? 0 : fastest,
                slowestRunMs.get(),
                faults, active.size(), history.size(), history.capacity());
    }

    /**
     * Forgets history, usage counters and statistics. In-flight executions are untouched.
     */
    public void clearAllData() {
        history.clear();
        usage.clear();
        faultTypes.clear();
        total.reset();
        succeeded.reset();
        denied.reset();
        faulted.reset();
        deniedByReason.values().forEach(LongAdder::reset);
        runs.reset();
        totalRunMs.reset();
        fastestRunMs.set(Long.MAX_VALUE);
        slowestRunMs.set(0);
        logger.info("🧹 Executor data cleared");
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String guildLabel(String guildId) {
        return guildId == null ? "DM" : guildId;
    }
}
