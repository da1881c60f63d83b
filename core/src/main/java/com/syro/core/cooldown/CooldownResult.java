package com.syro.core.cooldown;

/**
 * Outcome of {@link CooldownManager#checkAndStart}.
 *
 * @param remainingMs wait time when denied, 0 when allowed
 * @param scope       the cooldown that blocked, {@code null} when allowed
 */
public record CooldownResult(boolean allowed, long remainingMs, CooldownScope scope) {

    static final CooldownResult ALLOWED = new CooldownResult(true, 0, null);

    static CooldownResult denied(long remainingMs, CooldownScope scope) {
        return new CooldownResult(false, remainingMs, scope);
    }

    public long remainingSeconds() {
        return (remainingMs + 999) / 1000;
    }
}
