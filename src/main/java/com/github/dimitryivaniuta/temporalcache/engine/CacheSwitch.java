package com.github.dimitryivaniuta.temporalcache.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global disable switch read by every {@link TemporalGate} on every call.
 *
 * <p>{@link #global()} is the process-wide instance used at the composition boundary
 * (Spring configuration, {@link TemporalCaches}). Tests create their own instances.
 * Meant for debugging and test isolation, not for toggling under load.
 */
public final class CacheSwitch {

    private static final CacheSwitch GLOBAL = new CacheSwitch();

    private final AtomicBoolean disabled = new AtomicBoolean(false);

    public static CacheSwitch global() {
        return GLOBAL;
    }

    public void enable() {
        disabled.set(false);
    }

    public void disable() {
        disabled.set(true);
    }

    public boolean isDisabled() {
        return disabled.get();
    }

    public boolean isEnabled() {
        return !disabled.get();
    }
}
