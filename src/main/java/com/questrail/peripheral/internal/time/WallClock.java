package com.questrail.peripheral.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for discovery timestamps and observability events.
 *
 * <p>
 * Nothing in the stack makes timing decisions, so wall time is the only clock
 * it needs. Tests substitute a fixed clock to make timestamps predictable.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
