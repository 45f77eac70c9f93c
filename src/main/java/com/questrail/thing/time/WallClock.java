package com.questrail.thing.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to timestamp emitted events and observability records.
 *
 * <p>
 * Timestamps are informational only. Nothing in the runtime orders or expires
 * events by time; publish order is the only ordering that matters.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
