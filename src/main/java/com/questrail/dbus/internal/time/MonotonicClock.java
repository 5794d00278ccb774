package com.questrail.dbus.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every expiry computed by the event loops.
 *
 * <h2>Binding invariant</h2>
 * Timer expiry, poll timeouts and pending-call deadlines are computed from
 * this clock only. Wall-clock time is reserved for observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
