package com.questrail.dbus.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a single armed timer.
 *
 * <p>
 * Event-loop adapters hold one of these in a {@code Timeout}'s data slot while
 * the timer is armed. Re-arming after an interval change is expressed as
 * cancel-then-schedule, never as mutation of a running timer.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the armed timer.
     *
     * @return {@code true} if this call cancelled it; {@code false} if it had
     *         already fired or was cancelled before.
     */
    boolean cancel();
}
