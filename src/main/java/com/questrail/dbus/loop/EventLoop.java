package com.questrail.dbus.loop;

import com.questrail.dbus.transport.Timeout;
import com.questrail.dbus.transport.Watch;

/**
 * EventLoop
 * =============================================================================
 * Adapter between a connection's watches/timeouts and a host scheduler.
 *
 * <p>Every method is called by the {@code Connection}, never by application
 * code, and is pure registration: nothing returned here affects protocol
 * correctness.</p>
 *
 * <h2>Event delivery</h2>
 * When a watched channel becomes ready or a timer expires, an implementation
 * MUST:
 * <ol>
 *   <li>call {@link Watch#handle(int)} / {@link Timeout#handle()} so the
 *       connection can update its state, then</li>
 *   <li>schedule a dispatch pass ({@link DispatchDriver#drain}) for later,
 *       rather than dispatching from inside the event callback.</li>
 * </ol>
 */
public interface EventLoop
{
    /**
     * Begin observing the watch's channel for its flags if it is enabled.
     * Scheduler state goes into {@link Watch#setData(Object)}.
     */
    void addWatch(Watch watch);

    /**
     * Stop observing and release the watch's slot state. Safe for a watch
     * that was never enabled.
     */
    void removeWatch(Watch watch);

    /**
     * The watch's flags or enabled state changed; start or stop observation
     * to match without leaving a stale registration behind.
     */
    void watchToggled(Watch watch);

    void addTimeout(Timeout timeout);

    void removeTimeout(Timeout timeout);

    /**
     * The timeout's enabled state or interval changed. An interval change on
     * an enabled timeout re-arms it with the new interval.
     */
    void timeoutToggled(Timeout timeout);
}
