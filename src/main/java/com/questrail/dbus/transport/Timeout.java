package com.questrail.dbus.transport;

import java.util.Objects;

/**
 * Timeout
 * =============================================================================
 * A recurring interval timer owned by a connection.
 *
 * <p>Lifecycle mirrors {@link Watch}: the connection decides the interval and
 * the enabled state and reports changes to the event loop; the loop keeps its
 * timer handle in {@link #data()} and calls {@link #handle()} on every expiry.
 * The interval may change while the timer is enabled, in which case the loop
 * must re-arm with the new interval on {@code timeoutToggled}.</p>
 */
public final class Timeout
{
    private final Runnable handler;

    private volatile int intervalMillis;
    private volatile boolean enabled;
    private volatile Object data;

    public Timeout(int intervalMillis, boolean enabled, Runnable handler) {
        this.intervalMillis = checkInterval(intervalMillis);
        this.enabled = enabled;
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    public int intervalMillis() {
        return intervalMillis;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Object data() {
        return data;
    }

    public void setData(Object data) {
        this.data = data;
    }

    /**
     * Changed by the owning connection only; followed by
     * {@code EventLoop.timeoutToggled}.
     */
    public void setInterval(int intervalMillis) {
        this.intervalMillis = checkInterval(intervalMillis);
    }

    /**
     * Changed by the owning connection only; followed by
     * {@code EventLoop.timeoutToggled}.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Deliver one expiry to the owning connection.
     */
    public void handle() {
        handler.run();
    }

    @Override
    public String toString() {
        return "Timeout{" + intervalMillis + "ms" + (enabled ? " enabled" : " disabled") + '}';
    }

    private static int checkInterval(int intervalMillis) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("interval must be > 0 ms: " + intervalMillis);
        }
        return intervalMillis;
    }
}
