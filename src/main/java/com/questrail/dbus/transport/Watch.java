package com.questrail.dbus.transport;

import java.nio.channels.SelectableChannel;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Watch
 * =============================================================================
 * A connection's interest in readiness of one channel.
 *
 * <h2>Ownership</h2>
 * The connection creates the watch, decides its interest flags and enabled
 * state, and tells the installed event loop about every change through
 * {@code addWatch} / {@code watchToggled} / {@code removeWatch}. The event loop
 * only reads those attributes and keeps its own bookkeeping (a selection key,
 * a registration handle) in {@link #data()}.
 *
 * <p>When the loop observes readiness it calls {@link #handle(int)} with the
 * flags it saw; the connection updates its internal state from there.</p>
 */
public final class Watch
{
    public static final int READABLE = 1;
    public static final int WRITABLE = 2;

    private final SelectableChannel channel;
    private final IntConsumer handler;

    private volatile int flags;
    private volatile boolean enabled;
    private volatile Object data;

    /**
     * @param channel  channel to observe; must be in non-blocking mode
     * @param flags    {@link #READABLE} and/or {@link #WRITABLE}
     * @param enabled  initial enabled state
     * @param handler  receives the observed flags when the channel is ready
     */
    public Watch(SelectableChannel channel, int flags, boolean enabled, IntConsumer handler) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.flags = checkFlags(flags);
        this.enabled = enabled;
    }

    public SelectableChannel channel() {
        return channel;
    }

    public int flags() {
        return flags;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Adapter-owned slot. {@code null} until an adapter stores something.
     */
    public Object data() {
        return data;
    }

    public void setData(Object data) {
        this.data = data;
    }

    /**
     * Changed by the owning connection only; followed by
     * {@code EventLoop.watchToggled}.
     */
    public void setFlags(int flags) {
        this.flags = checkFlags(flags);
    }

    /**
     * Changed by the owning connection only; followed by
     * {@code EventLoop.watchToggled}.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Deliver observed readiness to the owning connection.
     *
     * @param observedFlags the subset of {@link #flags()} that became ready
     */
    public void handle(int observedFlags) {
        handler.accept(observedFlags);
    }

    @Override
    public String toString() {
        return "Watch{" + channel.getClass().getSimpleName()
                + ((flags & READABLE) != 0 ? " R" : "")
                + ((flags & WRITABLE) != 0 ? " W" : "")
                + (enabled ? " enabled" : " disabled") + '}';
    }

    private static int checkFlags(int flags) {
        if ((flags & ~(READABLE | WRITABLE)) != 0) {
            throw new IllegalArgumentException("unknown watch flags: " + flags);
        }
        return flags;
    }
}
