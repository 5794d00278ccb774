package com.questrail.dbus.internal.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Used by {@code SelectLoop} and {@code NettyEventLoop} unless a test
 * injects a {@code ManualMonotonicClock}.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
