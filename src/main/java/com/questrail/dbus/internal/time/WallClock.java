package com.questrail.dbus.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for observability event timestamps. Never consulted for
 * expiry or poll timing.
 */
public interface WallClock
{
    Instant now();
}
