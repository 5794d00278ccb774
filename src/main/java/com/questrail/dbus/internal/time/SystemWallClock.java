package com.questrail.dbus.internal.time;

import java.time.Instant;

/**
 * {@link WallClock} backed by {@link Instant#now()}; stamps the events handed
 * to a {@code BusObservabilitySink}.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
