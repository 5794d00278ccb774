package com.questrail.dbus.observability;

import java.time.Instant;

/**
 * Record representing an error in the dispatch engine outside any handler.
 */
public record BusErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
