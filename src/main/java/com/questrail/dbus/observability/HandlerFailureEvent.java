package com.questrail.dbus.observability;

import com.questrail.dbus.model.Message;

import java.time.Instant;

/**
 * Record describing a handler that failed while processing a message.
 */
public record HandlerFailureEvent(
    Instant timestamp,
    Message message,
    Throwable cause
) {
}
