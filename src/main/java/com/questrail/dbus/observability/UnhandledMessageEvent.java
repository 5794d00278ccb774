package com.questrail.dbus.observability;

import com.questrail.dbus.model.Message;

import java.time.Instant;

/**
 * Record describing a message nobody claimed.
 *
 * @param errorReplySent {@code true} if an unknown-method error was sent back
 *                       to the caller
 */
public record UnhandledMessageEvent(
    Instant timestamp,
    Message message,
    boolean errorReplySent
) {
}
