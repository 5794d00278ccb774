package com.questrail.dbus.transport;

import com.questrail.dbus.model.Message;

/**
 * Receives every dispatched message that is not a reply to a live pending
 * call. Filters run in registration order until one returns {@code true}.
 */
@FunctionalInterface
public interface MessageFilter
{
    /**
     * @return {@code true} if the message was handled and later filters
     *         should not see it
     */
    boolean filter(Message message);
}
