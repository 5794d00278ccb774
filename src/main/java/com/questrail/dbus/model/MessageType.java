package com.questrail.dbus.model;

/**
 * The four message kinds carried by the bus.
 */
public enum MessageType
{
    METHOD_CALL,
    METHOD_RETURN,
    ERROR,
    SIGNAL;

    /**
     * @return {@code true} for kinds that answer an earlier method call and
     *         are correlated by reply-serial rather than routed to handlers
     */
    public boolean isReply() {
        return this == METHOD_RETURN || this == ERROR;
    }
}
