package com.questrail.dbus.transport;

/**
 * Whether a connection holds decoded messages awaiting delivery.
 */
public enum DispatchStatus
{
    /** At least one message is queued; {@link Connection#dispatch()} will deliver it. */
    DATA_REMAINS,

    /** Nothing queued. */
    COMPLETE,

    /** The transport could not allocate while decoding; retry after the next event. */
    NEED_MEMORY
}
