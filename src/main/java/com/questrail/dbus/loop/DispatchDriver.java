package com.questrail.dbus.loop;

import com.questrail.dbus.transport.Connection;
import com.questrail.dbus.transport.DispatchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a connection's dispatch queue to empty.
 *
 * <p>Called by the reactors after every I/O or timer event, and by a
 * synchronous call's wait path so a blocking call on a single-threaded
 * reactor still makes progress.</p>
 */
public final class DispatchDriver
{
    private static final Logger log = LoggerFactory.getLogger(DispatchDriver.class);

    private DispatchDriver() {
    }

    /**
     * Dispatch messages one at a time while the connection reports
     * {@link DispatchStatus#DATA_REMAINS}. A failure while dispatching one
     * message is logged and the next message is dispatched.
     *
     * @return the number of messages dispatched
     */
    public static int drain(Connection connection) {
        int dispatched = 0;
        while (connection.dispatchStatus() == DispatchStatus.DATA_REMAINS) {
            try {
                connection.dispatch();
            } catch (RuntimeException e) {
                log.error("Dispatching a message failed; continuing with the next", e);
            }
            dispatched++;
        }
        return dispatched;
    }
}
