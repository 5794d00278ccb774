package com.questrail.dbus.transport;

import com.questrail.dbus.loop.EventLoop;
import com.questrail.dbus.model.Message;

/**
 * Connection
 * =============================================================================
 * Transport-level connection to a bus, as consumed by the dispatch engine.
 *
 * <p>The transport owns serial numbering, the incoming and outgoing message
 * queues, pending-call correlation and the watches and timeouts it needs.
 * It never runs its own thread: all progress happens when the installed
 * {@link EventLoop} reports readiness or expiry and when someone calls
 * {@link #dispatch()}.</p>
 *
 * <h2>Dispatch contract</h2>
 * {@link #dispatch()} delivers one queued message. A reply (return or error)
 * whose reply-serial matches a live {@link PendingCall} resolves that call;
 * every other message is offered to the filters in registration order.
 */
public interface Connection
{
    /** Default reply timeout used by {@link #sendWithReply} when given {@code -1}. */
    int DEFAULT_TIMEOUT_MILLIS = 25_000;

    /**
     * Attach to the bus. A closed connection may be opened again; it then
     * receives a new unique name.
     */
    void open();

    /**
     * Detach from the bus, remove all watches and timeouts from the loop and
     * cancel every pending call. Idempotent.
     */
    void close();

    boolean isOpen();

    /**
     * @return the bus-assigned unique name, e.g. {@code ":1.7"}
     * @throws IllegalStateException if the connection is not open
     */
    String uniqueName();

    /**
     * Queue a message for sending. The message is stamped with the next
     * serial and this connection's unique name as sender.
     *
     * @return the serial assigned to the message
     */
    long send(Message message);

    /**
     * Queue a method call and register a pending call for its reply.
     *
     * @param timeoutMillis reply timeout, or {@code -1} for
     *                      {@link #DEFAULT_TIMEOUT_MILLIS}
     */
    PendingCall sendWithReply(Message message, int timeoutMillis);

    DispatchStatus dispatchStatus();

    /**
     * Deliver at most one queued message.
     *
     * @return the status after this dispatch
     */
    DispatchStatus dispatch();

    /**
     * Push all buffered outgoing messages to the bus.
     */
    void flush();

    void addFilter(MessageFilter filter);

    void removeFilter(MessageFilter filter);

    /**
     * Install the event loop that will observe this connection's watches and
     * timeouts. Existing watches and timeouts are announced to it immediately.
     */
    void setLoop(EventLoop loop);
}
