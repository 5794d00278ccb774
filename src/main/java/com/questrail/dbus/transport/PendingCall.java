package com.questrail.dbus.transport;

import com.questrail.dbus.model.Message;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * PendingCall
 * =============================================================================
 * An outstanding method call awaiting its correlated reply.
 *
 * <h2>Single resolution</h2>
 * A pending call resolves exactly once: with the reply whose reply-serial
 * matches {@link #serial()}, with a synthesized timeout error, or by
 * {@link #cancel()}. The first of these wins; later attempts are ignored.
 * The notify callback runs exactly once for a resolved call, whether it was
 * registered before or after resolution, and never for a cancelled one.
 */
public final class PendingCall
{
    private final long serial;
    private final Runnable onCancel;

    private Message reply;
    private Consumer<Message> notify;
    private boolean notified;
    private boolean cancelled;

    /**
     * @param serial   serial of the outgoing call
     * @param onCancel invoked once if the call is cancelled before resolution,
     *                 so the connection can forget it
     */
    public PendingCall(long serial, Runnable onCancel) {
        this.serial = serial;
        this.onCancel = Objects.requireNonNull(onCancel, "onCancel");
    }

    public long serial() {
        return serial;
    }

    /**
     * Register the continuation. If the reply is already present the callback
     * runs immediately on the calling thread.
     */
    public void setNotify(Consumer<Message> callback) {
        Objects.requireNonNull(callback, "callback");
        Message ready;
        synchronized (this) {
            if (notify != null) {
                throw new IllegalStateException("notify already set for serial " + serial);
            }
            notify = callback;
            ready = claimNotification();
        }
        if (ready != null) {
            callback.accept(ready);
        }
    }

    /**
     * Resolve with a reply. Called by the owning connection.
     *
     * @return {@code false} if the call was already resolved or cancelled
     */
    public boolean complete(Message reply) {
        Objects.requireNonNull(reply, "reply");
        Consumer<Message> callback;
        Message ready;
        synchronized (this) {
            if (this.reply != null || cancelled) {
                return false;
            }
            this.reply = reply;
            callback = notify;
            ready = claimNotification();
        }
        if (ready != null) {
            callback.accept(ready);
        }
        return true;
    }

    /**
     * Give up on the reply. No callback will run afterwards.
     */
    public void cancel() {
        synchronized (this) {
            if (reply != null || cancelled) {
                return;
            }
            cancelled = true;
        }
        onCancel.run();
    }

    public synchronized boolean isCompleted() {
        return reply != null;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized Optional<Message> reply() {
        return Optional.ofNullable(reply);
    }

    private Message claimNotification() {
        if (notify != null && reply != null && !notified) {
            notified = true;
            return reply;
        }
        return null;
    }
}
