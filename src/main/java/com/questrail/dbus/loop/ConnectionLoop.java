package com.questrail.dbus.loop;

import com.questrail.dbus.model.Message;
import com.questrail.dbus.transport.Connection;

import java.util.concurrent.CompletableFuture;

/**
 * ConnectionLoop
 * =============================================================================
 * An {@link EventLoop} that also defines how a connection façade schedules
 * work around it.
 *
 * <p>A {@code DBusConnection} is given one of these at construction; choosing
 * {@code SelectLoop} or {@code NettyEventLoop} selects the whole concurrency
 * model (who runs handlers, how a blocking call waits) without subclassing.</p>
 */
public interface ConnectionLoop extends EventLoop
{
    /**
     * Associate the loop with the connection it will drain. Called once,
     * before the loop is installed on that connection.
     *
     * @throws IllegalStateException if already bound
     */
    void bind(Connection connection);

    /**
     * Run the handling of one inbound message in its own execution context.
     * Failures escaping the task are logged by the loop.
     */
    void spawn(Runnable task);

    /**
     * Suspend the calling context until {@code reply} completes, while
     * letting the loop keep dispatching (the reply itself arrives through a
     * dispatch pass).
     *
     * @return the completed reply
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Message await(CompletableFuture<Message> reply) throws InterruptedException;

    /**
     * Release loop resources. The bound connection is not closed.
     */
    void close();
}
