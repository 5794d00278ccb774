package com.questrail.dbus;

import com.questrail.dbus.config.DBusConnectionConfig;
import com.questrail.dbus.handler.DBusHandler;
import com.questrail.dbus.internal.time.SystemMonotonicClock;
import com.questrail.dbus.internal.time.SystemWallClock;
import com.questrail.dbus.internal.time.WallClock;
import com.questrail.dbus.loop.ConnectionLoop;
import com.questrail.dbus.loop.netty.NettyEventLoop;
import com.questrail.dbus.loop.select.SelectLoop;
import com.questrail.dbus.model.DBusException;
import com.questrail.dbus.model.ErrorNames;
import com.questrail.dbus.model.Message;
import com.questrail.dbus.model.MessageType;
import com.questrail.dbus.observability.BusErrorEvent;
import com.questrail.dbus.observability.BusObservabilitySink;
import com.questrail.dbus.observability.UnhandledMessageEvent;
import com.questrail.dbus.transport.Connection;
import com.questrail.dbus.transport.PendingCall;
import io.netty.channel.nio.NioEventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * DBusConnection
 * =============================================================================
 * Application-facing access to a message bus.
 *
 * <p>Wraps a transport {@link Connection} and a {@link ConnectionLoop}; the
 * loop decides the concurrency model:</p>
 * <ul>
 *   <li>{@link #simple(Connection)}: a {@link SelectLoop}. Handlers run one
 *       at a time on whichever thread drives the loop, and a synchronous call
 *       drives it itself while it waits.</li>
 *   <li>{@link #netty(Connection, NioEventLoop)}: a {@link NettyEventLoop}.
 *       The connection lives on an existing Netty reactor and every inbound
 *       message is handled on its own handler thread.</li>
 * </ul>
 *
 * <h2>Inbound messages</h2>
 * Replies go to the call that is waiting for them and never reach a handler.
 * A method call is offered to each handler chain in turn until one accepts
 * it; if none does and the caller wants a reply, this connection answers
 * with {@link ErrorNames#UNKNOWN_METHOD} (see
 * {@link DBusConnectionConfig#replyUnknownMethod()}). A signal is offered to
 * every chain, and a failure in one chain does not keep it from the next.
 *
 * <h2>Outbound calls</h2>
 * <ul>
 *   <li>{@link #send(MethodCall)}: fire and forget.</li>
 *   <li>{@link #callAsync(MethodCall, ReplyCallback)}: continuation runs once
 *       with the reply or a {@code NoReply} timeout error.</li>
 *   <li>{@link #callFuture(MethodCall)}: the same as a future.</li>
 *   <li>{@link #callForReply(MethodCall)} / {@link #call(MethodCall)}: block
 *       the caller; error replies are raised as {@link DBusException}.</li>
 * </ul>
 */
public final class DBusConnection implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(DBusConnection.class);

    private final Connection transport;
    private final ConnectionLoop loop;
    private final DBusConnectionConfig config;
    private final BusObservabilitySink sink;
    private final WallClock wallClock = SystemWallClock.INSTANCE;

    private final List<DBusHandler> handlers = new CopyOnWriteArrayList<>();

    public DBusConnection(Connection transport, ConnectionLoop loop, DBusConnectionConfig config) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();

        loop.bind(transport);
        transport.addFilter(this::onMessage);
        transport.setLoop(loop);
    }

    public static DBusConnection simple(Connection transport) {
        return simple(transport, DBusConnectionConfig.defaults());
    }

    public static DBusConnection simple(Connection transport, DBusConnectionConfig config) {
        SelectLoop loop = new SelectLoop(SystemMonotonicClock.INSTANCE, config.idlePollInterval());
        return new DBusConnection(transport, loop, config);
    }

    public static DBusConnection netty(Connection transport, NioEventLoop eventLoop) {
        return netty(transport, eventLoop, DBusConnectionConfig.defaults());
    }

    public static DBusConnection netty(Connection transport, NioEventLoop eventLoop, DBusConnectionConfig config) {
        return new DBusConnection(transport, new NettyEventLoop(eventLoop), config);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Open the transport if it is not open yet.
     */
    public void open() {
        if (!transport.isOpen()) {
            transport.open();
        }
    }

    /**
     * Flush and close the transport. Outstanding calls are resolved with a
     * {@code Disconnected} error. The connection can be {@linkplain #open()
     * opened} again.
     */
    public void disconnect() {
        if (transport.isOpen()) {
            transport.flush();
            transport.close();
        }
    }

    /**
     * Disconnect and release the loop.
     */
    @Override
    public void close() {
        disconnect();
        loop.close();
    }

    public String uniqueName() {
        return transport.uniqueName();
    }

    public void flush() {
        transport.flush();
    }

    public ConnectionLoop loop() {
        return loop;
    }

    public DBusConnectionConfig config() {
        return config;
    }

    // -------------------------------------------------------------------------
    // Handler chains
    // -------------------------------------------------------------------------

    public void addHandler(DBusHandler handler) {
        handlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public void removeHandler(DBusHandler handler) {
        handlers.remove(handler);
    }

    private boolean onMessage(Message message) {
        if (message.type().isReply()) {
            // Late reply to a call that already timed out or was cancelled.
            sink.onUnhandledMessage(new UnhandledMessageEvent(wallClock.now(), message, false));
            return true;
        }
        loop.spawn(() -> route(message));
        return true;
    }

    private void route(Message message) {
        if (message.type() == MessageType.METHOD_CALL) {
            routeMethodCall(message);
        } else {
            routeSignal(message);
        }
    }

    private void routeMethodCall(Message call) {
        for (DBusHandler handler : handlers) {
            try {
                if (handler.dispatch(this, call)) {
                    return;
                }
            } catch (RuntimeException e) {
                sink.onError(new BusErrorEvent(wallClock.now(), "handler chain failed on " + call, e));
                return;
            }
        }

        boolean reply = config.replyUnknownMethod() && !call.isNoReply();
        if (reply) {
            sendError(call, ErrorNames.UNKNOWN_METHOD, "No handler for "
                    + (call.interfaceName() == null ? "" : call.interfaceName() + ".")
                    + call.member() + " at " + call.path());
        }
        sink.onUnhandledMessage(new UnhandledMessageEvent(wallClock.now(), call, reply));
    }

    private void routeSignal(Message signal) {
        boolean handled = false;
        for (DBusHandler handler : handlers) {
            try {
                handled |= handler.dispatch(this, signal);
            } catch (RuntimeException e) {
                sink.onError(new BusErrorEvent(wallClock.now(), "handler chain failed on " + signal, e));
            }
        }
        if (!handled) {
            sink.onUnhandledMessage(new UnhandledMessageEvent(wallClock.now(), signal, false));
        }
    }

    // -------------------------------------------------------------------------
    // Calls
    // -------------------------------------------------------------------------

    /**
     * Send a method call flagged as not expecting a reply.
     *
     * @return the serial assigned to the call
     */
    public long send(MethodCall call) {
        Objects.requireNonNull(call, "call");
        return transport.send(call.toMessage(true));
    }

    public PendingCall callAsync(MethodCall call, ReplyCallback callback) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(callback, "callback");

        PendingCall pending = transport.sendWithReply(call.toMessage(false), timeoutMillis(call));
        pending.setNotify(reply -> {
            try {
                callback.onReply(reply);
            } catch (RuntimeException e) {
                sink.onError(new BusErrorEvent(wallClock.now(), "reply callback failed for " + call.member(), e));
            }
        });
        return pending;
    }

    /**
     * Cancelling the returned future cancels the pending call.
     */
    public CompletableFuture<Message> callFuture(MethodCall call) {
        CompletableFuture<Message> future = new CompletableFuture<>();
        PendingCall pending = callAsync(call, future::complete);
        future.whenComplete((reply, failure) -> {
            if (future.isCancelled()) {
                pending.cancel();
            }
        });
        return future;
    }

    /**
     * Send a call and wait for its reply.
     *
     * @return the method return
     * @throws DBusException the error reply, {@code NoReply} on timeout or
     *         interruption, {@code Disconnected} if the connection closes
     */
    public Message callForReply(MethodCall call) {
        CompletableFuture<Message> future = new CompletableFuture<>();
        PendingCall pending = callAsync(call, future::complete);

        Message reply;
        try {
            reply = loop.await(future);
        } catch (InterruptedException e) {
            pending.cancel();
            Thread.currentThread().interrupt();
            throw new DBusException(ErrorNames.NO_REPLY, "interrupted while waiting for " + call.member(), e);
        } catch (RuntimeException e) {
            pending.cancel();
            throw e;
        }

        if (reply.type() == MessageType.ERROR) {
            throw DBusException.fromReply(reply);
        }
        return reply;
    }

    /**
     * {@link #callForReply} returning only the reply's arguments.
     */
    public List<Object> call(MethodCall call) {
        return callForReply(call).args();
    }

    // -------------------------------------------------------------------------
    // Direct sends
    // -------------------------------------------------------------------------

    /**
     * Emit a signal.
     *
     * @param member        member name, or {@code interface.Member}, in which
     *                      case the prefix is the interface
     * @param interfaceName interface when {@code member} carries none
     * @param destination   unicast target, or {@code null} to broadcast
     * @throws IllegalArgumentException if no interface is given either way
     */
    public long sendSignal(String path, String member, String interfaceName,
                           String signature, List<?> args, String destination) {
        Objects.requireNonNull(member, "member");
        String iface = interfaceName;
        String name = member;
        int dot = member.lastIndexOf('.');
        if (dot > 0) {
            iface = member.substring(0, dot);
            name = member.substring(dot + 1);
        }
        if (iface == null) {
            throw new IllegalArgumentException("a signal needs an interface: " + member);
        }

        Message signal = Message.signal(path, iface, name)
                .destination(destination)
                .args(signature == null ? "" : signature, args)
                .build();
        return transport.send(signal);
    }

    public long sendSignal(String path, String member, String interfaceName, String signature, List<?> args) {
        return sendSignal(path, member, interfaceName, signature, args, null);
    }

    /**
     * @throws DBusException {@code InvalidArgs} if {@code args} do not match
     *         {@code signature}; nothing is sent then
     */
    public long sendMethodReturn(Message call, String signature, List<?> args) {
        Message reply = Message.methodReturn(call)
                .args(signature == null ? "" : signature, args)
                .build();
        return transport.send(reply);
    }

    /**
     * @param detail human-readable message sent as the single string
     *               argument, or {@code null} for none
     */
    public long sendError(Message call, String errorName, String detail) {
        Message.Builder error = Message.error(call, errorName);
        if (detail != null) {
            error.args("s", detail);
        }
        log.debug("Replying {} to {}", errorName, call);
        return transport.send(error.build());
    }

    private int timeoutMillis(MethodCall call) {
        long millis = (call.timeout() != null ? call.timeout() : config.defaultCallTimeout()).toMillis();
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, millis));
    }
}
