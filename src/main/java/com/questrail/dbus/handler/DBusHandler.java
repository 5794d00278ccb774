package com.questrail.dbus.handler;

import com.questrail.dbus.DBusConnection;
import com.questrail.dbus.internal.time.SystemWallClock;
import com.questrail.dbus.internal.time.WallClock;
import com.questrail.dbus.model.DBusException;
import com.questrail.dbus.model.ErrorNames;
import com.questrail.dbus.model.Message;
import com.questrail.dbus.model.MessageType;
import com.questrail.dbus.observability.BusObservabilitySink;
import com.questrail.dbus.observability.HandlerFailureEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DBusHandler
 * =============================================================================
 * Table of method and signal handlers for one object or service, built once.
 *
 * <pre>{@code
 * DBusHandler echo = DBusHandler.builder()
 *     .add(HandlerRegistration.method("Echo")
 *             .interfaceName("com.example.Echo")
 *             .replySignature("i")
 *             .handledBy(ctx -> ctx.reply(ctx.args().get(0))))
 *     .signal("Changed", ctx -> log.info("changed: {}", ctx.args()))
 *     .build();
 * connection.addHandler(echo);
 * }</pre>
 *
 * <h2>Selection</h2>
 * Handlers are looked up by member name; among the registrations for that
 * member the first one (in registration order) whose interface and path
 * match is chosen. Method calls and signals use separate tables.
 *
 * <h2>Replies</h2>
 * For a method call exactly one reply is sent unless the call carries the
 * no-reply flag:
 * <ul>
 *   <li>handler returns: a method return with the values given to
 *       {@link HandlerContext#reply}, or an empty one;</li>
 *   <li>those values do not match their signature:
 *       {@link ErrorNames#INVALID_ARGS};</li>
 *   <li>handler throws {@link DBusException}: an error with its name;</li>
 *   <li>handler throws anything else: {@link ErrorNames#UNCAUGHT_EXCEPTION},
 *       and the failure is reported to the observability sink.</li>
 * </ul>
 * A failing signal handler is only reported.
 *
 * <p>Immutable and safe to share between connections and threads.</p>
 */
public final class DBusHandler
{
    private final Map<String, List<HandlerRegistration>> methods;
    private final Map<String, List<HandlerRegistration>> signals;
    private final WallClock wallClock;

    private DBusHandler(Builder builder) {
        this.methods = freeze(builder.methods);
        this.signals = freeze(builder.signals);
        this.wallClock = builder.wallClock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Offer a message to this handler.
     *
     * @return {@code true} if a registration matched and was invoked
     */
    public boolean dispatch(DBusConnection connection, Message message) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(message, "message");

        if (message.type() == MessageType.METHOD_CALL) {
            HandlerRegistration registration = select(methods, message);
            if (registration == null) {
                return false;
            }
            invokeMethod(connection, message, registration);
            return true;
        }
        if (message.type() == MessageType.SIGNAL) {
            HandlerRegistration registration = select(signals, message);
            if (registration == null) {
                return false;
            }
            invokeSignal(connection, message, registration);
            return true;
        }
        return false;
    }

    public List<HandlerRegistration> registrations() {
        List<HandlerRegistration> all = new ArrayList<>();
        methods.values().forEach(all::addAll);
        signals.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    private static HandlerRegistration select(Map<String, List<HandlerRegistration>> table, Message message) {
        List<HandlerRegistration> candidates = table.get(message.member());
        if (candidates == null) {
            return null;
        }
        for (HandlerRegistration r : candidates) {
            if (r.matches(message)) {
                return r;
            }
        }
        return null;
    }

    private void invokeMethod(DBusConnection connection, Message call, HandlerRegistration registration) {
        HandlerContext context = new HandlerContext(connection, call, registration.replySignature());
        try {
            registration.handler().handle(context);
        } catch (DBusException e) {
            replyError(connection, call, e.errorName(), detailOf(e));
            return;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            report(connection, call, e);
            replyError(connection, call, ErrorNames.UNCAUGHT_EXCEPTION, e.toString());
            return;
        }

        if (call.isNoReply()) {
            return;
        }
        try {
            connection.sendMethodReturn(call, context.responseSignature(), context.responseArgs());
        } catch (DBusException e) {
            connection.sendError(call, ErrorNames.INVALID_ARGS, e.getMessage());
        }
    }

    private void invokeSignal(DBusConnection connection, Message signal, HandlerRegistration registration) {
        try {
            registration.handler().handle(new HandlerContext(connection, signal, null));
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            report(connection, signal, e);
        }
    }

    private static void replyError(DBusConnection connection, Message call, String errorName, String detail) {
        if (!call.isNoReply()) {
            connection.sendError(call, errorName, detail);
        }
    }

    private void report(DBusConnection connection, Message message, Exception cause) {
        BusObservabilitySink sink = connection.config().observabilitySink();
        sink.onHandlerFailure(new HandlerFailureEvent(wallClock.now(), message, cause));
    }

    private static String detailOf(DBusException e) {
        for (Object arg : e.args()) {
            if (arg instanceof String) {
                return (String) arg;
            }
        }
        return null;
    }

    // HashMap-backed: Map.copyOf rejects get(null) lookups.
    private static Map<String, List<HandlerRegistration>> freeze(Map<String, List<HandlerRegistration>> source) {
        Map<String, List<HandlerRegistration>> copy = new HashMap<>();
        source.forEach((member, list) -> copy.put(member, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder
    {
        private final Map<String, List<HandlerRegistration>> methods = new HashMap<>();
        private final Map<String, List<HandlerRegistration>> signals = new HashMap<>();
        private WallClock wallClock = SystemWallClock.INSTANCE;

        private Builder() {
        }

        public Builder add(HandlerRegistration registration) {
            Objects.requireNonNull(registration, "registration");
            Map<String, List<HandlerRegistration>> table =
                    registration.kind() == HandlerRegistration.Kind.METHOD ? methods : signals;
            table.computeIfAbsent(registration.member(), k -> new ArrayList<>()).add(registration);
            return this;
        }

        /** Method handler for any interface and path, with an empty return signature. */
        public Builder method(String member, MessageHandler handler) {
            return add(HandlerRegistration.method(member).handledBy(handler));
        }

        public Builder signal(String member, MessageHandler handler) {
            return add(HandlerRegistration.signal(member).handledBy(handler));
        }

        /** Timestamps for failure events. */
        public Builder wallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public DBusHandler build() {
            return new DBusHandler(this);
        }
    }
}
