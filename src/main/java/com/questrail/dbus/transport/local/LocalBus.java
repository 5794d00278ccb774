package com.questrail.dbus.transport.local;

import com.questrail.dbus.model.ErrorNames;
import com.questrail.dbus.model.Message;
import com.questrail.dbus.model.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * LocalBus
 * =============================================================================
 * In-process bus daemon for {@link LocalConnection}s.
 *
 * <p>Routing is deliberately minimal:</p>
 * <ul>
 *   <li>a message with a destination goes to the connection holding that
 *       unique name;</li>
 *   <li>a signal without a destination goes to every attached connection
 *       except its sender;</li>
 *   <li>a method call that cannot be delivered is answered by the bus with
 *       {@link ErrorNames#SERVICE_UNKNOWN} unless it asked for no reply;
 *       undeliverable replies and signals are dropped.</li>
 * </ul>
 *
 * <p>Well-known name ownership and match rules are not modelled.</p>
 *
 * <p>Thread-safe. Delivery never blocks: it only queues on the target.</p>
 */
public final class LocalBus
{
    /** Sender name used on messages originated by the bus itself. */
    public static final String BUS_NAME = "org.freedesktop.DBus";

    private static final Logger log = LoggerFactory.getLogger(LocalBus.class);

    private final AtomicLong nextConnectionId = new AtomicLong(1);
    private final AtomicLong busSerials = new AtomicLong();
    private final Map<String, LocalConnection> connections = new ConcurrentHashMap<>();

    /**
     * Create a connection to this bus and open it.
     */
    public LocalConnection connect() {
        LocalConnection connection = new LocalConnection(this);
        connection.open();
        return connection;
    }

    /**
     * @return the unique names of all currently attached connections
     */
    public Set<String> names() {
        return new TreeSet<>(connections.keySet());
    }

    String attach(LocalConnection connection) {
        String name = ":1." + nextConnectionId.getAndIncrement();
        connections.put(name, connection);
        log.debug("Attached {}", name);
        return name;
    }

    void detach(String name) {
        if (connections.remove(name) != null) {
            log.debug("Detached {}", name);
        }
    }

    void route(Message message) {
        Objects.requireNonNull(message, "message");

        String destination = message.destination();
        if (destination != null) {
            LocalConnection target = connections.get(destination);
            if (target != null) {
                target.deliver(message);
            } else {
                undeliverable(message, "The name " + destination + " was not provided by any service");
            }
            return;
        }

        if (message.type() == MessageType.SIGNAL) {
            for (Map.Entry<String, LocalConnection> entry : connections.entrySet()) {
                if (!entry.getKey().equals(message.sender())) {
                    entry.getValue().deliver(message);
                }
            }
            return;
        }

        undeliverable(message, "Message has no destination");
    }

    private void undeliverable(Message message, String reason) {
        if (message.type() != MessageType.METHOD_CALL || message.isNoReply()) {
            log.debug("Dropping undeliverable {}", message);
            return;
        }

        LocalConnection caller = message.sender() == null ? null : connections.get(message.sender());
        if (caller == null) {
            return;
        }

        Message error = Message.error(message, ErrorNames.SERVICE_UNKNOWN)
                .sender(BUS_NAME)
                .args("s", reason)
                .build()
                .withSerial(busSerials.incrementAndGet());
        caller.deliver(error);
    }
}
