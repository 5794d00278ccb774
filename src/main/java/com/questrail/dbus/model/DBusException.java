package com.questrail.dbus.model;

import java.util.List;
import java.util.Objects;

/**
 * A bus-level failure identified by a symbolic error name.
 *
 * <p>Raised to synchronous callers when the reply to their call is an
 * error-kind message, raised by argument validation, and thrown by method
 * handlers that want a specific error name sent back to the caller.</p>
 */
public final class DBusException extends RuntimeException
{
    private final String errorName;
    private final List<Object> args;

    public DBusException(String errorName) {
        this(errorName, null, null);
    }

    public DBusException(String errorName, String detail) {
        this(errorName, detail, null);
    }

    public DBusException(String errorName, String detail, Throwable cause) {
        super(detail == null ? errorName : errorName + ": " + detail, cause);
        this.errorName = Objects.requireNonNull(errorName, "errorName");
        this.args = detail == null ? List.of() : List.of(detail);
    }

    private DBusException(Message reply) {
        super(describe(reply));
        this.errorName = reply.errorName();
        this.args = reply.args();
    }

    /**
     * Convert an error-kind reply into an exception.
     */
    public static DBusException fromReply(Message reply) {
        Objects.requireNonNull(reply, "reply");
        if (reply.type() != MessageType.ERROR) {
            throw new IllegalArgumentException("not an error reply: " + reply.type());
        }
        return new DBusException(reply);
    }

    public String errorName() {
        return errorName;
    }

    /**
     * Arguments of the error reply; by convention a single human-readable
     * string when present.
     */
    public List<Object> args() {
        return args;
    }

    private static String describe(Message reply) {
        if (!reply.args().isEmpty() && reply.args().get(0) instanceof String) {
            return reply.errorName() + ": " + reply.args().get(0);
        }
        return reply.errorName();
    }
}
