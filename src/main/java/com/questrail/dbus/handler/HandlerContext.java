package com.questrail.dbus.handler;

import com.questrail.dbus.DBusConnection;
import com.questrail.dbus.model.Message;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * HandlerContext
 * =============================================================================
 * What a handler sees for one dispatched message.
 *
 * <p>A new context is created for every dispatch and handed to exactly one
 * handler, so concurrent handlers never observe each other's responses.
 * Not thread-safe.</p>
 */
public final class HandlerContext
{
    private final DBusConnection connection;
    private final Message message;
    private final String declaredSignature;

    private String responseSignature;
    private List<?> responseArgs = List.of();

    HandlerContext(DBusConnection connection, Message message, String declaredSignature) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.message = Objects.requireNonNull(message, "message");
        this.declaredSignature = declaredSignature == null ? "" : declaredSignature;
        this.responseSignature = this.declaredSignature;
    }

    public DBusConnection connection() {
        return connection;
    }

    public Message message() {
        return message;
    }

    public List<Object> args() {
        return message.args();
    }

    /**
     * Set the method return values using the registration's reply signature.
     * The return is sent after the handler returns; validation happens then.
     */
    public void reply(Object... values) {
        reply(declaredSignature, Arrays.asList(values));
    }

    /**
     * Set the method return values with an explicit signature.
     */
    public void reply(String signature, List<?> values) {
        this.responseSignature = Objects.requireNonNull(signature, "signature");
        this.responseArgs = values == null ? List.of() : values;
    }

    String responseSignature() {
        return responseSignature;
    }

    List<?> responseArgs() {
        return responseArgs;
    }
}
