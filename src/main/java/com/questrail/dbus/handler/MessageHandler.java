package com.questrail.dbus.handler;

/**
 * Callback bound to one member name in a {@link DBusHandler}.
 *
 * <p>Method handlers answer through {@link HandlerContext#reply}; returning
 * without calling it sends an empty method return (or one with the declared
 * reply signature and no values, which must then be empty). Throwing
 * {@link com.questrail.dbus.model.DBusException} sends that error name back;
 * any other exception is reported and answered with an
 * {@code UncaughtException} error.</p>
 */
@FunctionalInterface
public interface MessageHandler
{
    void handle(HandlerContext context) throws Exception;
}
