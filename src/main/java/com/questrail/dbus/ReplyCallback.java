package com.questrail.dbus;

import com.questrail.dbus.model.Message;

/**
 * Continuation for {@link DBusConnection#callAsync}.
 *
 * <p>Invoked exactly once, with either the method return, the error reply,
 * or a synthesized {@code NoReply} error when the call timed out. It runs on
 * whatever thread dispatches the reply, normally the event loop's, and must
 * not block.</p>
 */
@FunctionalInterface
public interface ReplyCallback
{
    void onReply(Message reply);
}
