package com.questrail.dbus.model;

/**
 * Symbolic error names produced or interpreted by this library.
 */
public final class ErrorNames
{
    /** Synthesized when a pending call's timeout elapses before its reply. */
    public static final String NO_REPLY = "org.freedesktop.DBus.Error.NoReply";

    /** Sent when a method call matched no handler in any chain. */
    public static final String UNKNOWN_METHOD = "org.freedesktop.DBus.Error.UnknownMethod";

    /** Sent by the bus when a call names a destination nobody owns. */
    public static final String SERVICE_UNKNOWN = "org.freedesktop.DBus.Error.ServiceUnknown";

    public static final String INVALID_ARGS = "org.freedesktop.DBus.Error.InvalidArgs";

    public static final String INVALID_SIGNATURE = "org.freedesktop.DBus.Error.InvalidSignature";

    /** Pending calls still outstanding when their connection closes. */
    public static final String DISCONNECTED = "org.freedesktop.DBus.Error.Disconnected";

    /** Generic reply for a method handler that failed with a non-bus exception. */
    public static final String UNCAUGHT_EXCEPTION = "com.questrail.dbus.Error.UncaughtException";

    private ErrorNames() {
    }
}
