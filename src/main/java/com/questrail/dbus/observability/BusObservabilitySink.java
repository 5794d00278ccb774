package com.questrail.dbus.observability;

/**
 * Receives diagnostic events from the dispatch engine.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from any thread that dispatches messages; an
 * implementation shared between connections must be thread-safe.</p>
 */
public interface BusObservabilitySink {
    /**
     * A method or signal handler threw. For method calls the caller has
     * already been sent an error reply.
     */
    void onHandlerFailure(HandlerFailureEvent event);

    /**
     * A message reached the outermost dispatch boundary without being
     * claimed by any handler chain, or a reply arrived with no pending call.
     */
    void onUnhandledMessage(UnhandledMessageEvent event);

    /**
     * An error outside any single handler (a failed reply send, a failing
     * loop task).
     */
    void onError(BusErrorEvent event);
}
