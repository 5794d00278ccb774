package com.questrail.dbus.observability;

/**
 * No-op implementation of BusObservabilitySink.
 */
public final class NullObservabilitySink implements BusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onHandlerFailure(HandlerFailureEvent event) {}

    @Override
    public void onUnhandledMessage(UnhandledMessageEvent event) {}

    @Override
    public void onError(BusErrorEvent event) {}
}
