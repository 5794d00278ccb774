package com.questrail.dbus.observability;

import com.questrail.dbus.model.Message;
import com.questrail.dbus.model.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BusObservabilitySink that emits logs via SLF4J.
 *
 * <p>All instances share the process-wide {@code com.questrail.dbus} logger.</p>
 */
public final class Slf4jBusObservabilitySink implements BusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger("com.questrail.dbus");

    @Override
    public void onHandlerFailure(HandlerFailureEvent event) {
        Message m = event.message();
        String where = m.type() == MessageType.SIGNAL ? "signal handler" : "method call";
        log.error("Uncaught exception in {} {}.{} at {}",
            where, m.interfaceName(), m.member(), m.path(), event.cause());
    }

    @Override
    public void onUnhandledMessage(UnhandledMessageEvent event) {
        if (event.errorReplySent()) {
            log.debug("No handler for {}; sent UnknownMethod", event.message());
        } else {
            log.debug("No handler for {}", event.message());
        }
    }

    @Override
    public void onError(BusErrorEvent event) {
        log.error("Bus error: {}", event.message(), event.cause());
    }
}
