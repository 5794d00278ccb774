package com.questrail.dbus.config;

import com.questrail.dbus.observability.BusObservabilitySink;
import com.questrail.dbus.observability.NullObservabilitySink;
import com.questrail.dbus.observability.Slf4jBusObservabilitySink;

import java.time.Duration;
import java.util.Objects;

/**
 * DBusConnectionConfig
 * -----------------------------------------------------------------------------
 * Operational settings for a {@code DBusConnection}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>defaultCallTimeout</b>: reply timeout for calls that do not set
 *       their own. After it elapses the caller receives a
 *       {@code NoReply} error.</li>
 *   <li><b>idlePollInterval</b>: longest single poll of the portable loop
 *       when no timer is armed; bounds how long a stop request can go
 *       unnoticed.</li>
 *   <li><b>replyUnknownMethod</b>: answer method calls that no handler chain
 *       accepts with {@code UnknownMethod}. When off, such calls get no
 *       reply at all and the caller eventually times out.</li>
 *   <li><b>observabilitySink</b>: receives handler failures and unhandled
 *       messages.</li>
 * </ul>
 */
public record DBusConnectionConfig(
        Duration defaultCallTimeout,
        Duration idlePollInterval,
        boolean replyUnknownMethod,
        BusObservabilitySink observabilitySink
) {
    public DBusConnectionConfig {
        Objects.requireNonNull(defaultCallTimeout, "defaultCallTimeout");
        Objects.requireNonNull(idlePollInterval, "idlePollInterval");

        if (defaultCallTimeout.isNegative() || defaultCallTimeout.isZero()) {
            throw new IllegalArgumentException("defaultCallTimeout must be positive");
        }
        if (defaultCallTimeout.toMillis() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("defaultCallTimeout too large: " + defaultCallTimeout);
        }
        if (idlePollInterval.isNegative() || idlePollInterval.isZero()) {
            throw new IllegalArgumentException("idlePollInterval must be positive");
        }
        if (observabilitySink == null) {
            observabilitySink = NullObservabilitySink.INSTANCE;
        }
    }

    /**
     * 25 s call timeout, 4 s idle poll, {@code UnknownMethod} replies on,
     * failures logged through SLF4J.
     */
    public static DBusConnectionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration defaultCallTimeout = Duration.ofSeconds(25);
        private Duration idlePollInterval = Duration.ofSeconds(4);
        private boolean replyUnknownMethod = true;
        private BusObservabilitySink observabilitySink = new Slf4jBusObservabilitySink();

        public Builder withDefaultCallTimeout(Duration defaultCallTimeout) {
            this.defaultCallTimeout = defaultCallTimeout;
            return this;
        }

        public Builder withIdlePollInterval(Duration idlePollInterval) {
            this.idlePollInterval = idlePollInterval;
            return this;
        }

        public Builder withReplyUnknownMethod(boolean replyUnknownMethod) {
            this.replyUnknownMethod = replyUnknownMethod;
            return this;
        }

        public Builder withObservabilitySink(BusObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public DBusConnectionConfig build() {
            return new DBusConnectionConfig(defaultCallTimeout, idlePollInterval, replyUnknownMethod, observabilitySink);
        }
    }
}
