package com.questrail.dbus.config;

import com.questrail.dbus.observability.NullObservabilitySink;
import com.questrail.dbus.observability.Slf4jBusObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DBusConnectionConfigTest
 * -----------------------------------------------------------------------------
 * Validates connection configuration defaults and canonical constructor checks.
 */
class DBusConnectionConfigTest {

    @Test
    void defaultsMatchBusConventions() {
        DBusConnectionConfig config = DBusConnectionConfig.defaults();

        assertEquals(Duration.ofSeconds(25), config.defaultCallTimeout());
        assertEquals(Duration.ofSeconds(4), config.idlePollInterval());
        assertTrue(config.replyUnknownMethod());
        assertInstanceOf(Slf4jBusObservabilitySink.class, config.observabilitySink());
    }

    @Test
    void builderOverridesEachField() {
        DBusConnectionConfig config = DBusConnectionConfig.builder()
                .withDefaultCallTimeout(Duration.ofMillis(500))
                .withIdlePollInterval(Duration.ofMillis(20))
                .withReplyUnknownMethod(false)
                .withObservabilitySink(NullObservabilitySink.INSTANCE)
                .build();

        assertEquals(Duration.ofMillis(500), config.defaultCallTimeout());
        assertEquals(Duration.ofMillis(20), config.idlePollInterval());
        assertFalse(config.replyUnknownMethod());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
    }

    @Test
    void nullSinkBecomesNullObject() {
        DBusConnectionConfig config = new DBusConnectionConfig(
                Duration.ofSeconds(1), Duration.ofSeconds(1), true, null);

        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
    }

    @Test
    void canonicalConstructorRejectsNullDurations() {
        assertThrows(NullPointerException.class, () ->
                new DBusConnectionConfig(null, Duration.ofSeconds(1), true, null));
        assertThrows(NullPointerException.class, () ->
                new DBusConnectionConfig(Duration.ofSeconds(1), null, true, null));
    }

    @Test
    void canonicalConstructorRejectsNonPositiveDurations() {
        assertThrows(IllegalArgumentException.class, () ->
                new DBusConnectionConfig(Duration.ZERO, Duration.ofSeconds(1), true, null));
        assertThrows(IllegalArgumentException.class, () ->
                new DBusConnectionConfig(Duration.ofSeconds(1), Duration.ofMillis(-5), true, null));
    }

    @Test
    void callTimeoutMustFitInMilliseconds() {
        assertThrows(IllegalArgumentException.class, () ->
                new DBusConnectionConfig(Duration.ofDays(30), Duration.ofSeconds(1), true, null));
    }
}
