package com.questrail.dbus.handler;

import com.questrail.dbus.DBusConnection;
import com.questrail.dbus.config.DBusConnectionConfig;
import com.questrail.dbus.loop.RecordingEventLoop;
import com.questrail.dbus.model.DBusException;
import com.questrail.dbus.model.ErrorNames;
import com.questrail.dbus.model.Message;
import com.questrail.dbus.model.MessageType;
import com.questrail.dbus.observability.RecordingObservabilitySink;
import com.questrail.dbus.transport.local.LocalBus;
import com.questrail.dbus.transport.local.LocalConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DBusHandlerTest
 * -----------------------------------------------------------------------------
 * Dispatches messages straight into a handler table and inspects what the
 * caller receives.
 */
class DBusHandlerTest {

    private LocalBus bus;
    private RecordingObservabilitySink sink;
    private DBusConnection connection;
    private LocalConnection caller;
    private RecordingEventLoop callerLoop;
    private List<Message> received;
    private long nextSerial = 1;

    @BeforeEach
    void setUp() {
        bus = new LocalBus();
        sink = new RecordingObservabilitySink();
        connection = DBusConnection.simple(bus.connect(),
                DBusConnectionConfig.builder().withObservabilitySink(sink).build());
        caller = bus.connect();
        callerLoop = new RecordingEventLoop();
        caller.setLoop(callerLoop);
        received = new ArrayList<>();
        caller.addFilter(received::add);
    }

    @AfterEach
    void tearDown() {
        connection.close();
        caller.close();
    }

    private Message call(String member, String iface, String path, String sig, Object... args) {
        return Message.methodCall(path, member)
                .interfaceName(iface)
                .args(sig, args)
                .build()
                .withSerial(nextSerial++)
                .withSender(caller.uniqueName());
    }

    private List<Message> replies() {
        connection.flush();
        callerLoop.pump(caller);
        return received;
    }

    @Test
    void successSendsOneReturnWithDeclaredSignature() {
        DBusHandler handler = DBusHandler.builder()
                .add(HandlerRegistration.method("Echo")
                        .interfaceName("com.example.Echo")
                        .replySignature("i")
                        .handledBy(ctx -> ctx.reply(ctx.args().get(0))))
                .build();
        Message echo = call("Echo", "com.example.Echo", "/", "i", 42);

        assertTrue(handler.dispatch(connection, echo));

        List<Message> replies = replies();
        assertEquals(1, replies.size());
        assertEquals(MessageType.METHOD_RETURN, replies.get(0).type());
        assertEquals(echo.serial(), replies.get(0).replySerial());
        assertEquals("i", replies.get(0).signature());
        assertEquals(List.of(42), replies.get(0).args());
    }

    @Test
    void handlerWithoutResponseSendsEmptyReturn() {
        DBusHandler handler = DBusHandler.builder().method("Ping", ctx -> { }).build();

        handler.dispatch(connection, call("Ping", null, "/", ""));

        List<Message> replies = replies();
        assertEquals(1, replies.size());
        assertEquals(MessageType.METHOD_RETURN, replies.get(0).type());
        assertTrue(replies.get(0).args().isEmpty());
    }

    @Test
    void explicitSignatureOverridesDeclaredOne() {
        DBusHandler handler = DBusHandler.builder()
                .add(HandlerRegistration.method("Describe").replySignature("s")
                        .handledBy(ctx -> ctx.reply("a{si}", List.of(Map.of("a", 1)))))
                .build();

        handler.dispatch(connection, call("Describe", null, "/", ""));

        assertEquals("a{si}", replies().get(0).signature());
    }

    @Test
    void busExceptionBecomesNamedError() {
        DBusHandler handler = DBusHandler.builder()
                .method("Fail", ctx -> {
                    throw new DBusException("com.example.Error.Busy", "try later");
                })
                .build();

        handler.dispatch(connection, call("Fail", null, "/", ""));

        List<Message> replies = replies();
        assertEquals(1, replies.size());
        assertEquals("com.example.Error.Busy", replies.get(0).errorName());
        assertEquals(List.of("try later"), replies.get(0).args());
        assertTrue(sink.getHandlerFailures().isEmpty());
    }

    @Test
    void unexpectedExceptionIsReportedAndAnswered() {
        DBusHandler handler = DBusHandler.builder()
                .method("Crash", ctx -> {
                    throw new IllegalStateException("bug");
                })
                .build();

        handler.dispatch(connection, call("Crash", null, "/", ""));

        List<Message> replies = replies();
        assertEquals(1, replies.size());
        assertEquals(ErrorNames.UNCAUGHT_EXCEPTION, replies.get(0).errorName());
        assertEquals(1, sink.getHandlerFailures().size());
        assertInstanceOf(IllegalStateException.class, sink.getHandlerFailures().get(0).cause());
    }

    @Test
    void mismatchedResponseBecomesInvalidArgs() {
        DBusHandler handler = DBusHandler.builder()
                .add(HandlerRegistration.method("Count").replySignature("i")
                        .handledBy(ctx -> ctx.reply("not a number")))
                .build();

        handler.dispatch(connection, call("Count", null, "/", ""));

        List<Message> replies = replies();
        assertEquals(1, replies.size());
        assertEquals(ErrorNames.INVALID_ARGS, replies.get(0).errorName());
    }

    @Test
    void noReplyCallGetsNothingEvenOnFailure() {
        DBusHandler handler = DBusHandler.builder()
                .method("Quiet", ctx -> { })
                .method("Crash", ctx -> {
                    throw new IllegalStateException("bug");
                })
                .build();
        Message quiet = Message.methodCall("/", "Quiet").noReply(true).build()
                .withSerial(nextSerial++).withSender(caller.uniqueName());
        Message crash = Message.methodCall("/", "Crash").noReply(true).build()
                .withSerial(nextSerial++).withSender(caller.uniqueName());

        assertTrue(handler.dispatch(connection, quiet));
        assertTrue(handler.dispatch(connection, crash));

        assertTrue(replies().isEmpty());
        assertEquals(1, sink.getHandlerFailures().size());
    }

    @Test
    void firstMatchingRegistrationWins() {
        List<String> invoked = new ArrayList<>();
        DBusHandler handler = DBusHandler.builder()
                .add(HandlerRegistration.method("Get").interfaceName("com.example.A")
                        .handledBy(ctx -> invoked.add("A")))
                .add(HandlerRegistration.method("Get").path("/objects/*")
                        .handledBy(ctx -> invoked.add("objects")))
                .add(HandlerRegistration.method("Get")
                        .handledBy(ctx -> invoked.add("any")))
                .add(HandlerRegistration.method("Get")
                        .handledBy(ctx -> invoked.add("never")))
                .build();

        handler.dispatch(connection, call("Get", "com.example.A", "/objects/1", ""));
        handler.dispatch(connection, call("Get", "com.example.B", "/objects/1", ""));
        handler.dispatch(connection, call("Get", "com.example.B", "/other", ""));

        assertEquals(List.of("A", "objects", "any"), invoked);
        assertEquals(3, replies().size());
    }

    @Test
    void unmatchedCallIsLeftToCaller() {
        DBusHandler handler = DBusHandler.builder()
                .add(HandlerRegistration.method("Echo").interfaceName("com.example.Echo").handledBy(ctx -> { }))
                .build();

        assertFalse(handler.dispatch(connection, call("Missing", null, "/", "")));
        assertFalse(handler.dispatch(connection, call("Echo", "com.example.Other", "/", "")));
        assertTrue(replies().isEmpty());
    }

    @Test
    void signalHandlerFailureIsReportedNotAnswered() {
        AtomicInteger calls = new AtomicInteger();
        DBusHandler handler = DBusHandler.builder()
                .signal("Changed", ctx -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("listener bug");
                })
                .build();
        Message signal = Message.signal("/", "com.example.Iface", "Changed").build()
                .withSerial(nextSerial++).withSender(caller.uniqueName());

        assertTrue(handler.dispatch(connection, signal));

        assertEquals(1, calls.get());
        assertTrue(replies().isEmpty());
        assertEquals(1, sink.getHandlerFailures().size());
    }

    @Test
    void methodAndSignalTablesAreSeparate() {
        DBusHandler handler = DBusHandler.builder().method("Changed", ctx -> { }).build();
        Message signal = Message.signal("/", "com.example.Iface", "Changed").build();

        assertFalse(handler.dispatch(connection, signal));
        assertEquals(1, handler.registrations().size());
    }

    @Test
    void repliesAreNotDispatched() {
        DBusHandler handler = DBusHandler.builder().method("Echo", ctx -> { }).build();
        Message reply = Message.error(1, ErrorNames.NO_REPLY).build();

        assertFalse(handler.dispatch(connection, reply));
    }

    @Test
    void signalRegistrationCannotDeclareReplySignature() {
        assertThrows(IllegalArgumentException.class,
                () -> HandlerRegistration.signal("Changed").replySignature("s").handledBy(ctx -> { }));
    }
}
