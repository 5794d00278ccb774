package com.questrail.dbus.transport.local;

import com.questrail.dbus.loop.RecordingEventLoop;
import com.questrail.dbus.model.ErrorNames;
import com.questrail.dbus.model.Message;
import com.questrail.dbus.model.MessageType;
import com.questrail.dbus.transport.DispatchStatus;
import com.questrail.dbus.transport.PendingCall;
import com.questrail.dbus.transport.Watch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LocalConnectionTest
 * -----------------------------------------------------------------------------
 * Transport behaviour with readiness and expiry fired by hand.
 */
class LocalConnectionTest {

    private LocalBus bus;
    private LocalConnection client;
    private LocalConnection server;
    private RecordingEventLoop clientLoop;
    private RecordingEventLoop serverLoop;
    private List<Message> clientInbox;
    private List<Message> serverInbox;

    @BeforeEach
    void setUp() {
        bus = new LocalBus();
        client = bus.connect();
        server = bus.connect();
        clientLoop = new RecordingEventLoop();
        serverLoop = new RecordingEventLoop();
        client.setLoop(clientLoop);
        server.setLoop(serverLoop);
        clientInbox = new ArrayList<>();
        serverInbox = new ArrayList<>();
        client.addFilter(m -> clientInbox.add(m));
        server.addFilter(m -> serverInbox.add(m));
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    private Message echoCall() {
        return Message.methodCall("/echo", "Echo")
                .interfaceName("com.example.Echo")
                .destination(server.uniqueName())
                .args("i", 42)
                .build();
    }

    @Test
    void connectionsGetDistinctUniqueNames() {
        assertNotEquals(client.uniqueName(), server.uniqueName());
        assertTrue(client.uniqueName().startsWith(":1."));
        assertEquals(2, bus.names().size());
    }

    @Test
    void sendStampsSerialAndSender() {
        long serial = client.send(echoCall());
        clientLoop.pump(client);
        serverLoop.pump(server);

        assertEquals(1, serverInbox.size());
        Message received = serverInbox.get(0);
        assertEquals(serial, received.serial());
        assertEquals(client.uniqueName(), received.sender());
        assertEquals(List.of(42), received.args());
    }

    @Test
    void writeWatchIsEnabledOnlyWhileOutputIsBuffered() {
        Watch writeWatch = clientLoop.watches().stream()
                .filter(w -> (w.flags() & Watch.WRITABLE) != 0)
                .findFirst()
                .orElseThrow();
        assertFalse(writeWatch.isEnabled());

        client.send(echoCall());
        assertTrue(writeWatch.isEnabled());

        clientLoop.pump(client);
        assertFalse(writeWatch.isEnabled());
        assertTrue(clientLoop.watchToggles() >= 2);
    }

    @Test
    void replyResolvesPendingCallAndRemovesItsTimeout() {
        PendingCall call = client.sendWithReply(echoCall(), 1_000);
        AtomicReference<Message> reply = new AtomicReference<>();
        call.setNotify(reply::set);
        assertEquals(1, clientLoop.timeouts().size());

        clientLoop.pump(client);
        serverLoop.pump(server);
        server.send(Message.methodReturn(serverInbox.get(0)).args("i", 42).build());
        serverLoop.pump(server);
        clientLoop.pump(client);

        assertNotNull(reply.get());
        assertEquals(MessageType.METHOD_RETURN, reply.get().type());
        assertEquals(call.serial(), reply.get().replySerial());
        assertEquals(0, client.pendingCallCount());
        assertTrue(clientLoop.timeouts().isEmpty());
        assertTrue(clientInbox.isEmpty(), "correlated replies bypass filters");
    }

    @Test
    void timeoutWinsAndLateReplyGoesToFilters() {
        PendingCall call = client.sendWithReply(echoCall(), 100);
        AtomicInteger notifications = new AtomicInteger();
        AtomicReference<Message> reply = new AtomicReference<>();
        call.setNotify(m -> {
            notifications.incrementAndGet();
            reply.set(m);
        });

        clientLoop.pump(client);
        serverLoop.pump(server);

        clientLoop.fireTimeouts();
        assertNull(reply.get(), "timeout result is delivered from a dispatch pass");
        assertEquals(DispatchStatus.DATA_REMAINS, client.dispatchStatus());
        clientLoop.pump(client);

        assertEquals(ErrorNames.NO_REPLY, reply.get().errorName());
        assertTrue(clientLoop.timeouts().isEmpty());

        server.send(Message.methodReturn(serverInbox.get(0)).args("i", 42).build());
        serverLoop.pump(server);
        clientLoop.pump(client);

        assertEquals(1, notifications.get());
        assertEquals(1, clientInbox.size());
        assertEquals(MessageType.METHOD_RETURN, clientInbox.get(0).type());
    }

    @Test
    void cancelForgetsCallWithoutNotifying() {
        PendingCall call = client.sendWithReply(echoCall(), 1_000);
        AtomicInteger notifications = new AtomicInteger();
        call.setNotify(m -> notifications.incrementAndGet());

        call.cancel();

        assertTrue(call.isCancelled());
        assertEquals(0, client.pendingCallCount());
        assertTrue(clientLoop.timeouts().isEmpty());
        assertFalse(call.complete(Message.error(call.serial(), ErrorNames.NO_REPLY).build()));
        assertEquals(0, notifications.get());
    }

    @Test
    void closeResolvesPendingCallsAsDisconnected() {
        PendingCall call = client.sendWithReply(echoCall(), 1_000);

        client.close();

        assertFalse(client.isOpen());
        assertEquals(ErrorNames.DISCONNECTED, call.reply().orElseThrow().errorName());
        assertTrue(clientLoop.watches().isEmpty());
        assertTrue(clientLoop.timeouts().isEmpty());
        assertThrows(IllegalStateException.class, () -> client.uniqueName());
    }

    @Test
    void closeDeliversQueuedTimeoutExactlyOnce() {
        PendingCall call = client.sendWithReply(echoCall(), 100);
        AtomicInteger notifications = new AtomicInteger();
        AtomicReference<Message> reply = new AtomicReference<>();
        call.setNotify(m -> {
            notifications.incrementAndGet();
            reply.set(m);
        });

        clientLoop.fireTimeouts();
        assertEquals(0, notifications.get());
        client.close();

        assertEquals(1, notifications.get());
        assertTrue(call.isCompleted());
        assertEquals(ErrorNames.NO_REPLY, reply.get().errorName());
        assertEquals(call.serial(), reply.get().replySerial());
    }

    @Test
    void reopenedConnectionGetsNewName() {
        String first = client.uniqueName();
        client.close();
        client.open();

        assertNotEquals(first, client.uniqueName());
        assertEquals(2, clientLoop.watches().size());
    }

    @Test
    void callToUnknownNameIsAnsweredByBus() {
        Message call = Message.methodCall("/", "Ping").destination(":1.999").build();
        PendingCall pending = client.sendWithReply(call, 1_000);

        clientLoop.pump(client);
        clientLoop.pump(client);

        Message reply = pending.reply().orElseThrow();
        assertEquals(ErrorNames.SERVICE_UNKNOWN, reply.errorName());
        assertEquals(LocalBus.BUS_NAME, reply.sender());
    }

    @Test
    void broadcastSignalSkipsSender() {
        LocalConnection third = bus.connect();
        RecordingEventLoop thirdLoop = new RecordingEventLoop();
        third.setLoop(thirdLoop);
        List<Message> thirdInbox = new ArrayList<>();
        third.addFilter(thirdInbox::add);

        client.send(Message.signal("/", "com.example.Iface", "Changed").build());
        clientLoop.pump(client);
        serverLoop.pump(server);
        thirdLoop.pump(third);

        assertEquals(1, serverInbox.size());
        assertEquals(1, thirdInbox.size());
        assertTrue(clientInbox.isEmpty());
        third.close();
    }

    @Test
    void filtersRunInOrderUntilOneHandles() {
        List<String> seen = new ArrayList<>();
        LocalConnection fresh = bus.connect();
        RecordingEventLoop loop = new RecordingEventLoop();
        fresh.setLoop(loop);
        fresh.addFilter(m -> { seen.add("first"); return false; });
        fresh.addFilter(m -> { throw new IllegalStateException("boom"); });
        fresh.addFilter(m -> { seen.add("third"); return true; });
        fresh.addFilter(m -> { seen.add("fourth"); return true; });

        client.send(Message.signal("/", "com.example.Iface", "Changed").destination(fresh.uniqueName()).build());
        clientLoop.pump(client);
        loop.pump(fresh);

        assertEquals(List.of("first", "third"), seen);
        fresh.close();
    }
}
