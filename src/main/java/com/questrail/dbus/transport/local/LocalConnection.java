package com.questrail.dbus.transport.local;

import com.questrail.dbus.loop.EventLoop;
import com.questrail.dbus.model.ErrorNames;
import com.questrail.dbus.model.Message;
import com.questrail.dbus.model.MessageType;
import com.questrail.dbus.transport.Connection;
import com.questrail.dbus.transport.DispatchStatus;
import com.questrail.dbus.transport.MessageFilter;
import com.questrail.dbus.transport.PendingCall;
import com.questrail.dbus.transport.Timeout;
import com.questrail.dbus.transport.Watch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Pipe;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * LocalConnection
 * =============================================================================
 * {@link Connection} to a {@link LocalBus} in the same JVM.
 *
 * <h2>Readiness model</h2>
 * Each open connection owns two NIO pipes so that event loops observe it
 * exactly as they would a socket:
 * <ul>
 *   <li><b>inbound</b>: the bus queues a message on {@link #deliver} and writes
 *       a wake-up byte into the pipe. The READABLE watch on the pipe's source
 *       drains those bytes and moves the queued messages into the dispatch
 *       queue, which is what {@link #dispatchStatus()} reports on.</li>
 *   <li><b>outbound</b>: {@link #send} buffers the message and enables the
 *       WRITABLE watch on the other pipe's (always writable) sink; the next
 *       writable event flushes the buffer to the bus and disables the watch
 *       again.</li>
 * </ul>
 *
 * <h2>Reply correlation</h2>
 * {@link #sendWithReply} registers the pending call and a one-shot
 * {@link Timeout} with the loop. Whichever of the reply or the timeout removes
 * the pending entry first wins; the timeout queues a synthesized
 * {@link ErrorNames#NO_REPLY} error so the continuation runs from a dispatch
 * pass, never from inside the timer callback. A reply that arrives after that
 * finds no pending call and is offered to the filters like any other message.
 *
 * <h2>Thread safety</h2>
 * {@link #deliver}, {@link #send} and {@link #sendWithReply} may be called from
 * any thread. Dispatching is expected to happen on one thread at a time
 * (the event loop's).
 */
public final class LocalConnection implements Connection
{
    private static final Logger log = LoggerFactory.getLogger(LocalConnection.class);

    private final LocalBus bus;

    private final Object lock = new Object();
    private final Object flushLock = new Object();

    private final Queue<Message> inbox = new ConcurrentLinkedQueue<>();
    private final Queue<Message> outbox = new ConcurrentLinkedQueue<>();
    private final Deque<Inbound> dispatchQueue = new ArrayDeque<>();
    private final Map<Long, PendingEntry> pending = new ConcurrentHashMap<>();
    private final List<MessageFilter> filters = new CopyOnWriteArrayList<>();
    private final AtomicLong serials = new AtomicLong();

    private volatile EventLoop loop;
    private volatile String uniqueName;
    private volatile boolean open;

    private Pipe inboundPipe;
    private Pipe outboundPipe;
    private Watch readWatch;
    private Watch writeWatch;

    public LocalConnection(LocalBus bus) {
        this.bus = Objects.requireNonNull(bus, "bus");
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void open() {
        EventLoop l;
        synchronized (lock) {
            if (open) {
                throw new IllegalStateException("connection already open as " + uniqueName);
            }
            try {
                inboundPipe = Pipe.open();
                outboundPipe = Pipe.open();
                inboundPipe.source().configureBlocking(false);
                inboundPipe.sink().configureBlocking(false);
                outboundPipe.source().configureBlocking(false);
                outboundPipe.sink().configureBlocking(false);
            } catch (IOException e) {
                closeQuietly();
                throw new UncheckedIOException("cannot create connection pipes", e);
            }
            readWatch = new Watch(inboundPipe.source(), Watch.READABLE, true, this::onReadable);
            writeWatch = new Watch(outboundPipe.sink(), Watch.WRITABLE, false, flags -> flush());
            uniqueName = bus.attach(this);
            open = true;
            l = loop;
        }

        if (l != null) {
            l.addWatch(readWatch);
            l.addWatch(writeWatch);
        }
    }

    @Override
    public void close() {
        Watch oldRead;
        Watch oldWrite;
        List<PendingEntry> abandoned;
        List<Inbound> queuedResolutions = new ArrayList<>();
        synchronized (lock) {
            if (!open) {
                return;
            }
            open = false;
            bus.detach(uniqueName);
            oldRead = readWatch;
            oldWrite = writeWatch;
            abandoned = new ArrayList<>(pending.values());
            pending.clear();
            // Timed-out calls have left the pending table; their result is only queued.
            for (Inbound inbound : dispatchQueue) {
                if (inbound.resolves != null) {
                    queuedResolutions.add(inbound);
                }
            }
            dispatchQueue.clear();
            inbox.clear();
            outbox.clear();
        }

        EventLoop l = loop;
        if (l != null) {
            l.removeWatch(oldRead);
            l.removeWatch(oldWrite);
        }
        for (PendingEntry entry : abandoned) {
            if (l != null) {
                l.removeTimeout(entry.timeout);
            }
            entry.call.complete(Message.error(entry.call.serial(), ErrorNames.DISCONNECTED)
                    .args("s", "Connection was closed before a reply arrived")
                    .build());
        }
        for (Inbound inbound : queuedResolutions) {
            inbound.resolves.complete(inbound.message);
        }

        synchronized (lock) {
            closeQuietly();
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public String uniqueName() {
        requireOpen();
        return uniqueName;
    }

    @Override
    public void setLoop(EventLoop newLoop) {
        Objects.requireNonNull(newLoop, "loop");
        EventLoop previous;
        Watch r;
        Watch w;
        synchronized (lock) {
            previous = loop;
            loop = newLoop;
            r = open ? readWatch : null;
            w = open ? writeWatch : null;
        }

        if (r == null) {
            return;
        }
        if (previous != null) {
            previous.removeWatch(r);
            previous.removeWatch(w);
        }
        newLoop.addWatch(r);
        newLoop.addWatch(w);
        for (PendingEntry entry : pending.values()) {
            if (previous != null) {
                previous.removeTimeout(entry.timeout);
            }
            newLoop.addTimeout(entry.timeout);
        }
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    @Override
    public long send(Message message) {
        Objects.requireNonNull(message, "message");
        requireOpen();
        long serial = serials.incrementAndGet();
        enqueue(message.withSerial(serial).withSender(uniqueName));
        return serial;
    }

    @Override
    public PendingCall sendWithReply(Message message, int timeoutMillis) {
        Objects.requireNonNull(message, "message");
        if (message.type() != MessageType.METHOD_CALL) {
            throw new IllegalArgumentException("only method calls expect a reply: " + message.type());
        }
        if (message.isNoReply()) {
            throw new IllegalArgumentException("message is flagged no-reply");
        }
        int interval = timeoutMillis == -1 ? DEFAULT_TIMEOUT_MILLIS : timeoutMillis;
        if (interval <= 0) {
            throw new IllegalArgumentException("timeout must be > 0 ms or -1: " + timeoutMillis);
        }
        requireOpen();

        long serial = serials.incrementAndGet();
        PendingCall call = new PendingCall(serial, () -> forget(serial));
        Timeout timeout = new Timeout(interval, true, () -> onReplyTimeout(serial));

        // Registered before the call is queued so a fast reply always finds it.
        pending.put(serial, new PendingEntry(call, timeout));
        EventLoop l = loop;
        if (l != null) {
            l.addTimeout(timeout);
        }

        enqueue(message.withSerial(serial).withSender(uniqueName));
        return call;
    }

    @Override
    public void flush() {
        synchronized (flushLock) {
            List<Message> batch = new ArrayList<>();
            boolean toggled = false;
            synchronized (lock) {
                if (!open) {
                    return;
                }
                Message m;
                while ((m = outbox.poll()) != null) {
                    batch.add(m);
                }
                if (outbox.isEmpty() && writeWatch.isEnabled()) {
                    writeWatch.setEnabled(false);
                    toggled = true;
                }
            }

            if (toggled) {
                announceToggle(writeWatch);
            }
            for (Message m : batch) {
                bus.route(m);
            }
        }
    }

    private void enqueue(Message stamped) {
        outbox.add(stamped);
        boolean toggled = false;
        synchronized (lock) {
            if (open && !writeWatch.isEnabled()) {
                writeWatch.setEnabled(true);
                toggled = true;
            }
        }
        if (toggled) {
            announceToggle(writeWatch);
        }
    }

    private void announceToggle(Watch watch) {
        EventLoop l = loop;
        if (l != null) {
            l.watchToggled(watch);
        }
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Called by the bus to hand this connection a message.
     */
    void deliver(Message message) {
        Pipe.SinkChannel sink;
        synchronized (lock) {
            if (!open) {
                return;
            }
            inbox.add(message);
            sink = inboundPipe.sink();
        }
        try {
            // A full pipe already guarantees a pending readable event.
            sink.write(ByteBuffer.wrap(new byte[]{1}));
        } catch (IOException e) {
            log.debug("Wake-up write failed for {}: {}", uniqueName, e.toString());
        }
    }

    private void onReadable(int flags) {
        ByteBuffer scratch = ByteBuffer.allocate(256);
        synchronized (lock) {
            if (!open) {
                return;
            }
            try {
                while (inboundPipe.source().read(scratch) > 0) {
                    scratch.clear();
                }
            } catch (IOException e) {
                throw new UncheckedIOException("inbound pipe read failed", e);
            }
            Message m;
            while ((m = inbox.poll()) != null) {
                dispatchQueue.add(new Inbound(m, null));
            }
        }
    }

    private void onReplyTimeout(long serial) {
        PendingEntry entry = pending.remove(serial);
        if (entry == null) {
            return;
        }
        EventLoop l = loop;
        if (l != null) {
            l.removeTimeout(entry.timeout);
        }
        Message error = Message.error(serial, ErrorNames.NO_REPLY)
                .destination(uniqueName)
                .args("s", "Did not receive a reply within " + entry.timeout.intervalMillis() + " ms")
                .build();
        synchronized (lock) {
            dispatchQueue.add(new Inbound(error, entry.call));
        }
    }

    private void forget(long serial) {
        PendingEntry entry = pending.remove(serial);
        EventLoop l = loop;
        if (entry != null && l != null) {
            l.removeTimeout(entry.timeout);
        }
    }

    // -------------------------------------------------------------------------
    // Dispatch
    // -------------------------------------------------------------------------

    @Override
    public DispatchStatus dispatchStatus() {
        synchronized (lock) {
            return dispatchQueue.isEmpty() ? DispatchStatus.COMPLETE : DispatchStatus.DATA_REMAINS;
        }
    }

    @Override
    public DispatchStatus dispatch() {
        Inbound next;
        synchronized (lock) {
            next = dispatchQueue.poll();
        }
        if (next == null) {
            return DispatchStatus.COMPLETE;
        }

        Message message = next.message;
        PendingCall target = next.resolves;
        if (target == null && message.type().isReply()) {
            PendingEntry entry = pending.remove(message.replySerial());
            if (entry != null) {
                EventLoop l = loop;
                if (l != null) {
                    l.removeTimeout(entry.timeout);
                }
                target = entry.call;
            }
        }

        if (target != null) {
            target.complete(message);
        } else {
            runFilters(message);
        }
        return dispatchStatus();
    }

    private void runFilters(Message message) {
        for (MessageFilter filter : filters) {
            try {
                if (filter.filter(message)) {
                    return;
                }
            } catch (RuntimeException e) {
                log.error("Message filter failed on {}", message, e);
            }
        }
        log.trace("No filter handled {}", message);
    }

    @Override
    public void addFilter(MessageFilter filter) {
        filters.add(Objects.requireNonNull(filter, "filter"));
    }

    @Override
    public void removeFilter(MessageFilter filter) {
        filters.remove(filter);
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    /**
     * @return number of calls still awaiting a reply or timeout
     */
    public int pendingCallCount() {
        return pending.size();
    }

    private void requireOpen() {
        if (!open) {
            throw new IllegalStateException("connection is not open");
        }
    }

    private void closeQuietly() {
        for (Pipe pipe : new Pipe[]{inboundPipe, outboundPipe}) {
            if (pipe == null) {
                continue;
            }
            try {
                pipe.source().close();
                pipe.sink().close();
            } catch (IOException e) {
                log.debug("Ignoring pipe close failure: {}", e.toString());
            }
        }
        inboundPipe = null;
        outboundPipe = null;
    }

    private static final class PendingEntry {
        private final PendingCall call;
        private final Timeout timeout;

        private PendingEntry(PendingCall call, Timeout timeout) {
            this.call = call;
            this.timeout = timeout;
        }
    }

    private static final class Inbound {
        private final Message message;
        private final PendingCall resolves;

        private Inbound(Message message, PendingCall resolves) {
            this.message = message;
            this.resolves = resolves;
        }
    }
}
