package com.questrail.dbus.loop.select;

import com.questrail.dbus.internal.time.MonotonicClock;
import com.questrail.dbus.internal.time.SystemMonotonicClock;
import com.questrail.dbus.loop.ConnectionLoop;
import com.questrail.dbus.loop.DispatchDriver;
import com.questrail.dbus.model.Message;
import com.questrail.dbus.transport.Connection;
import com.questrail.dbus.transport.Timeout;
import com.questrail.dbus.transport.Watch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SelectLoop
 * =============================================================================
 * Portable polling reactor for a single connection, built on a
 * {@link Selector}.
 *
 * <p>Use it when the application has no event loop of its own: either run
 * {@link #run()} on a dedicated thread to make the bus the main loop, or make
 * synchronous calls and let {@link #await} drive the loop in the calling
 * thread until the reply arrives.</p>
 *
 * <h2>One iteration</h2>
 * <ol>
 *   <li>Bring selection keys in line with the enabled watches.</li>
 *   <li>Poll for the time remaining until the nearest timer expiry, or the
 *       idle poll interval when no timer is armed (so a stop request is
 *       noticed even with nothing to do).</li>
 *   <li>Hand every ready channel's flags to its watch.</li>
 *   <li>Fire every timer that is due and re-arm it at
 *       {@code expiry + interval}. Re-arming from the scheduled expiry
 *       rather than from "now" keeps a periodic timer from drifting when
 *       the loop runs late.</li>
 *   <li>Drain the connection's dispatch queue.</li>
 * </ol>
 * When {@link #run()} returns it flushes the connection, so replies queued by
 * the last handlers are not lost.
 *
 * <h2>Threading</h2>
 * The loop is driven by at most one thread at a time (its <em>owner</em>).
 * Registration methods may be called from any thread; they wake the selector
 * and take effect on the next iteration.
 */
public final class SelectLoop implements ConnectionLoop
{
    public static final Duration DEFAULT_IDLE_POLL_INTERVAL = Duration.ofSeconds(4);

    private static final Logger log = LoggerFactory.getLogger(SelectLoop.class);

    private final Selector selector;
    private final MonotonicClock clock;
    private final long idlePollMillis;

    private final List<Watch> watches = new CopyOnWriteArrayList<>();

    private final Object timerLock = new Object();
    private final PriorityQueue<ArmedTimer> timers = new PriorityQueue<>();
    private final Set<Timeout> timeouts = Collections.newSetFromMap(new IdentityHashMap<>());
    private final AtomicLong armSequence = new AtomicLong();

    private final AtomicReference<Thread> owner = new AtomicReference<>();
    private volatile boolean stopRequested;
    private volatile Connection connection;

    public SelectLoop() {
        this(SystemMonotonicClock.INSTANCE, DEFAULT_IDLE_POLL_INTERVAL);
    }

    /**
     * @param clock            clock for timer expiry
     * @param idlePollInterval upper bound on one poll when no timer is armed
     */
    public SelectLoop(MonotonicClock clock, Duration idlePollInterval) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(idlePollInterval, "idlePollInterval");
        if (idlePollInterval.isNegative() || idlePollInterval.isZero()) {
            throw new IllegalArgumentException("idlePollInterval must be > 0");
        }
        this.idlePollMillis = idlePollInterval.toMillis();
        try {
            this.selector = Selector.open();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot open selector", e);
        }
    }

    // -------------------------------------------------------------------------
    // ConnectionLoop
    // -------------------------------------------------------------------------

    @Override
    public void bind(Connection connection) {
        Objects.requireNonNull(connection, "connection");
        if (this.connection != null) {
            throw new IllegalStateException("loop already bound to a connection");
        }
        this.connection = connection;
    }

    /**
     * Runs the task inline: in this model every message is handled on the
     * loop thread, one after the other.
     */
    @Override
    public void spawn(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Uncaught exception while handling a message", e);
        }
    }

    @Override
    public Message await(CompletableFuture<Message> reply) throws InterruptedException {
        Thread current = Thread.currentThread();
        while (!reply.isDone()) {
            Thread driver = owner.get();
            if (driver == current) {
                // Nested inside run() or another await on this thread.
                iterateUntilDone(reply, current);
            } else if (driver == null && owner.compareAndSet(null, current)) {
                try {
                    iterateUntilDone(reply, current);
                } finally {
                    owner.set(null);
                }
            } else if (driver != null) {
                // Another thread drives the loop and will dispatch the reply;
                // re-check in case it stops driving first.
                try {
                    return reply.get(idlePollMillis, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    log.trace("Still waiting for a reply dispatched by {}", driver.getName());
                } catch (ExecutionException e) {
                    throw new IllegalStateException("reply future failed", e.getCause());
                }
            }
        }
        return result(reply);
    }

    @Override
    public void close() {
        stop();
        try {
            selector.close();
        } catch (IOException e) {
            log.warn("Selector close failed", e);
        }
    }

    // -------------------------------------------------------------------------
    // Driving the loop
    // -------------------------------------------------------------------------

    /**
     * Run iterations on the calling thread until {@link #stop()} is called,
     * then flush the connection.
     *
     * @throws IllegalStateException   if another thread is driving the loop
     * @throws UncheckedIOException    if polling fails for a reason other
     *                                 than a wake-up
     */
    public void run() {
        Thread current = Thread.currentThread();
        boolean claimed = owner.compareAndSet(null, current);
        Thread driver = owner.get();
        if (!claimed && driver != current) {
            throw new IllegalStateException("loop is already driven by "
                    + (driver == null ? "another thread" : driver.getName()));
        }

        try {
            while (!stopRequested) {
                runOnce();
            }
        } finally {
            stopRequested = false;
            if (claimed) {
                owner.set(null);
            }
            Connection c = connection;
            if (c != null) {
                c.flush();
            }
        }
    }

    /**
     * Ask {@link #run()} to return after the current iteration. Callable from
     * any thread, including from a handler running on the loop. A stop
     * requested while nothing runs the loop makes the next {@code run()}
     * return at once.
     */
    public void stop() {
        stopRequested = true;
        selector.wakeup();
    }

    /**
     * @return {@code true} while some thread is driving the loop
     */
    public boolean isRunning() {
        return owner.get() != null;
    }

    /**
     * Perform exactly one iteration on the calling thread.
     */
    public void runOnce() {
        Connection c = requireBound();

        reconcileKeys();

        long pollMillis = pollTimeoutMillis();
        try {
            if (pollMillis <= 0) {
                selector.selectNow();
            } else {
                selector.select(pollMillis);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("select failed", e);
        }

        handleReadyKeys();
        fireDueTimers();
        DispatchDriver.drain(c);
    }

    // -------------------------------------------------------------------------
    // EventLoop
    // -------------------------------------------------------------------------

    @Override
    public void addWatch(Watch watch) {
        watches.add(Objects.requireNonNull(watch, "watch"));
        selector.wakeup();
    }

    @Override
    public void removeWatch(Watch watch) {
        watches.remove(watch);
        Object data = watch.data();
        if (data instanceof SelectionKey) {
            ((SelectionKey) data).cancel();
        }
        watch.setData(null);
        selector.wakeup();
    }

    @Override
    public void watchToggled(Watch watch) {
        selector.wakeup();
    }

    @Override
    public void addTimeout(Timeout timeout) {
        Objects.requireNonNull(timeout, "timeout");
        synchronized (timerLock) {
            timeouts.add(timeout);
            if (timeout.isEnabled()) {
                arm(timeout, clock.nowNanos() + intervalNanos(timeout));
            }
        }
        selector.wakeup();
    }

    @Override
    public void removeTimeout(Timeout timeout) {
        synchronized (timerLock) {
            timeouts.remove(timeout);
            disarm(timeout);
        }
    }

    @Override
    public void timeoutToggled(Timeout timeout) {
        synchronized (timerLock) {
            if (!timeouts.contains(timeout)) {
                return;
            }
            ArmedTimer current = armedTimer(timeout);
            if (!timeout.isEnabled()) {
                disarm(timeout);
            } else if (current == null || current.intervalMillis != timeout.intervalMillis()) {
                disarm(timeout);
                arm(timeout, clock.nowNanos() + intervalNanos(timeout));
            }
        }
        selector.wakeup();
    }

    // -------------------------------------------------------------------------
    // Iteration steps
    // -------------------------------------------------------------------------

    private void reconcileKeys() {
        for (Watch watch : watches) {
            SelectableChannel channel = watch.channel();
            int ops = watch.isEnabled() ? interestOps(watch) & channel.validOps() : 0;
            Object data = watch.data();
            SelectionKey key = data instanceof SelectionKey ? (SelectionKey) data : null;

            if (key != null && key.isValid()) {
                key.interestOps(ops);
                continue;
            }
            if (ops == 0 || !channel.isOpen()) {
                continue;
            }
            try {
                watch.setData(channel.register(selector, ops, watch));
            } catch (ClosedChannelException e) {
                log.debug("Watch channel closed before registration: {}", watch);
            } catch (CancelledKeyException e) {
                // Previous key is deregistered by the next select; retried then.
                log.trace("Deferring re-registration of {}", watch);
            }
        }
    }

    private long pollTimeoutMillis() {
        synchronized (timerLock) {
            ArmedTimer next = timers.peek();
            if (next == null) {
                return idlePollMillis;
            }
            long remainingNanos = next.expiryNanos - clock.nowNanos();
            if (remainingNanos <= 0) {
                return 0;
            }
            return Math.max(1, TimeUnit.NANOSECONDS.toMillis(remainingNanos + 999_999));
        }
    }

    private void handleReadyKeys() {
        Iterator<SelectionKey> it = selector.selectedKeys().iterator();
        while (it.hasNext()) {
            SelectionKey key = it.next();
            it.remove();
            if (!key.isValid()) {
                continue;
            }

            Watch watch = (Watch) key.attachment();
            int ready;
            try {
                ready = key.readyOps();
            } catch (CancelledKeyException e) {
                continue;
            }
            int observed = 0;
            if ((ready & SelectionKey.OP_READ) != 0) {
                observed |= Watch.READABLE;
            }
            if ((ready & SelectionKey.OP_WRITE) != 0) {
                observed |= Watch.WRITABLE;
            }
            observed &= watch.flags();

            if (observed != 0 && watch.isEnabled() && watches.contains(watch)) {
                watch.handle(observed);
            }
        }
    }

    private void fireDueTimers() {
        long now = clock.nowNanos();
        while (true) {
            ArmedTimer due;
            synchronized (timerLock) {
                due = timers.peek();
                if (due == null || due.expiryNanos > now) {
                    return;
                }
                timers.poll();
            }

            due.timeout.handle();

            synchronized (timerLock) {
                // Skip if handle() removed, disabled or re-armed the timeout.
                if (armedTimer(due.timeout) == due && due.timeout.isEnabled()) {
                    arm(due.timeout, due.expiryNanos + intervalNanos(due.timeout));
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    // Callers hold timerLock.
    private void arm(Timeout timeout, long expiryNanos) {
        ArmedTimer armed = new ArmedTimer(timeout, expiryNanos, timeout.intervalMillis(), armSequence.incrementAndGet());
        timeout.setData(armed);
        timers.add(armed);
    }

    // Callers hold timerLock.
    private void disarm(Timeout timeout) {
        ArmedTimer current = armedTimer(timeout);
        if (current != null) {
            timers.remove(current);
        }
        timeout.setData(null);
    }

    private static ArmedTimer armedTimer(Timeout timeout) {
        Object data = timeout.data();
        return data instanceof ArmedTimer ? (ArmedTimer) data : null;
    }

    private static long intervalNanos(Timeout timeout) {
        return TimeUnit.MILLISECONDS.toNanos(timeout.intervalMillis());
    }

    private static int interestOps(Watch watch) {
        int ops = 0;
        if ((watch.flags() & Watch.READABLE) != 0) {
            ops |= SelectionKey.OP_READ;
        }
        if ((watch.flags() & Watch.WRITABLE) != 0) {
            ops |= SelectionKey.OP_WRITE;
        }
        return ops;
    }

    private Connection requireBound() {
        Connection c = connection;
        if (c == null) {
            throw new IllegalStateException("loop is not bound to a connection");
        }
        return c;
    }

    private void iterateUntilDone(CompletableFuture<Message> reply, Thread current) throws InterruptedException {
        while (!reply.isDone()) {
            if (current.isInterrupted()) {
                throw new InterruptedException("interrupted while waiting for a reply");
            }
            runOnce();
        }
    }

    private static Message result(CompletableFuture<Message> reply) throws InterruptedException {
        try {
            return reply.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("reply future failed", e.getCause());
        }
    }

    /**
     * A timeout's position in the expiry heap. Identity matters: a timeout
     * re-armed while one of its entries is firing gets a new entry, and the
     * old one is then ignored.
     */
    private static final class ArmedTimer implements Comparable<ArmedTimer> {
        private final Timeout timeout;
        private final long expiryNanos;
        private final int intervalMillis;
        private final long sequence;

        private ArmedTimer(Timeout timeout, long expiryNanos, int intervalMillis, long sequence) {
            this.timeout = timeout;
            this.expiryNanos = expiryNanos;
            this.intervalMillis = intervalMillis;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(ArmedTimer o) {
            int c = Long.compare(expiryNanos, o.expiryNanos);
            return c != 0 ? c : Long.compare(sequence, o.sequence);
        }
    }
}
