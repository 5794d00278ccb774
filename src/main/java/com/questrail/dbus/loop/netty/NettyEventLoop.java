package com.questrail.dbus.loop.netty;

import com.questrail.dbus.internal.time.Cancellable;
import com.questrail.dbus.internal.time.MonotonicClock;
import com.questrail.dbus.internal.time.MonotonicScheduler;
import com.questrail.dbus.internal.time.ScheduledExecutorScheduler;
import com.questrail.dbus.internal.time.SystemMonotonicClock;
import com.questrail.dbus.loop.ConnectionLoop;
import com.questrail.dbus.loop.DispatchDriver;
import com.questrail.dbus.model.Message;
import com.questrail.dbus.transport.Connection;
import com.questrail.dbus.transport.Timeout;
import com.questrail.dbus.transport.Watch;
import io.netty.channel.EventLoopException;
import io.netty.channel.nio.NioEventLoop;
import io.netty.channel.nio.NioTask;
import io.netty.util.concurrent.BlockingOperationException;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * NettyEventLoop
 * =============================================================================
 * Runs a connection inside an existing Netty {@link NioEventLoop}.
 *
 * <p>This is the cooperative model: the application already owns a
 * single-threaded reactor and the bus connection becomes one more set of
 * channels on it.</p>
 *
 * <ul>
 *   <li>Watches are registered with {@link NioEventLoop#register}; each
 *       registration keeps the selection key Netty reports back to it and
 *       only touches it on the loop thread.</li>
 *   <li>Timers go through a {@link MonotonicScheduler}, by default the event
 *       loop itself. A periodic timer re-arms at {@code deadline + interval};
 *       an interval change cancels the pending firing and schedules a new
 *       one, since a scheduled task's delay cannot be changed in place.</li>
 *   <li>Every I/O or timer event is followed by a dispatch pass submitted to
 *       the event loop as a separate task.</li>
 *   <li>Each inbound message is handled on the handler executor, so a
 *       handler that makes a synchronous call blocks its own thread while
 *       the event loop keeps dispatching.</li>
 * </ul>
 *
 * <p>A synchronous call made on the event-loop thread would deadlock; it is
 * rejected with {@link BlockingOperationException}.</p>
 */
public final class NettyEventLoop implements ConnectionLoop
{
    private static final Logger log = LoggerFactory.getLogger(NettyEventLoop.class);

    private final NioEventLoop eventLoop;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Executor handlerExecutor;
    private final ExecutorService ownedExecutor;

    private final Set<Watch> watches = ConcurrentHashMap.newKeySet();
    private final Set<Timeout> timeouts = ConcurrentHashMap.newKeySet();

    private volatile Connection connection;

    /**
     * Timers on the event loop itself; handlers on a private cached pool of
     * daemon threads named {@code dbus-handler-*}, shut down by {@link #close()}.
     */
    public NettyEventLoop(NioEventLoop eventLoop) {
        this(eventLoop, SystemMonotonicClock.INSTANCE, null, null);
    }

    /**
     * @param eventLoop       host reactor (not owned)
     * @param clock           clock for timer deadlines
     * @param scheduler       timer source, or {@code null} for the event loop
     * @param handlerExecutor runs message handlers, or {@code null} for a
     *                        private pool owned by this adapter
     */
    public NettyEventLoop(NioEventLoop eventLoop,
                          MonotonicClock clock,
                          MonotonicScheduler scheduler,
                          Executor handlerExecutor) {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = scheduler != null ? scheduler : new ScheduledExecutorScheduler(eventLoop, clock);
        if (handlerExecutor != null) {
            this.handlerExecutor = handlerExecutor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("dbus-handler", true));
            this.handlerExecutor = ownedExecutor;
        }
    }

    public NioEventLoop eventLoop() {
        return eventLoop;
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

    @Override
    public void spawn(Runnable task) {
        try {
            handlerExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Uncaught exception while handling a message", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Handler executor rejected a message; dropping it", e);
        }
    }

    @Override
    public Message await(CompletableFuture<Message> reply) throws InterruptedException {
        if (eventLoop.inEventLoop()) {
            throw new BlockingOperationException("synchronous bus call on the event loop thread");
        }
        try {
            return reply.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("reply future failed", e.getCause());
        }
    }

    @Override
    public void close() {
        for (Watch watch : watches) {
            removeWatch(watch);
        }
        for (Timeout timeout : timeouts) {
            removeTimeout(timeout);
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    // -------------------------------------------------------------------------
    // Watches
    // -------------------------------------------------------------------------

    @Override
    public void addWatch(Watch watch) {
        Objects.requireNonNull(watch, "watch");
        WatchRegistration registration = new WatchRegistration(watch);
        watch.setData(registration);
        watches.add(watch);
        onLoop(registration::sync);
    }

    @Override
    public void removeWatch(Watch watch) {
        watches.remove(watch);
        Object data = watch.data();
        watch.setData(null);
        if (data instanceof WatchRegistration) {
            WatchRegistration registration = (WatchRegistration) data;
            registration.removed = true;
            onLoop(registration::cancel);
        }
    }

    @Override
    public void watchToggled(Watch watch) {
        Object data = watch.data();
        if (data instanceof WatchRegistration) {
            onLoop(((WatchRegistration) data)::sync);
        }
    }

    /**
     * Loop-thread side of one watch.
     *
     * <p>{@link NioEventLoop#register} does not hand back the selection key, so
     * the key is learned from the first {@link #channelReady} callback. Until
     * then a toggle that clears the interest set cannot be applied directly;
     * {@code channelReady} applies it instead, before reporting anything. All
     * fields are confined to the event loop thread except {@code removed}.</p>
     */
    private final class WatchRegistration implements NioTask<SelectableChannel>
    {
        private final Watch watch;
        private volatile boolean removed;

        private SelectionKey key;
        private boolean registered;

        WatchRegistration(Watch watch) {
            this.watch = watch;
        }

        void sync() {
            if (removed) {
                cancel();
                return;
            }
            SelectableChannel channel = watch.channel();
            int ops = desiredOps();

            if (key != null && !key.isValid()) {
                // Cancelled, or left behind by a selector rebuild.
                key = null;
                registered = false;
            }
            if (key != null) {
                try {
                    key.interestOps(ops);
                    return;
                } catch (CancelledKeyException e) {
                    key = null;
                    registered = false;
                }
            }
            if (ops == 0 || !channel.isOpen()) {
                return;
            }
            if (registered && channel.isRegistered()) {
                // Registered with these ops but no key seen yet; channelReady will catch up.
                return;
            }
            try {
                eventLoop.register(channel, ops, this);
                registered = true;
            } catch (EventLoopException e) {
                if (e.getCause() instanceof CancelledKeyException) {
                    // The old key leaves the selector on the next select; retry after it.
                    eventLoop.execute(this::sync);
                } else {
                    log.warn("Cannot register {} with the event loop", watch, e);
                }
            } catch (IllegalStateException | IllegalArgumentException e) {
                log.warn("Cannot register {} with the event loop", watch, e);
            }
        }

        void cancel() {
            if (key != null) {
                key.cancel();
                key = null;
            }
            registered = false;
        }

        @Override
        public void channelReady(SelectableChannel ch, SelectionKey key) {
            this.key = key;
            if (removed) {
                cancel();
                return;
            }
            int ops = desiredOps();
            if (key.interestOps() != ops) {
                key.interestOps(ops);
            }
            if (ops == 0) {
                return;
            }

            int ready = key.readyOps();
            int observed = 0;
            if ((ready & SelectionKey.OP_READ) != 0) {
                observed |= Watch.READABLE;
            }
            if ((ready & SelectionKey.OP_WRITE) != 0) {
                observed |= Watch.WRITABLE;
            }
            observed &= watch.flags();
            if (observed == 0) {
                return;
            }

            watch.handle(observed);
            scheduleDispatch();
        }

        @Override
        public void channelUnregistered(SelectableChannel ch, Throwable cause) {
            key = null;
            registered = false;
            if (cause != null) {
                log.error("Watch {} was unregistered after a failure", watch, cause);
            }
        }

        private int desiredOps() {
            return watch.isEnabled() ? interestOps(watch) & watch.channel().validOps() : 0;
        }
    }

    // -------------------------------------------------------------------------
    // Timers
    // -------------------------------------------------------------------------

    @Override
    public void addTimeout(Timeout timeout) {
        Objects.requireNonNull(timeout, "timeout");
        TimerRegistration registration = new TimerRegistration(timeout);
        timeout.setData(registration);
        timeouts.add(timeout);
        registration.sync();
    }

    @Override
    public void removeTimeout(Timeout timeout) {
        timeouts.remove(timeout);
        Object data = timeout.data();
        timeout.setData(null);
        if (data instanceof TimerRegistration) {
            ((TimerRegistration) data).remove();
        }
    }

    @Override
    public void timeoutToggled(Timeout timeout) {
        Object data = timeout.data();
        if (data instanceof TimerRegistration) {
            ((TimerRegistration) data).sync();
        }
    }

    /**
     * One periodic timer built from one-shot firings. Each arming gets a new
     * generation; a firing whose generation is stale does nothing.
     */
    private final class TimerRegistration
    {
        private final Timeout timeout;

        private Cancellable pending;
        private long generation;
        private long deadlineNanos;
        private int armedIntervalMillis;
        private boolean removed;

        TimerRegistration(Timeout timeout) {
            this.timeout = timeout;
        }

        synchronized void sync() {
            if (removed) {
                return;
            }
            if (!timeout.isEnabled()) {
                disarm();
                return;
            }
            if (pending != null && armedIntervalMillis == timeout.intervalMillis()) {
                return;
            }
            disarm();
            armAt(clock.nowNanos() + TimeUnit.MILLISECONDS.toNanos(timeout.intervalMillis()));
        }

        synchronized void remove() {
            removed = true;
            disarm();
        }

        private void armAt(long deadline) {
            long armed = ++generation;
            deadlineNanos = deadline;
            armedIntervalMillis = timeout.intervalMillis();
            try {
                pending = scheduler.scheduleAtNanos(deadline, () -> fire(armed));
            } catch (RejectedExecutionException e) {
                pending = null;
                log.debug("Event loop is shutting down; {} not armed", timeout);
            }
        }

        private void disarm() {
            generation++;
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
        }

        private void fire(long armed) {
            synchronized (this) {
                if (removed || armed != generation) {
                    return;
                }
            }

            timeout.handle();
            scheduleDispatch();

            synchronized (this) {
                // handle() may have removed, disabled or re-armed this timer.
                if (!removed && armed == generation && timeout.isEnabled()) {
                    armAt(deadlineNanos + TimeUnit.MILLISECONDS.toNanos(armedIntervalMillis));
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void scheduleDispatch() {
        Connection c = connection;
        if (c == null) {
            return;
        }
        try {
            eventLoop.execute(() -> DispatchDriver.drain(c));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop is shutting down; dispatch pass skipped");
        }
    }

    private void onLoop(Runnable task) {
        if (eventLoop.inEventLoop()) {
            task.run();
            return;
        }
        try {
            eventLoop.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop is shutting down; registration change skipped");
        }
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
}
