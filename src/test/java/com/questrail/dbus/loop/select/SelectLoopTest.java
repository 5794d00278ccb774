package com.questrail.dbus.loop.select;

import com.questrail.dbus.time.ManualMonotonicClock;
import com.questrail.dbus.transport.Timeout;
import com.questrail.dbus.transport.Watch;
import com.questrail.dbus.transport.local.LocalBus;
import com.questrail.dbus.transport.local.LocalConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Pipe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SelectLoopTest
 * -----------------------------------------------------------------------------
 * Timer arithmetic runs on a manual clock; channel readiness uses real pipes.
 */
class SelectLoopTest {

    private ManualMonotonicClock clock;
    private SelectLoop loop;
    private LocalConnection connection;
    private Pipe pipe;

    @BeforeEach
    void setUp() throws IOException {
        clock = new ManualMonotonicClock();
        loop = new SelectLoop(clock, Duration.ofMillis(10));
        connection = new LocalBus().connect();
        loop.bind(connection);
        pipe = Pipe.open();
        pipe.source().configureBlocking(false);
    }

    @AfterEach
    void tearDown() throws IOException {
        loop.close();
        connection.close();
        pipe.source().close();
        pipe.sink().close();
    }

    @Test
    void periodicTimeoutRearmsFromScheduledExpiry() {
        AtomicInteger fired = new AtomicInteger();
        Timeout timeout = new Timeout(100, true, fired::incrementAndGet);
        loop.addTimeout(timeout);

        clock.advanceMillis(100);
        loop.runOnce();
        assertEquals(1, fired.get());

        clock.advanceMillis(100);
        loop.runOnce();
        assertEquals(2, fired.get());

        // Late by 250 ms: expiries at 300 and 400 are both due, 500 is not.
        clock.advanceMillis(250);
        loop.runOnce();
        assertEquals(4, fired.get());

        clock.advanceMillis(50);
        loop.runOnce();
        assertEquals(5, fired.get());
    }

    @Test
    void timeoutDoesNotFireEarly() {
        AtomicInteger fired = new AtomicInteger();
        loop.addTimeout(new Timeout(100, true, fired::incrementAndGet));

        clock.advanceMillis(99);
        loop.runOnce();

        assertEquals(0, fired.get());
    }

    @Test
    void disabledTimeoutIsNotArmedUntilEnabled() {
        AtomicInteger fired = new AtomicInteger();
        Timeout timeout = new Timeout(100, false, fired::incrementAndGet);
        loop.addTimeout(timeout);

        clock.advanceMillis(150);
        loop.runOnce();
        assertEquals(0, fired.get());

        timeout.setEnabled(true);
        loop.timeoutToggled(timeout);
        clock.advanceMillis(100);
        loop.runOnce();
        assertEquals(1, fired.get());

        timeout.setEnabled(false);
        loop.timeoutToggled(timeout);
        clock.advanceMillis(500);
        loop.runOnce();
        assertEquals(1, fired.get());
    }

    @Test
    void intervalChangeRearmsWithNewInterval() {
        AtomicInteger fired = new AtomicInteger();
        Timeout timeout = new Timeout(100, true, fired::incrementAndGet);
        loop.addTimeout(timeout);

        clock.advanceMillis(50);
        timeout.setInterval(30);
        loop.timeoutToggled(timeout);

        clock.advanceMillis(29);
        loop.runOnce();
        assertEquals(0, fired.get());

        clock.advanceMillis(1);
        loop.runOnce();
        assertEquals(1, fired.get());

        clock.advanceMillis(30);
        loop.runOnce();
        assertEquals(2, fired.get());
    }

    @Test
    void timeoutRemovedByItsOwnHandlerIsNotRearmed() {
        AtomicInteger fired = new AtomicInteger();
        AtomicReference<Timeout> self = new AtomicReference<>();
        Timeout timeout = new Timeout(10, true, () -> {
            fired.incrementAndGet();
            loop.removeTimeout(self.get());
        });
        self.set(timeout);
        loop.addTimeout(timeout);

        clock.advanceMillis(100);
        loop.runOnce();

        assertEquals(1, fired.get());
        assertNull(timeout.data());
    }

    @Test
    void readableWatchReceivesObservedFlags() throws IOException {
        List<Integer> observed = new ArrayList<>();
        Watch watch = new Watch(pipe.source(), Watch.READABLE, true, observed::add);
        loop.addWatch(watch);

        pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));
        loop.runOnce();

        assertEquals(List.of(Watch.READABLE), observed);
    }

    @Test
    void disabledWatchIsNotReported() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        Watch watch = new Watch(pipe.source(), Watch.READABLE, false, f -> calls.incrementAndGet());
        loop.addWatch(watch);

        pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));
        loop.runOnce();
        assertEquals(0, calls.get());

        watch.setEnabled(true);
        loop.watchToggled(watch);
        loop.runOnce();
        assertEquals(1, calls.get());
    }

    @Test
    void removedWatchIsNotReported() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        Watch watch = new Watch(pipe.source(), Watch.READABLE, true, f -> calls.incrementAndGet());
        loop.addWatch(watch);
        loop.runOnce();

        loop.removeWatch(watch);
        pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));
        loop.runOnce();

        assertEquals(0, calls.get());
        assertNull(watch.data());
    }

    @Test
    void runReturnsAfterStopFromAnotherThread() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        Thread driver = new Thread(() -> {
            started.countDown();
            loop.run();
        }, "select-loop-test");
        driver.start();
        assertTrue(started.await(1, TimeUnit.SECONDS));

        // Wait until the loop has claimed ownership.
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!loop.isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(1);
        }
        assertTrue(loop.isRunning());
        assertThrows(IllegalStateException.class, loop::run);

        loop.stop();
        driver.join(2_000);

        assertFalse(driver.isAlive());
        assertFalse(loop.isRunning());
    }

    @Test
    void unboundLoopCannotIterate() {
        SelectLoop unbound = new SelectLoop(clock, Duration.ofMillis(10));
        try {
            assertThrows(IllegalStateException.class, unbound::runOnce);
            assertThrows(IllegalStateException.class, () -> loop.bind(connection));
        } finally {
            unbound.close();
        }
    }
}
