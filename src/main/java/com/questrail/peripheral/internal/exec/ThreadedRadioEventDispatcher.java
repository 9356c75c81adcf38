package com.questrail.peripheral.internal.exec;

import com.questrail.peripheral.internal.events.RadioEvent;
import com.questrail.peripheral.internal.time.WallClock;
import com.questrail.peripheral.observability.NullObservabilitySink;
import com.questrail.peripheral.observability.PeripheralErrorEvent;
import com.questrail.peripheral.observability.PeripheralObservabilitySink;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * ThreadedRadioEventDispatcher
 * =============================================================================
 * Production dispatcher that runs a dedicated event-loop thread.
 *
 * <h2>Threading Model</h2>
 * Events are queued by the radio layer's threads and taken by one daemon thread,
 * which invokes the handler for each in turn. This ensures:
 * <ul>
 *   <li>No two radio events are applied concurrently</li>
 *   <li>Events are applied in the order the radio delivered them</li>
 *   <li>Radio callback threads never run stack logic and never block</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start(handler)  → dispatch thread running
 *   submit(event)   → queued, applied in arrival order
 *   stop()          → queue discarded, thread joined
 * </pre>
 *
 * <h2>Failures</h2>
 * An exception thrown by the handler is reported to the observability sink and
 * the loop continues with the next event.
 */
public final class ThreadedRadioEventDispatcher implements RadioEventDispatcher {

    static final long SHUTDOWN_WAIT_MILLIS = 5_000;

    private final String threadName;
    private final WallClock clock;
    private final PeripheralObservabilitySink observabilitySink;

    private final BlockingQueue<RadioEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Consumer<RadioEvent> handler;
    private volatile Thread eventLoopThread;

    public ThreadedRadioEventDispatcher(String threadName,
                                        WallClock clock,
                                        PeripheralObservabilitySink observabilitySink) {
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the dispatch thread with the given handler. Has no effect while a
     * thread is already running; a stopped dispatcher may be started again.
     */
    @Override
    public void start(Consumer<RadioEvent> handler) {
        Objects.requireNonNull(handler, "handler");
        if (!running.compareAndSet(false, true)) {
            return;
        }
        this.handler = handler;
        Thread thread = new Thread(this::dispatchUntilStopped, threadName);
        thread.setDaemon(true);
        eventLoopThread = thread;
        thread.start();
    }

    /**
     * Stops dispatching and discards queued events. Waits up to
     * {@link #SHUTDOWN_WAIT_MILLIS} for the dispatch thread to exit, unless
     * called from that thread.
     */
    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread thread = eventLoopThread;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            awaitExit(thread);
        }
        eventQueue.clear();
    }

    @Override
    public void submit(RadioEvent event) {
        Objects.requireNonNull(event, "event");
        if (running.get()) {
            eventQueue.offer(event);
        }
    }

    /**
     * Number of events waiting to be applied.
     */
    public int queuedEventCount() {
        return eventQueue.size();
    }

    private void dispatchUntilStopped() {
        while (running.get()) {
            RadioEvent event;
            try {
                event = eventQueue.take();
            } catch (InterruptedException e) {
                // stop() interrupts the take; anything else keeps the flag set.
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
                continue;
            }
            if (running.get()) {
                dispatch(event);
            }
        }
    }

    private void dispatch(RadioEvent event) {
        try {
            handler.accept(event);
        } catch (RuntimeException e) {
            observabilitySink.onError(new PeripheralErrorEvent(
                    clock.now(), "Radio event handler failed on " + event, e));
        }
    }

    private static void awaitExit(Thread thread) {
        try {
            thread.join(SHUTDOWN_WAIT_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
