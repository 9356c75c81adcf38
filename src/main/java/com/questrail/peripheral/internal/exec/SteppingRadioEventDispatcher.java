package com.questrail.peripheral.internal.exec;

import com.questrail.peripheral.internal.events.RadioEvent;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Consumer;

/**
 * SteppingRadioEventDispatcher
 * -----------------------------------------------------------------------------
 * Dispatcher without a thread of its own: events are queued on
 * {@link #submit} and applied only when the owner calls {@link #step()} or
 * {@link #drain()}.
 *
 * <h2>Uses</h2>
 * <ul>
 *   <li>Deterministic tests: the test decides exactly when radio events land</li>
 *   <li>Embedding in an application that already owns an event loop and
 *       drains the stack from it</li>
 * </ul>
 *
 * <p>{@link #submit} is safe from any thread. {@code step()} and
 * {@code drain()} must only be called from one thread at a time.</p>
 */
public final class SteppingRadioEventDispatcher implements RadioEventDispatcher
{
    private final ConcurrentLinkedDeque<RadioEvent> queue = new ConcurrentLinkedDeque<>();

    private volatile Consumer<RadioEvent> handler;
    private volatile boolean running;

    @Override
    public void start(Consumer<RadioEvent> handler)
    {
        Objects.requireNonNull(handler, "handler");
        if (!running) {
            this.handler = handler;
            this.running = true;
        }
    }

    @Override
    public void stop()
    {
        running = false;
        queue.clear();
    }

    @Override
    public void submit(RadioEvent event)
    {
        Objects.requireNonNull(event, "event");
        if (running) {
            queue.addLast(event);
        }
    }

    /**
     * Apply exactly one queued event, if present.
     *
     * @return {@code true} if an event was applied; {@code false} if the queue was empty.
     */
    public boolean step()
    {
        if (!running) {
            return false;
        }
        RadioEvent event = queue.pollFirst();
        if (event == null) {
            return false;
        }
        handler.accept(event);
        return true;
    }

    /**
     * Apply queued events until none remain, including events queued while
     * draining.
     *
     * @return number of events applied
     */
    public int drain()
    {
        int applied = 0;
        while (step()) {
            applied++;
        }
        return applied;
    }

    public int queuedEventCount()
    {
        return queue.size();
    }

    /**
     * Optional peek for debugging/test assertions without mutating the queue.
     */
    public Optional<RadioEvent> peekNextEvent()
    {
        return Optional.ofNullable(queue.peekFirst());
    }
}
