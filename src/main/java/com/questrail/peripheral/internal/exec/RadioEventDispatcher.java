package com.questrail.peripheral.internal.exec;

import com.questrail.peripheral.internal.events.RadioEvent;

import java.util.function.Consumer;

/**
 * RadioEventDispatcher
 * -----------------------------------------------------------------------------
 * Serializes radio events onto a single lane.
 *
 * <p>Radio callbacks arrive on arbitrary threads; {@link #submit} may be called
 * from any of them. The dispatcher hands events to its handler one at a time, in
 * submission order, never concurrently.</p>
 */
public interface RadioEventDispatcher
{
    /**
     * Installs the handler and begins delivering events. Idempotent.
     */
    void start(Consumer<RadioEvent> handler);

    /**
     * Stops delivering events. Events submitted afterwards are discarded.
     * Idempotent.
     */
    void stop();

    /**
     * Enqueues an event for delivery.
     */
    void submit(RadioEvent event);
}
