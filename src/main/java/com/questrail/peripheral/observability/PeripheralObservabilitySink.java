package com.questrail.peripheral.observability;

import com.questrail.peripheral.internal.events.RadioEvent;

/**
 * Main interface for receiving peripheral stack observability events.
 * Implementations can provide logging, metrics, or tracing.
 * <p>
 * Callbacks run on the stack's mutation lane and must not block.
 */
public interface PeripheralObservabilitySink {
    /**
     * Called after every registry mutation.
     * @param event the registry contents before and after
     */
    void onRegistryTransition(RegistryTransitionEvent event);

    /**
     * Called for every radio event before it is applied.
     * @param event the event as delivered by the radio session
     */
    void onRadioEvent(RadioEvent event);

    /**
     * Called when the radio session delivers something the stack did not expect
     * (e.g., a connect outcome nobody asked for). The event is dropped.
     * @param event the anomaly details
     */
    void onAnomaly(SessionAnomalyEvent event);

    /**
     * Called when an error occurs that has no caller to report to.
     * @param event the error event
     */
    void onError(PeripheralErrorEvent event);
}
