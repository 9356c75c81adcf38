package com.questrail.peripheral.observability;

import com.questrail.peripheral.internal.events.RadioEvent;

/**
 * No-op implementation of PeripheralObservabilitySink.
 */
public final class NullObservabilitySink implements PeripheralObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRegistryTransition(RegistryTransitionEvent event) {}

    @Override
    public void onRadioEvent(RadioEvent event) {}

    @Override
    public void onAnomaly(SessionAnomalyEvent event) {}

    @Override
    public void onError(PeripheralErrorEvent event) {}
}
