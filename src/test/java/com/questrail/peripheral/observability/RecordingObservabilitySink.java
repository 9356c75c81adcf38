package com.questrail.peripheral.observability;

import com.questrail.peripheral.internal.events.RadioEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements PeripheralObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onRegistryTransition(RegistryTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRadioEvent(RadioEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onAnomaly(SessionAnomalyEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(PeripheralErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized List<SessionAnomalyEvent> getAnomalies() {
        return eventsOfType(SessionAnomalyEvent.class);
    }

    public synchronized List<PeripheralErrorEvent> getErrors() {
        return eventsOfType(PeripheralErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
