package com.questrail.peripheral.observability;

import com.questrail.peripheral.internal.events.RadioEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PeripheralObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPeripheralObservabilitySink implements PeripheralObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPeripheralObservabilitySink.class);

    @Override
    public void onRegistryTransition(RegistryTransitionEvent event) {
        if (!event.isChange()) {
            return;
        }
        for (var added : event.added()) {
            log.info("Pending: {}", added);
        }
        for (var removed : event.removed()) {
            log.info("Settled: {}", removed);
        }
    }

    @Override
    public void onRadioEvent(RadioEvent event) {
        log.debug("Radio Event: {}", event);
    }

    @Override
    public void onAnomaly(SessionAnomalyEvent event) {
        log.warn("Radio session anomaly {} for {}: {}",
            event.kind(),
            event.peripheral().map(Object::toString).orElse("-"),
            event.detail());
    }

    @Override
    public void onError(PeripheralErrorEvent event) {
        log.error("Peripheral Stack Error: {}", event.message(), event.cause());
    }
}
