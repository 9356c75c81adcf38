package com.questrail.peripheral.internal.exec;

import com.questrail.peripheral.api.RadioState;
import com.questrail.peripheral.internal.events.RadioEvent;
import com.questrail.peripheral.internal.events.RadioLifecycleEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SteppingRadioEventDispatcherTest
{
    private final SteppingRadioEventDispatcher dispatcher = new SteppingRadioEventDispatcher();
    private final List<RadioEvent> applied = new ArrayList<>();

    private static RadioEvent state(RadioState state) {
        return new RadioLifecycleEvent.StateChanged(Instant.EPOCH, 1, state);
    }

    @Test
    void eventsWaitUntilStepped() {
        dispatcher.start(applied::add);
        RadioEvent first = state(RadioState.POWERED_OFF);
        RadioEvent second = state(RadioState.POWERED_ON);

        dispatcher.submit(first);
        dispatcher.submit(second);
        assertTrue(applied.isEmpty());
        assertEquals(2, dispatcher.queuedEventCount());
        assertEquals(first, dispatcher.peekNextEvent().orElseThrow());

        assertTrue(dispatcher.step());
        assertEquals(List.of(first), applied);

        assertEquals(1, dispatcher.drain());
        assertEquals(List.of(first, second), applied);
        assertFalse(dispatcher.step());
    }

    @Test
    void drainIncludesEventsSubmittedWhileDraining() {
        dispatcher.start(event -> {
            applied.add(event);
            if (applied.size() == 1) {
                dispatcher.submit(state(RadioState.POWERED_ON));
            }
        });
        dispatcher.submit(state(RadioState.RESETTING));

        assertEquals(2, dispatcher.drain());
    }

    @Test
    void nothingIsQueuedBeforeStartOrAfterStop() {
        dispatcher.submit(state(RadioState.POWERED_ON));
        assertEquals(0, dispatcher.queuedEventCount());

        dispatcher.start(applied::add);
        dispatcher.submit(state(RadioState.POWERED_ON));
        dispatcher.stop();

        assertEquals(0, dispatcher.queuedEventCount());
        assertFalse(dispatcher.step());
        assertTrue(applied.isEmpty());
    }
}
