package com.questrail.peripheral.internal.events;

import com.questrail.peripheral.api.DiscoveredPeripheral;
import com.questrail.peripheral.api.RadioState;

import java.time.Instant;
import java.util.Objects;

/**
 * Events about the radio itself and about advertisements it hears.
 */
public sealed interface RadioLifecycleEvent extends RadioEvent
        permits RadioLifecycleEvent.StateChanged, RadioLifecycleEvent.PeripheralDiscovered
{
    /** The radio reported a new raw state. */
    final class StateChanged extends RadioEvent.Base implements RadioLifecycleEvent {
        private final RadioState state;

        public StateChanged(Instant timestamp, long sessionEpoch, RadioState state) {
            super(timestamp, sessionEpoch);
            this.state = Objects.requireNonNull(state, "state");
        }

        public RadioState state() {
            return state;
        }

        @Override
        public String toString() {
            return "StateChanged[" + state + "]";
        }
    }

    /** An advertisement report was received while scanning. */
    final class PeripheralDiscovered extends RadioEvent.Base implements RadioLifecycleEvent {
        private final DiscoveredPeripheral peripheral;

        public PeripheralDiscovered(long sessionEpoch, DiscoveredPeripheral peripheral) {
            super(peripheral.discoveredAt(), sessionEpoch);
            this.peripheral = peripheral;
        }

        public DiscoveredPeripheral peripheral() {
            return peripheral;
        }

        @Override
        public String toString() {
            return "PeripheralDiscovered[" + peripheral.id() + ", rssi=" + peripheral.rssi() + "]";
        }
    }
}
