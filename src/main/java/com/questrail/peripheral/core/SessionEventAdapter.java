package com.questrail.peripheral.core;

import com.questrail.peripheral.api.DiscoveredPeripheral;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.RadioState;
import com.questrail.peripheral.api.ServiceId;
import com.questrail.peripheral.internal.events.ConnectionEvent;
import com.questrail.peripheral.internal.events.DiscoveryEvent;
import com.questrail.peripheral.internal.events.RadioEvent;
import com.questrail.peripheral.internal.events.RadioLifecycleEvent;
import com.questrail.peripheral.internal.time.WallClock;
import com.questrail.peripheral.observability.PeripheralErrorEvent;
import com.questrail.peripheral.observability.PeripheralObservabilitySink;
import com.questrail.peripheral.radio.DiscoveredCharacteristic;
import com.questrail.peripheral.radio.RadioSessionListener;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * SessionEventAdapter
 * -----------------------------------------------------------------------------
 * Listener handed to one radio session. Turns each callback into an immutable
 * {@link RadioEvent} stamped with the receive time and the session's epoch, and
 * submits it for serialized processing.
 *
 * <p>This class does nothing else: it runs on the radio layer's threads and
 * must never touch stack state. A callback whose arguments cannot be turned
 * into an event is reported to the observability sink and dropped; nothing is
 * thrown back into the radio layer.</p>
 */
final class SessionEventAdapter implements RadioSessionListener
{
    private final long epoch;
    private final WallClock clock;
    private final PeripheralObservabilitySink observabilitySink;
    private final Consumer<RadioEvent> submit;

    SessionEventAdapter(long epoch,
                        WallClock clock,
                        PeripheralObservabilitySink observabilitySink,
                        Consumer<RadioEvent> submit) {
        this.epoch = epoch;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.submit = Objects.requireNonNull(submit, "submit");
    }

    long epoch() {
        return epoch;
    }

    @Override
    public void onStateChanged(RadioState state) {
        deliver("state change", () -> new RadioLifecycleEvent.StateChanged(clock.now(), epoch, state));
    }

    @Override
    public void onPeripheralDiscovered(PeripheralId peripheral, Map<String, Object> advertisement, int rssi) {
        Map<String, Object> payload = advertisement == null ? Map.of() : advertisement;
        deliver("discovery of " + peripheral, () -> new RadioLifecycleEvent.PeripheralDiscovered(
                epoch, new DiscoveredPeripheral(peripheral, payload, rssi, clock.now())));
    }

    @Override
    public void onConnected(PeripheralId peripheral) {
        deliver("connect of " + peripheral, () -> new ConnectionEvent.Connected(clock.now(), epoch, peripheral));
    }

    @Override
    public void onConnectFailed(PeripheralId peripheral, Throwable cause) {
        deliver("connect failure of " + peripheral,
                () -> new ConnectionEvent.ConnectFailed(clock.now(), epoch, peripheral, cause));
    }

    @Override
    public void onDisconnected(PeripheralId peripheral, Throwable cause) {
        deliver("disconnect of " + peripheral,
                () -> new ConnectionEvent.Disconnected(clock.now(), epoch, peripheral, cause));
    }

    @Override
    public void onServicesDiscovered(PeripheralId peripheral, List<ServiceId> services, Throwable error) {
        deliver("services of " + peripheral,
                () -> new DiscoveryEvent.ServicesDiscovered(clock.now(), epoch, peripheral, services, error));
    }

    @Override
    public void onCharacteristicsDiscovered(PeripheralId peripheral, ServiceId service,
                                            List<DiscoveredCharacteristic> characteristics, Throwable error) {
        deliver("characteristics of " + peripheral, () -> new DiscoveryEvent.CharacteristicsDiscovered(
                clock.now(), epoch, peripheral, service, characteristics, error));
    }

    private void deliver(String what, Supplier<RadioEvent> event) {
        RadioEvent built;
        try {
            built = event.get();
        } catch (RuntimeException e) {
            observabilitySink.onError(new PeripheralErrorEvent(
                    clock.now(), "Malformed radio callback dropped: " + what, e));
            return;
        }
        submit.accept(built);
    }
}
