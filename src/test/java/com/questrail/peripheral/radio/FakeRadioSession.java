package com.questrail.peripheral.radio;

import com.questrail.peripheral.api.CharacteristicHandle;
import com.questrail.peripheral.api.CharacteristicId;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.RadioState;
import com.questrail.peripheral.api.ServiceId;
import com.questrail.peripheral.config.ConnectionOptions;
import com.questrail.peripheral.config.ScanConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * FakeRadioSession
 * -----------------------------------------------------------------------------
 * Test-only {@link RadioSession} implementation.
 *
 * <p>Records every command it receives and lets tests inject listener callbacks
 * as the radio would deliver them. It contains no radio semantics: nothing is
 * delivered unless a test asks for it.</p>
 */
public final class FakeRadioSession implements RadioSession {

    public sealed interface Command permits StartScan, StopScan, Connect, CancelOrDisconnect,
            DiscoverServices, DiscoverCharacteristics {}

    public record StartScan(ScanConfiguration configuration) implements Command {}
    public record StopScan() implements Command {}
    public record Connect(PeripheralId peripheral, ConnectionOptions options) implements Command {}
    public record CancelOrDisconnect(PeripheralId peripheral) implements Command {}
    public record DiscoverServices(PeripheralId peripheral, Optional<Set<ServiceId>> filter) implements Command {}
    public record DiscoverCharacteristics(PeripheralId peripheral, ServiceId service,
                                          Optional<Set<CharacteristicId>> filter) implements Command {}

    /** Opaque handle used for characteristics reported by this fake. */
    public record Handle(String label) implements CharacteristicHandle {}

    private final RadioSessionListener listener;
    private final List<Command> commands = new ArrayList<>();
    private final Map<PeripheralId, PeripheralId> knownIdentifiers = new HashMap<>();
    private final Map<ServiceId, List<PeripheralId>> connectedByService = new HashMap<>();
    private boolean closed;

    /**
     * Session with nobody listening; for tests that only inspect commands.
     */
    public FakeRadioSession() {
        this(new RadioSessionListener() {
            @Override public void onStateChanged(RadioState state) {}
            @Override public void onPeripheralDiscovered(PeripheralId p, Map<String, Object> a, int rssi) {}
            @Override public void onConnected(PeripheralId p) {}
            @Override public void onConnectFailed(PeripheralId p, Throwable cause) {}
            @Override public void onDisconnected(PeripheralId p, Throwable cause) {}
            @Override public void onServicesDiscovered(PeripheralId p, List<ServiceId> s, Throwable e) {}
            @Override public void onCharacteristicsDiscovered(PeripheralId p, ServiceId s,
                                                              List<DiscoveredCharacteristic> c, Throwable e) {}
        });
    }

    public FakeRadioSession(RadioSessionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    // ---------------------------------------------------------------------
    // RadioSession
    // ---------------------------------------------------------------------

    @Override
    public synchronized void startScan(ScanConfiguration configuration) {
        commands.add(new StartScan(configuration));
    }

    @Override
    public synchronized void stopScan() {
        commands.add(new StopScan());
    }

    @Override
    public synchronized void connect(PeripheralId peripheral, ConnectionOptions options) {
        commands.add(new Connect(peripheral, options));
    }

    @Override
    public synchronized void cancelOrDisconnect(PeripheralId peripheral) {
        commands.add(new CancelOrDisconnect(peripheral));
    }

    @Override
    public synchronized Optional<PeripheralId> lookupKnownIdentifier(PeripheralId peripheral) {
        return Optional.ofNullable(knownIdentifiers.get(peripheral));
    }

    @Override
    public synchronized List<PeripheralId> lookupConnectedMatchingServices(Set<ServiceId> services) {
        return services.stream()
                .flatMap(s -> connectedByService.getOrDefault(s, List.of()).stream())
                .distinct()
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void discoverServices(PeripheralId peripheral, Optional<Set<ServiceId>> filter) {
        commands.add(new DiscoverServices(peripheral, filter));
    }

    @Override
    public synchronized void discoverCharacteristics(PeripheralId peripheral, ServiceId service,
                                                     Optional<Set<CharacteristicId>> filter) {
        commands.add(new DiscoverCharacteristics(peripheral, service, filter));
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    // ---------------------------------------------------------------------
    // Test helpers: scripted lookups
    // ---------------------------------------------------------------------

    public synchronized void rememberIdentifier(PeripheralId peripheral) {
        knownIdentifiers.put(peripheral, peripheral);
    }

    public synchronized void addSystemConnected(ServiceId service, PeripheralId peripheral) {
        connectedByService.computeIfAbsent(service, s -> new ArrayList<>()).add(peripheral);
    }

    // ---------------------------------------------------------------------
    // Test helpers: inbound callbacks
    // ---------------------------------------------------------------------

    public void emitState(RadioState state) {
        listener.onStateChanged(state);
    }

    public void emitPoweredOn() {
        emitState(RadioState.POWERED_ON);
    }

    public void emitDiscovered(PeripheralId peripheral, int rssi) {
        listener.onPeripheralDiscovered(peripheral, Map.of("rssi", rssi), rssi);
    }

    public void emitDiscovered(PeripheralId peripheral, Map<String, Object> advertisement, int rssi) {
        listener.onPeripheralDiscovered(peripheral, advertisement, rssi);
    }

    public void emitConnected(PeripheralId peripheral) {
        listener.onConnected(peripheral);
    }

    public void emitConnectFailed(PeripheralId peripheral, Throwable cause) {
        listener.onConnectFailed(peripheral, cause);
    }

    public void emitDisconnected(PeripheralId peripheral, Throwable cause) {
        listener.onDisconnected(peripheral, cause);
    }

    public void emitServices(PeripheralId peripheral, ServiceId... services) {
        listener.onServicesDiscovered(peripheral, List.of(services), null);
    }

    public void emitServicesFailed(PeripheralId peripheral, Throwable error) {
        listener.onServicesDiscovered(peripheral, null, error);
    }

    public void emitCharacteristics(PeripheralId peripheral, ServiceId service, CharacteristicId... characteristics) {
        List<DiscoveredCharacteristic> reported = new ArrayList<>();
        for (CharacteristicId c : characteristics) {
            reported.add(new DiscoveredCharacteristic(c, new Handle(service + "/" + c)));
        }
        listener.onCharacteristicsDiscovered(peripheral, service, reported, null);
    }

    public void emitCharacteristicsFailed(PeripheralId peripheral, ServiceId service, Throwable error) {
        listener.onCharacteristicsDiscovered(peripheral, service, null, error);
    }

    // ---------------------------------------------------------------------
    // Test helpers: assertions
    // ---------------------------------------------------------------------

    public synchronized List<Command> commands() {
        return Collections.unmodifiableList(new ArrayList<>(commands));
    }

    public synchronized <T extends Command> List<T> commands(Class<T> type) {
        return commands.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized void clear() {
        commands.clear();
    }
}
