package com.questrail.peripheral.internal.discovery;

import com.questrail.peripheral.api.CharacteristicId;
import com.questrail.peripheral.api.ConnectionRoute;
import com.questrail.peripheral.api.KnownPath;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.ServiceId;
import com.questrail.peripheral.internal.events.DiscoveryEvent;
import com.questrail.peripheral.radio.DiscoveredCharacteristic;
import com.questrail.peripheral.radio.RadioSession;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * PathDiscoverer
 * -----------------------------------------------------------------------------
 * Resolves the {@link ConnectionRoute} requested for one connect attempt into a
 * flat list of {@link KnownPath}s.
 *
 * <h2>Protocol</h2>
 * <pre>
 *   start()                      → discoverServices(route filter)
 *   services discovered (ok)     → discoverCharacteristics(s) for each routed s
 *   characteristics for s (ok)   → s leaves the awaited set
 *   awaited set empty            → onPathsResolved(paths)
 *   any discovery error          → onDiscoveryFailed(cause)
 * </pre>
 *
 * <h2>Completion</h2>
 * The listener is called exactly once. The first error wins; characteristic
 * results still in flight for other services are not cancelled, they are
 * ignored when they arrive. A discoverer is discarded after completion.
 *
 * <h2>Threading</h2>
 * Not thread-safe. The owner feeds it discovery events from the serialized event
 * lane; its awaited-service set is private to one attempt.
 */
public final class PathDiscoverer
{
    private enum Phase {
        CREATED,
        AWAITING_SERVICES,
        AWAITING_CHARACTERISTICS,
        COMPLETED
    }

    private final PeripheralId peripheral;
    private final ConnectionRoute route;
    private final RadioSession radio;
    private final PathDiscoveryListener listener;

    private final Set<ServiceId> awaited = new LinkedHashSet<>();
    private final Map<ServiceId, List<DiscoveredCharacteristic>> resolved = new LinkedHashMap<>();

    private Phase phase = Phase.CREATED;

    public PathDiscoverer(PeripheralId peripheral,
                          ConnectionRoute route,
                          RadioSession radio,
                          PathDiscoveryListener listener) {
        this.peripheral = Objects.requireNonNull(peripheral, "peripheral");
        this.route = Objects.requireNonNull(route, "route");
        this.radio = Objects.requireNonNull(radio, "radio");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public PeripheralId peripheral() {
        return peripheral;
    }

    public boolean isCompleted() {
        return phase == Phase.COMPLETED;
    }

    /**
     * Issues service discovery. May be called once.
     */
    public void start() {
        if (phase != Phase.CREATED) {
            throw new IllegalStateException("PathDiscoverer for " + peripheral + " already started");
        }
        phase = Phase.AWAITING_SERVICES;
        radio.discoverServices(peripheral, route.serviceFilter());
    }

    /**
     * Feeds a service-discovery result.
     *
     * @return false if the result was not expected in the current phase
     */
    public boolean onServicesDiscovered(DiscoveryEvent.ServicesDiscovered event) {
        if (phase != Phase.AWAITING_SERVICES || !event.peripheral().equals(peripheral)) {
            return false;
        }
        if (event.error().isPresent()) {
            fail(event.error().get());
            return true;
        }

        for (ServiceId service : event.services()) {
            if (route.includes(service)) {
                awaited.add(service);
            }
        }
        phase = Phase.AWAITING_CHARACTERISTICS;

        if (awaited.isEmpty()) {
            complete();
            return true;
        }
        for (ServiceId service : List.copyOf(awaited)) {
            radio.discoverCharacteristics(peripheral, service, route.characteristicFilter(service));
        }
        return true;
    }

    /**
     * Feeds a characteristic-discovery result.
     *
     * @return false if the result was not expected in the current phase
     */
    public boolean onCharacteristicsDiscovered(DiscoveryEvent.CharacteristicsDiscovered event) {
        if (phase != Phase.AWAITING_CHARACTERISTICS
                || !event.peripheral().equals(peripheral)
                || !awaited.contains(event.service())) {
            return false;
        }
        if (event.error().isPresent()) {
            fail(event.error().get());
            return true;
        }

        resolved.put(event.service(), retainRequested(event.service(), event.characteristics()));
        awaited.remove(event.service());
        if (awaited.isEmpty()) {
            complete();
        }
        return true;
    }

    /**
     * Stops the run without notifying the listener; later results are ignored.
     */
    public void abandon() {
        phase = Phase.COMPLETED;
    }

    private List<DiscoveredCharacteristic> retainRequested(ServiceId service,
                                                           List<DiscoveredCharacteristic> reported) {
        Optional<Set<CharacteristicId>> filter = route.characteristicFilter(service);
        if (filter.isEmpty()) {
            return reported;
        }
        return reported.stream()
                .filter(c -> filter.get().contains(c.id()))
                .toList();
    }

    private void complete() {
        phase = Phase.COMPLETED;
        List<KnownPath> paths = new ArrayList<>();
        resolved.forEach((service, characteristics) -> {
            for (DiscoveredCharacteristic c : characteristics) {
                paths.add(new KnownPath(peripheral, service, c.id(), c.handle()));
            }
        });
        listener.onPathsResolved(this, List.copyOf(paths));
    }

    private void fail(Throwable cause) {
        phase = Phase.COMPLETED;
        listener.onDiscoveryFailed(this, cause);
    }
}
