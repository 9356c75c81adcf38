package com.questrail.peripheral.internal.discovery;

import com.questrail.peripheral.api.CharacteristicId;
import com.questrail.peripheral.api.ConnectionRoute;
import com.questrail.peripheral.api.KnownPath;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.ServiceId;
import com.questrail.peripheral.internal.events.DiscoveryEvent;
import com.questrail.peripheral.radio.DiscoveredCharacteristic;
import com.questrail.peripheral.radio.FakeRadioSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PathDiscovererTest
{
    private static final PeripheralId P = PeripheralId.of("6f1f4b6e-3f57-4d6c-9c57-2f0c1d1e0a01");
    private static final PeripheralId OTHER = PeripheralId.of("6f1f4b6e-3f57-4d6c-9c57-2f0c1d1e0a02");
    private static final ServiceId S1 = ServiceId.ofShort(0x1800);
    private static final ServiceId S2 = ServiceId.ofShort(0x1801);
    private static final ServiceId S3 = ServiceId.ofShort(0x1802);
    private static final CharacteristicId C1 = CharacteristicId.ofShort(0x2A00);
    private static final CharacteristicId C2 = CharacteristicId.ofShort(0x2A01);

    private FakeRadioSession radio;
    private List<List<KnownPath>> resolved;
    private List<Throwable> failures;
    private PathDiscoveryListener listener;

    @BeforeEach
    void setUp() {
        radio = new FakeRadioSession();
        resolved = new ArrayList<>();
        failures = new ArrayList<>();
        listener = new PathDiscoveryListener() {
            @Override
            public void onPathsResolved(PathDiscoverer discoverer, List<KnownPath> paths) {
                resolved.add(paths);
            }

            @Override
            public void onDiscoveryFailed(PathDiscoverer discoverer, Throwable cause) {
                failures.add(cause);
            }
        };
    }

    private static DiscoveryEvent.ServicesDiscovered services(PeripheralId p, ServiceId... services) {
        return new DiscoveryEvent.ServicesDiscovered(Instant.EPOCH, 1, p, List.of(services), null);
    }

    private static DiscoveryEvent.CharacteristicsDiscovered characteristics(ServiceId s, CharacteristicId... ids) {
        List<DiscoveredCharacteristic> reported = new ArrayList<>();
        for (CharacteristicId id : ids) {
            reported.add(new DiscoveredCharacteristic(id, new FakeRadioSession.Handle(s + "/" + id)));
        }
        return new DiscoveryEvent.CharacteristicsDiscovered(Instant.EPOCH, 1, P, s, reported, null);
    }

    private static DiscoveryEvent.CharacteristicsDiscovered characteristicsFailed(ServiceId s, Throwable error) {
        return new DiscoveryEvent.CharacteristicsDiscovered(Instant.EPOCH, 1, P, s, null, error);
    }

    @Test
    void startRequestsRoutedServices() {
        ConnectionRoute route = ConnectionRoute.builder().withService(S1, C1).build();
        new PathDiscoverer(P, route, radio, listener).start();

        assertEquals(List.of(new FakeRadioSession.DiscoverServices(P, Optional.of(Set.of(S1)))), radio.commands());
    }

    @Test
    void allServicesRouteRequestsWithoutFilter() {
        PathDiscoverer discoverer = new PathDiscoverer(P, ConnectionRoute.allServices(), radio, listener);
        discoverer.start();
        discoverer.onServicesDiscovered(services(P, S1, S2));

        assertEquals(List.of(
                new FakeRadioSession.DiscoverServices(P, Optional.empty()),
                new FakeRadioSession.DiscoverCharacteristics(P, S1, Optional.empty()),
                new FakeRadioSession.DiscoverCharacteristics(P, S2, Optional.empty())), radio.commands());
    }

    @Test
    void startTwiceIsRejected() {
        PathDiscoverer discoverer = new PathDiscoverer(P, ConnectionRoute.allServices(), radio, listener);
        discoverer.start();

        assertThrows(IllegalStateException.class, discoverer::start);
    }

    @Test
    void completesOnceAllAwaitedServicesReport() {
        ConnectionRoute route = ConnectionRoute.builder()
                .withService(S1, C1)
                .withService(S2)
                .build();
        PathDiscoverer discoverer = new PathDiscoverer(P, route, radio, listener);
        discoverer.start();

        assertTrue(discoverer.onServicesDiscovered(services(P, S1, S2, S3)));
        assertEquals(2, radio.commands(FakeRadioSession.DiscoverCharacteristics.class).size(),
                "S3 was not requested");
        assertEquals(Optional.of(Set.of(C1)),
                radio.commands(FakeRadioSession.DiscoverCharacteristics.class).get(0).filter());

        assertTrue(discoverer.onCharacteristicsDiscovered(characteristics(S2, C1, C2)));
        assertTrue(resolved.isEmpty());

        assertTrue(discoverer.onCharacteristicsDiscovered(characteristics(S1, C1, C2)));

        assertEquals(1, resolved.size());
        List<KnownPath> paths = resolved.get(0);
        assertEquals(3, paths.size(), "C2 on S1 was not requested");
        assertTrue(paths.stream().anyMatch(p -> p.matches(P, S1, C1)));
        assertTrue(paths.stream().noneMatch(p -> p.matches(P, S1, C2)));
        assertTrue(paths.stream().anyMatch(p -> p.matches(P, S2, C2)));
        assertTrue(discoverer.isCompleted());
    }

    @Test
    void noRoutedServicesCompletesImmediately() {
        ConnectionRoute route = ConnectionRoute.builder().withService(S1).build();
        PathDiscoverer discoverer = new PathDiscoverer(P, route, radio, listener);
        discoverer.start();

        discoverer.onServicesDiscovered(services(P));

        assertEquals(List.of(List.of()), resolved);
        assertTrue(radio.commands(FakeRadioSession.DiscoverCharacteristics.class).isEmpty());
    }

    @Test
    void serviceDiscoveryErrorFails() {
        IOException error = new IOException("gatt");
        PathDiscoverer discoverer = new PathDiscoverer(P, ConnectionRoute.allServices(), radio, listener);
        discoverer.start();

        discoverer.onServicesDiscovered(new DiscoveryEvent.ServicesDiscovered(Instant.EPOCH, 1, P, null, error));

        assertEquals(List.of(error), failures);
        assertTrue(resolved.isEmpty());
        assertTrue(discoverer.isCompleted());
    }

    @Test
    void firstCharacteristicErrorWinsAndLaterResultsAreRejected() {
        IOException first = new IOException("first");
        PathDiscoverer discoverer = new PathDiscoverer(P, ConnectionRoute.allServices(), radio, listener);
        discoverer.start();
        discoverer.onServicesDiscovered(services(P, S1, S2));

        assertTrue(discoverer.onCharacteristicsDiscovered(characteristicsFailed(S1, first)));
        assertFalse(discoverer.onCharacteristicsDiscovered(characteristicsFailed(S2, new IOException("second"))));
        assertFalse(discoverer.onCharacteristicsDiscovered(characteristics(S2, C1)));

        assertEquals(List.of(first), failures);
        assertTrue(resolved.isEmpty());
    }

    @Test
    void unexpectedResultsAreRejected() {
        PathDiscoverer discoverer = new PathDiscoverer(P, ConnectionRoute.allServices(), radio, listener);

        assertFalse(discoverer.onServicesDiscovered(services(P, S1)), "not started");
        discoverer.start();
        assertFalse(discoverer.onCharacteristicsDiscovered(characteristics(S1, C1)), "services not yet known");
        assertFalse(discoverer.onServicesDiscovered(services(OTHER, S1)), "other peripheral");

        discoverer.onServicesDiscovered(services(P, S1));
        assertFalse(discoverer.onServicesDiscovered(services(P, S1)), "services already known");
        assertFalse(discoverer.onCharacteristicsDiscovered(characteristics(S2, C1)), "S2 not awaited");
    }

    @Test
    void abandonSuppressesCompletion() {
        PathDiscoverer discoverer = new PathDiscoverer(P, ConnectionRoute.allServices(), radio, listener);
        discoverer.start();
        discoverer.onServicesDiscovered(services(P, S1));

        discoverer.abandon();

        assertFalse(discoverer.onCharacteristicsDiscovered(characteristics(S1, C1)));
        assertTrue(resolved.isEmpty());
        assertTrue(failures.isEmpty());
    }
}
