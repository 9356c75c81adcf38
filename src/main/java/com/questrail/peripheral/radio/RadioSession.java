package com.questrail.peripheral.radio;

import com.questrail.peripheral.api.CharacteristicId;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.ServiceId;
import com.questrail.peripheral.config.ConnectionOptions;
import com.questrail.peripheral.config.ScanConfiguration;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * RadioSession
 * -----------------------------------------------------------------------------
 * Command surface of an open radio session.
 *
 * <p>Every command is fire-and-forget. Outcomes, where there are any, arrive
 * later on the session's {@link RadioSessionListener}. The two lookups are the
 * only synchronous queries.</p>
 */
public interface RadioSession
{
    void startScan(ScanConfiguration configuration);

    void stopScan();

    void connect(PeripheralId peripheral, ConnectionOptions options);

    /**
     * Cancels a pending connect or disconnects an established link. The radio
     * layer does not distinguish the two; either way a
     * {@link RadioSessionListener#onDisconnected} follows.
     */
    void cancelOrDisconnect(PeripheralId peripheral);

    /**
     * Resolves an identifier the radio layer remembers from an earlier session.
     */
    Optional<PeripheralId> lookupKnownIdentifier(PeripheralId peripheral);

    /**
     * Peripherals already connected to the system (possibly by another
     * application) that expose any of the given services.
     */
    List<PeripheralId> lookupConnectedMatchingServices(Set<ServiceId> services);

    /**
     * Starts service discovery; empty filter means all services.
     */
    void discoverServices(PeripheralId peripheral, Optional<Set<ServiceId>> filter);

    /**
     * Starts characteristic discovery for one service; empty filter means all
     * characteristics.
     */
    void discoverCharacteristics(PeripheralId peripheral, ServiceId service,
                                 Optional<Set<CharacteristicId>> filter);

    /**
     * Releases the session. No further listener callbacks are expected, though
     * callbacks already in flight may still arrive.
     */
    void close();
}
