package com.questrail.peripheral.radio;

import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.RadioState;
import com.questrail.peripheral.api.ServiceId;

import java.util.List;
import java.util.Map;

/**
 * RadioSessionListener
 * -----------------------------------------------------------------------------
 * Event surface of an open radio session.
 *
 * <p>Callbacks may be delivered on any thread and may interleave across
 * peripherals. A {@code null} cause or error means the operation succeeded or,
 * for disconnections, that the link closed gracefully.</p>
 */
public interface RadioSessionListener
{
    void onStateChanged(RadioState state);

    void onPeripheralDiscovered(PeripheralId peripheral, Map<String, Object> advertisement, int rssi);

    void onConnected(PeripheralId peripheral);

    /**
     * @param cause failure reported by the radio; may be {@code null} when the
     *              radio gives no reason
     */
    void onConnectFailed(PeripheralId peripheral, Throwable cause);

    /**
     * @param cause failure that closed the link; {@code null} for an orderly
     *              disconnection
     */
    void onDisconnected(PeripheralId peripheral, Throwable cause);

    /**
     * @param services discovered services; ignored when {@code error} is set
     * @param error    discovery failure, or {@code null}
     */
    void onServicesDiscovered(PeripheralId peripheral, List<ServiceId> services, Throwable error);

    /**
     * @param characteristics discovered characteristics; ignored when
     *                        {@code error} is set
     * @param error           discovery failure, or {@code null}
     */
    void onCharacteristicsDiscovered(PeripheralId peripheral, ServiceId service,
                                     List<DiscoveredCharacteristic> characteristics, Throwable error);
}
