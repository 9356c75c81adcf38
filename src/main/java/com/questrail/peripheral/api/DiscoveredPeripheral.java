package com.questrail.peripheral.api;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * DiscoveredPeripheral
 * -----------------------------------------------------------------------------
 * One advertisement report for a peripheral seen while scanning.
 *
 * <h2>Identity</h2>
 * Equality and hash code use {@link #id()} only. A later report for the same
 * device is "the same peripheral" with a newer payload, signal and timestamp;
 * collections keyed on this type therefore replace rather than duplicate.
 *
 * <h2>Ordering</h2>
 * {@link #STRONGEST_FIRST} orders by signal strength, strongest (least negative
 * dBm) first. Ties have no defined order.
 *
 * @param id            stable peripheral identifier
 * @param advertisement opaque advertisement payload, keyed by the radio layer;
 *                      null keys and values are dropped
 * @param rssi          received signal strength in dBm
 * @param discoveredAt  time the report was received
 */
public record DiscoveredPeripheral(PeripheralId id,
                                   Map<String, Object> advertisement,
                                   int rssi,
                                   Instant discoveredAt)
{
    public static final Comparator<DiscoveredPeripheral> STRONGEST_FIRST =
            Comparator.comparingInt(DiscoveredPeripheral::rssi).reversed();

    public DiscoveredPeripheral {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(discoveredAt, "discoveredAt");
        advertisement = withoutNulls(Objects.requireNonNull(advertisement, "advertisement"));
    }

    // The radio layer may report absent fields as null values.
    private static Map<String, Object> withoutNulls(Map<String, Object> advertisement) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : advertisement.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscoveredPeripheral that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
