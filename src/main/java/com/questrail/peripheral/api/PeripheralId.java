package com.questrail.peripheral.api;

import java.util.Objects;
import java.util.UUID;

/**
 * Stable, opaque identifier of a physical peripheral.
 * <p>
 * The identifier is assigned by the radio layer and is the only identity used
 * throughout the stack: two reports with the same identifier describe the same
 * device.
 */
public record PeripheralId(UUID value)
{
    public PeripheralId {
        Objects.requireNonNull(value, "value");
    }

    public static PeripheralId of(String text) {
        return new PeripheralId(UUID.fromString(text));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
