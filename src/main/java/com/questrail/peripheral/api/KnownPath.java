package com.questrail.peripheral.api;

import java.util.Objects;

/**
 * A resolved, directly addressable endpoint on a connected peripheral.
 * <p>
 * Known paths exist only between a successful path resolution and the
 * disconnection of their peripheral.
 */
public record KnownPath(PeripheralId peripheral,
                        ServiceId service,
                        CharacteristicId characteristic,
                        CharacteristicHandle handle)
{
    public KnownPath {
        Objects.requireNonNull(peripheral, "peripheral");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(characteristic, "characteristic");
        Objects.requireNonNull(handle, "handle");
    }

    public boolean matches(PeripheralId peripheral, ServiceId service, CharacteristicId characteristic) {
        return this.peripheral.equals(peripheral)
                && this.service.equals(service)
                && this.characteristic.equals(characteristic);
    }
}
