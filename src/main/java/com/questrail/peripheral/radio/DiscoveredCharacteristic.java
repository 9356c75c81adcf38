package com.questrail.peripheral.radio;

import com.questrail.peripheral.api.CharacteristicHandle;
import com.questrail.peripheral.api.CharacteristicId;

import java.util.Objects;

/**
 * One characteristic reported by characteristic discovery.
 */
public record DiscoveredCharacteristic(CharacteristicId id, CharacteristicHandle handle)
{
    public DiscoveredCharacteristic {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(handle, "handle");
    }
}
