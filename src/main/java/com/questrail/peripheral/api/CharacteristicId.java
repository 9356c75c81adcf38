package com.questrail.peripheral.api;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier of a characteristic inside a service.
 */
public record CharacteristicId(UUID uuid)
{
    public CharacteristicId {
        Objects.requireNonNull(uuid, "uuid");
    }

    /**
     * Accepts the short ("2A37") or the full UUID form.
     */
    public static CharacteristicId of(String text) {
        return new CharacteristicId(AttributeUuids.parse(text));
    }

    public static CharacteristicId ofShort(int shortValue) {
        return new CharacteristicId(AttributeUuids.fromShort(shortValue));
    }

    @Override
    public String toString() {
        return AttributeUuids.format(uuid);
    }
}
