package com.questrail.peripheral.api;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier of a service exposed by a peripheral.
 */
public record ServiceId(UUID uuid)
{
    public ServiceId {
        Objects.requireNonNull(uuid, "uuid");
    }

    /**
     * Accepts the short ("180D") or the full UUID form.
     */
    public static ServiceId of(String text) {
        return new ServiceId(AttributeUuids.parse(text));
    }

    public static ServiceId ofShort(int shortValue) {
        return new ServiceId(AttributeUuids.fromShort(shortValue));
    }

    @Override
    public String toString() {
        return AttributeUuids.format(uuid);
    }
}
