package com.questrail.peripheral.api;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * AttributeUuids
 * -----------------------------------------------------------------------------
 * Parsing helpers for attribute identifiers (services and characteristics).
 *
 * <p>Attribute identifiers are 128-bit UUIDs. Peripherals commonly advertise the
 * 16-bit or 32-bit short form, which is an alias inside the Bluetooth base UUID
 * {@code 0000xxxx-0000-1000-8000-00805F9B34FB}.</p>
 */
public final class AttributeUuids
{
    private static final long BASE_LSB = 0x800000805F9B34FBL;
    private static final long BASE_MSB_LOW = 0x0000_1000L;

    private AttributeUuids() {}

    /**
     * Expands a 16-bit or 32-bit short identifier into the full 128-bit form.
     */
    public static UUID fromShort(long shortValue) {
        if (shortValue < 0 || shortValue > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("Short attribute id out of range: " + shortValue);
        }
        return new UUID((shortValue << 32) | BASE_MSB_LOW, BASE_LSB);
    }

    /**
     * Parses an identifier in short ("180D", "0000180D") or full UUID form.
     */
    public static UUID parse(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        if (trimmed.length() == 4 || trimmed.length() == 8) {
            try {
                return fromShort(Long.parseLong(trimmed, 16));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid short attribute id: " + text, e);
            }
        }
        return UUID.fromString(trimmed);
    }

    /**
     * Renders the identifier in its shortest form: 4 or 8 hex digits when it is an
     * alias of the base UUID, the full UUID otherwise.
     */
    public static String format(UUID uuid) {
        Objects.requireNonNull(uuid, "uuid");
        if (uuid.getLeastSignificantBits() == BASE_LSB
                && (uuid.getMostSignificantBits() & 0xFFFF_FFFFL) == BASE_MSB_LOW) {
            long shortValue = uuid.getMostSignificantBits() >>> 32;
            return shortValue <= 0xFFFF
                    ? String.format(Locale.ROOT, "%04X", shortValue)
                    : String.format(Locale.ROOT, "%08X", shortValue);
        }
        return uuid.toString().toUpperCase(Locale.ROOT);
    }
}
