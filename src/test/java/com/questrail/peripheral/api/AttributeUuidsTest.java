package com.questrail.peripheral.api;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AttributeUuidsTest
{
    @Test
    void shortFormExpandsAgainstBaseUuid() {
        assertEquals(UUID.fromString("0000180d-0000-1000-8000-00805f9b34fb"), AttributeUuids.fromShort(0x180D));
        assertEquals(UUID.fromString("12345678-0000-1000-8000-00805f9b34fb"), AttributeUuids.fromShort(0x12345678L));
    }

    @Test
    void parseAcceptsShortAndFullForms() {
        UUID expected = AttributeUuids.fromShort(0x001A);

        assertEquals(expected, AttributeUuids.parse("001A"));
        assertEquals(expected, AttributeUuids.parse("0000001a"));
        assertEquals(expected, AttributeUuids.parse("0000001A-0000-1000-8000-00805F9B34FB"));
        assertEquals(expected, AttributeUuids.parse(" 001a "));
    }

    @Test
    void parseRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> AttributeUuids.parse("ZZZZ"));
        assertThrows(IllegalArgumentException.class, () -> AttributeUuids.parse("12345"));
        assertThrows(IllegalArgumentException.class, () -> AttributeUuids.fromShort(-1));
    }

    @Test
    void formatUsesShortestForm() {
        assertEquals("180D", AttributeUuids.format(AttributeUuids.fromShort(0x180D)));
        assertEquals("12345678", AttributeUuids.format(AttributeUuids.fromShort(0x12345678L)));
        assertEquals("6E400001-B5A3-F393-E0A9-E50E24DCCA9E",
                AttributeUuids.format(UUID.fromString("6e400001-b5a3-f393-e0a9-e50e24dcca9e")));
    }

    @Test
    void identifiersCompareByUuid() {
        assertEquals(ServiceId.ofShort(0x180F), ServiceId.of("180F"));
        assertEquals(CharacteristicId.ofShort(0x2A19), CharacteristicId.of("00002A19-0000-1000-8000-00805F9B34FB"));
        assertEquals("180F", ServiceId.ofShort(0x180F).toString());
    }
}
