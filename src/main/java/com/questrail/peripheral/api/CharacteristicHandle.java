package com.questrail.peripheral.api;

/**
 * Opaque handle to a resolved characteristic.
 * <p>
 * Handles are minted by the radio layer during characteristic discovery and are
 * handed back to it unchanged when the application talks to the endpoint. The
 * stack never inspects them.
 */
public interface CharacteristicHandle
{
}
