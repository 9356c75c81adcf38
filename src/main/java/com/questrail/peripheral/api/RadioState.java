package com.questrail.peripheral.api;

/**
 * Raw state of the local radio as reported by the radio session.
 * <p>
 * Only {@link #POWERED_ON} allows scanning and connecting.
 */
public enum RadioState
{
    UNKNOWN,
    RESETTING,
    UNSUPPORTED,
    UNAUTHORIZED,
    POWERED_OFF,
    POWERED_ON;

    public boolean isReady() {
        return this == POWERED_ON;
    }
}
