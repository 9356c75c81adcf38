package com.questrail.peripheral.api;

/**
 * Cause delivered to pending operations when their radio session is replaced by
 * a new {@link PeripheralStack#initializeSession} call before they completed.
 */
public final class SessionReplacedException extends Exception
{
    public SessionReplacedException() {
        super("Radio session was replaced before the operation completed");
    }
}
