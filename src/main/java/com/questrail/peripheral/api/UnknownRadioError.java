package com.questrail.peripheral.api;

/**
 * Stand-in cause for a radio failure that was reported without one.
 */
public final class UnknownRadioError extends Exception
{
    public UnknownRadioError(PeripheralId peripheral) {
        super("Radio reported a failure without a cause for " + peripheral);
    }
}
