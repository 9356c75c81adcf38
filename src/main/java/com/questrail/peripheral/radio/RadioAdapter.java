package com.questrail.peripheral.radio;

import com.questrail.peripheral.api.AuthorizationState;
import com.questrail.peripheral.config.SessionConfiguration;

/**
 * Platform entry point to the radio.
 */
public interface RadioAdapter
{
    /**
     * Opens a new radio session. The session reports its first
     * {@link RadioSessionListener#onStateChanged} asynchronously.
     *
     * @param configuration session options
     * @param listener      receives every event of the new session
     * @return the command surface of the opened session
     */
    RadioSession open(SessionConfiguration configuration, RadioSessionListener listener);

    /**
     * Current platform authorization for radio use. Available before any session
     * is opened.
     */
    AuthorizationState authorization();
}
