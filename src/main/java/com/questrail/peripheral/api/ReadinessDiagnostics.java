package com.questrail.peripheral.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Pass-through pair used to explain why the stack is not ready.
 *
 * @param radioState    last raw state reported by the radio, empty until a
 *                      session has been initialized and has reported one
 * @param authorization platform authorization for radio use
 */
public record ReadinessDiagnostics(Optional<RadioState> radioState,
                                   AuthorizationState authorization)
{
    public ReadinessDiagnostics {
        Objects.requireNonNull(radioState, "radioState");
        Objects.requireNonNull(authorization, "authorization");
    }
}
