package com.questrail.peripheral.observability;

import java.time.Instant;

/**
 * Record representing an error in the peripheral stack that could not be routed
 * to a caller's error handler.
 */
public record PeripheralErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
