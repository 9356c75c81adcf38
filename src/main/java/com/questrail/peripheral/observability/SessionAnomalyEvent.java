package com.questrail.peripheral.observability;

import com.questrail.peripheral.api.PeripheralId;

import java.time.Instant;
import java.util.Optional;

/**
 * Record describing one dropped, unexpected radio event.
 */
public record SessionAnomalyEvent(
    Instant timestamp,
    AnomalyKind kind,
    Optional<PeripheralId> peripheral,
    String detail
) {
}
