package com.questrail.peripheral.observability;

import com.questrail.peripheral.internal.registry.PendingOperation;
import com.questrail.peripheral.internal.registry.RegistrySnapshot;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Record representing one mutation of the operation registry.
 */
public record RegistryTransitionEvent(
    Instant timestamp,
    RegistrySnapshot before,
    RegistrySnapshot after
) {
    /**
     * Operations present after the mutation but not before.
     */
    public Set<PendingOperation> added() {
        Set<PendingOperation> added = new LinkedHashSet<>(after.operations());
        added.removeAll(before.operations());
        return added;
    }

    /**
     * Operations present before the mutation but not after.
     */
    public Set<PendingOperation> removed() {
        Set<PendingOperation> removed = new LinkedHashSet<>(before.operations());
        removed.removeAll(after.operations());
        return removed;
    }

    public boolean isChange() {
        return !added().isEmpty() || !removed().isEmpty();
    }
}
