package com.questrail.peripheral.internal.registry;

import com.questrail.peripheral.api.PeripheralId;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of every pending operation at one point in time, in insertion
 * order.
 */
public final class RegistrySnapshot
{
    private static final RegistrySnapshot EMPTY = new RegistrySnapshot(Map.of());

    private final Map<PendingOperation.Key, PendingOperation> entries;

    private RegistrySnapshot(Map<PendingOperation.Key, PendingOperation> entries) {
        this.entries = entries;
    }

    public static RegistrySnapshot empty() {
        return EMPTY;
    }

    static RegistrySnapshot of(LinkedHashMap<PendingOperation.Key, PendingOperation> entries) {
        return new RegistrySnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    LinkedHashMap<PendingOperation.Key, PendingOperation> mutableCopy() {
        return new LinkedHashMap<>(entries);
    }

    public boolean contains(PendingOperation.Instruction instruction) {
        for (PendingOperation.Key key : entries.keySet()) {
            if (key.instruction() == instruction) {
                return true;
            }
        }
        return false;
    }

    public boolean contains(PendingOperation.Instruction instruction, PeripheralId peripheral) {
        return entries.containsKey(new PendingOperation.Key(instruction, Optional.of(peripheral)));
    }

    public Optional<PendingOperation> find(PendingOperation.Instruction instruction, PeripheralId peripheral) {
        return Optional.ofNullable(entries.get(new PendingOperation.Key(instruction, Optional.of(peripheral))));
    }

    public Collection<PendingOperation> operations() {
        return entries.values();
    }

    public List<PendingOperation> operationsFor(PeripheralId peripheral) {
        return entries.values().stream()
                .filter(op -> op.isAddressedTo(peripheral))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return entries.values().toString();
    }
}
