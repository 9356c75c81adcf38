package com.questrail.peripheral.internal.registry;

import com.questrail.peripheral.api.Outcome;
import com.questrail.peripheral.api.PeripheralId;
import com.questrail.peripheral.api.StackError;
import com.questrail.peripheral.api.StateView;
import com.questrail.peripheral.internal.state.StateContainer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * OperationRegistry
 * -----------------------------------------------------------------------------
 * Mutual-exclusion ledger of in-flight scan, connect and disconnect operations.
 *
 * <h2>Invariant</h2>
 * The registry never holds two operations with the same
 * {@link PendingOperation.Key} (instruction, addressee peripheral). Scanning has
 * no addressee and is therefore a singleton flag.
 *
 * <h2>Publication</h2>
 * State is a single immutable {@link RegistrySnapshot}. Every mutation builds a
 * new snapshot and publishes it whole through {@link #view()}, so readers on any
 * thread see either the state before a mutation or the state after it.
 * Mutations must run under the monitor shared with the view container; queries
 * may run anywhere.
 */
public final class OperationRegistry
{
    private final Object monitor;
    private final StateContainer<RegistrySnapshot> snapshots;

    public OperationRegistry(Object monitor) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.snapshots = new StateContainer<>("registry", RegistrySnapshot.empty(), monitor);
    }

    /**
     * Adds {@code operation} unless an operation with the same key is pending.
     *
     * @return the inserted operation, or {@link StackError.InvalidInstruction}
     */
    public Outcome<PendingOperation> insert(PendingOperation operation) {
        Objects.requireNonNull(operation, "operation");
        synchronized (monitor) {
            RegistrySnapshot current = snapshots.current();
            LinkedHashMap<PendingOperation.Key, PendingOperation> entries = current.mutableCopy();
            if (entries.containsKey(operation.key())) {
                String instruction = operation.instruction().name();
                return Outcome.failure(operation.peripheral()
                        .<StackError>map(p -> StackError.invalidInstruction(instruction, p))
                        .orElseGet(() -> StackError.invalidInstruction(instruction)));
            }
            entries.put(operation.key(), operation);
            snapshots.set(RegistrySnapshot.of(entries));
            return Outcome.success(operation);
        }
    }

    /**
     * Removes the operation with the same key as {@code operation}. Absent
     * operations are ignored; a change is published either way.
     *
     * @return true if an operation was removed
     */
    public boolean remove(PendingOperation operation) {
        Objects.requireNonNull(operation, "operation");
        return removeKey(operation.key()).isPresent();
    }

    /**
     * Removes and returns the operation of the given kind addressed to
     * {@code peripheral}, if one is pending.
     */
    public Optional<PendingOperation> take(PeripheralId peripheral, PendingOperation.Instruction instruction) {
        Objects.requireNonNull(peripheral, "peripheral");
        return removeKey(new PendingOperation.Key(instruction, Optional.of(peripheral)));
    }

    private Optional<PendingOperation> removeKey(PendingOperation.Key key) {
        synchronized (monitor) {
            LinkedHashMap<PendingOperation.Key, PendingOperation> entries = snapshots.current().mutableCopy();
            PendingOperation removed = entries.remove(key);
            snapshots.set(RegistrySnapshot.of(entries));
            return Optional.ofNullable(removed);
        }
    }

    /**
     * Removes every pending operation.
     *
     * @return the operations that were pending, in insertion order
     */
    public List<PendingOperation> clear() {
        synchronized (monitor) {
            List<PendingOperation> removed = List.copyOf(snapshots.current().operations());
            snapshots.set(RegistrySnapshot.empty());
            return removed;
        }
    }

    public boolean contains(PendingOperation.Instruction instruction) {
        return snapshots.current().contains(instruction);
    }

    public boolean contains(PendingOperation.Instruction instruction, PeripheralId peripheral) {
        return snapshots.current().contains(instruction, peripheral);
    }

    /**
     * Finds the operation of the given kind addressed to {@code peripheral}.
     * An empty result means no such operation is pending.
     */
    public Optional<PendingOperation> findAddressee(PeripheralId peripheral, PendingOperation.Instruction instruction) {
        return snapshots.current().find(instruction, peripheral);
    }

    public RegistrySnapshot snapshot() {
        return snapshots.current();
    }

    public StateView<RegistrySnapshot> view() {
        return snapshots;
    }
}
