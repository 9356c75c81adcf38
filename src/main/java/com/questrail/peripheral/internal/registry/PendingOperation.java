package com.questrail.peripheral.internal.registry;

import com.questrail.peripheral.api.ConnectionRoute;
import com.questrail.peripheral.api.ErrorHandler;
import com.questrail.peripheral.api.PeripheralId;

import java.util.Objects;
import java.util.Optional;

/**
 * PendingOperation
 * -----------------------------------------------------------------------------
 * One in-flight instruction recorded in the {@link OperationRegistry}.
 *
 * <h2>Identity</h2>
 * Two operations are equal when they have the same {@link Instruction} and the
 * same addressee peripheral. The error handler and route do not take part:
 * they describe <em>who asked</em>, not <em>what is pending</em>. Scanning has
 * no addressee, so at most one scanning operation can exist.
 *
 * <h2>Addressee</h2>
 * Connecting and disconnecting operations carry an {@link Addressee}: the
 * peripheral, the error handler owed to the caller, and for connecting the route
 * to resolve once connected.
 */
public final class PendingOperation
{
    public enum Instruction {
        SCANNING,
        CONNECTING,
        DISCONNECTING
    }

    /**
     * Target of a per-peripheral operation and the caller it reports to.
     */
    public static final class Addressee {
        private final PeripheralId peripheral;
        private final ErrorHandler onError;
        private final ConnectionRoute route;

        private Addressee(PeripheralId peripheral, ErrorHandler onError, ConnectionRoute route) {
            this.peripheral = Objects.requireNonNull(peripheral, "peripheral");
            this.onError = Objects.requireNonNull(onError, "onError");
            this.route = route;
        }

        public PeripheralId peripheral() {
            return peripheral;
        }

        public ErrorHandler onError() {
            return onError;
        }

        /**
         * Requested route; present for connecting operations only.
         */
        public Optional<ConnectionRoute> route() {
            return Optional.ofNullable(route);
        }
    }

    /**
     * Uniqueness key: (instruction, addressee peripheral).
     */
    public record Key(Instruction instruction, Optional<PeripheralId> peripheral) {
        public Key {
            Objects.requireNonNull(instruction, "instruction");
            Objects.requireNonNull(peripheral, "peripheral");
        }
    }

    private static final PendingOperation SCANNING = new PendingOperation(Instruction.SCANNING, null);

    private final Instruction instruction;
    private final Addressee addressee;

    private PendingOperation(Instruction instruction, Addressee addressee) {
        this.instruction = instruction;
        this.addressee = addressee;
    }

    public static PendingOperation scanning() {
        return SCANNING;
    }

    public static PendingOperation connecting(PeripheralId peripheral, ConnectionRoute route, ErrorHandler onError) {
        Objects.requireNonNull(route, "route");
        return new PendingOperation(Instruction.CONNECTING, new Addressee(peripheral, onError, route));
    }

    public static PendingOperation disconnecting(PeripheralId peripheral, ErrorHandler onError) {
        return new PendingOperation(Instruction.DISCONNECTING, new Addressee(peripheral, onError, null));
    }

    public Instruction instruction() {
        return instruction;
    }

    public Optional<Addressee> addressee() {
        return Optional.ofNullable(addressee);
    }

    public Optional<PeripheralId> peripheral() {
        return addressee == null ? Optional.empty() : Optional.of(addressee.peripheral());
    }

    public Key key() {
        return new Key(instruction, peripheral());
    }

    public boolean isAddressedTo(PeripheralId peripheral) {
        return addressee != null && addressee.peripheral().equals(peripheral);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PendingOperation that)) return false;
        return key().equals(that.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    @Override
    public String toString() {
        return addressee == null ? instruction.toString() : instruction + "(" + addressee.peripheral() + ")";
    }
}
