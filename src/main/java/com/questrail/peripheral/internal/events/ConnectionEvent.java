package com.questrail.peripheral.internal.events;

import com.questrail.peripheral.api.PeripheralId;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionEvent
 * -----------------------------------------------------------------------------
 * Terminal outcomes of connect and disconnect commands.
 *
 * <p>These events are not correlated with commands by the radio layer; the
 * stack routes them back to the originating caller through the operation
 * registry, keyed by peripheral identifier.</p>
 */
public sealed interface ConnectionEvent extends RadioEvent
        permits ConnectionEvent.Connected, ConnectionEvent.ConnectFailed, ConnectionEvent.Disconnected
{
    PeripheralId peripheral();

    /** The link to the peripheral is up; paths are not yet resolved. */
    final class Connected extends RadioEvent.Base implements ConnectionEvent {
        private final PeripheralId peripheral;

        public Connected(Instant timestamp, long sessionEpoch, PeripheralId peripheral) {
            super(timestamp, sessionEpoch);
            this.peripheral = Objects.requireNonNull(peripheral, "peripheral");
        }

        @Override
        public PeripheralId peripheral() {
            return peripheral;
        }

        @Override
        public String toString() {
            return "Connected[" + peripheral + "]";
        }
    }

    /** The connect attempt failed; the cause may be absent. */
    final class ConnectFailed extends RadioEvent.Base implements ConnectionEvent {
        private final PeripheralId peripheral;
        private final Optional<Throwable> cause;

        public ConnectFailed(Instant timestamp, long sessionEpoch, PeripheralId peripheral, Throwable cause) {
            super(timestamp, sessionEpoch);
            this.peripheral = Objects.requireNonNull(peripheral, "peripheral");
            this.cause = Optional.ofNullable(cause);
        }

        @Override
        public PeripheralId peripheral() {
            return peripheral;
        }

        public Optional<Throwable> cause() {
            return cause;
        }

        @Override
        public String toString() {
            return "ConnectFailed[" + peripheral + ", " + cause.map(Throwable::toString).orElse("no cause") + "]";
        }
    }

    /** The link closed, gracefully when the cause is absent. */
    final class Disconnected extends RadioEvent.Base implements ConnectionEvent {
        private final PeripheralId peripheral;
        private final Optional<Throwable> cause;

        public Disconnected(Instant timestamp, long sessionEpoch, PeripheralId peripheral, Throwable cause) {
            super(timestamp, sessionEpoch);
            this.peripheral = Objects.requireNonNull(peripheral, "peripheral");
            this.cause = Optional.ofNullable(cause);
        }

        @Override
        public PeripheralId peripheral() {
            return peripheral;
        }

        public Optional<Throwable> cause() {
            return cause;
        }

        @Override
        public String toString() {
            return "Disconnected[" + peripheral + cause.map(c -> ", " + c).orElse("") + "]";
        }
    }
}
