package com.questrail.peripheral.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * RadioEvent
 * -----------------------------------------------------------------------------
 * Base type for every event the radio session delivers to the stack.
 *
 * <h2>Role in the architecture</h2>
 * Radio callbacks arrive on arbitrary threads. The session listener converts
 * each one into an immutable {@code RadioEvent} and hands it to the event
 * dispatcher, which applies events to the stack one at a time. Events are the
 * only way the radio layer changes stack state.
 *
 * <h2>Session epoch</h2>
 * Each event carries the epoch of the session that produced it. Re-initializing
 * the stack opens a new session with a new epoch; events still in flight from
 * the old one are recognised by their stale epoch and dropped.
 */
public interface RadioEvent
{
    /**
     * Time at which the event was received from the radio layer.
     */
    Instant timestamp();

    /**
     * Epoch of the session that produced the event.
     */
    long sessionEpoch();

    /**
     * Convenience base class for events.
     */
    abstract class Base implements RadioEvent {
        private final Instant timestamp;
        private final long sessionEpoch;

        protected Base(Instant timestamp, long sessionEpoch) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
            this.sessionEpoch = sessionEpoch;
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public long sessionEpoch() {
            return sessionEpoch;
        }
    }
}
