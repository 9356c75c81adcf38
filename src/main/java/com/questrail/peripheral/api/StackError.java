package com.questrail.peripheral.api;

import java.util.Objects;
import java.util.Optional;

/**
 * StackError
 * -----------------------------------------------------------------------------
 * Closed set of failures the stack reports to callers.
 *
 * <p>Errors are values, delivered through the {@link ErrorHandler} supplied with
 * each command or inside an {@link Outcome}. They are never thrown out of the
 * stack's command methods and never appear on the state views.</p>
 *
 * <ul>
 *   <li>{@link SystemNotReady}: the radio is not powered on</li>
 *   <li>{@link InvalidInstruction}: the same operation is already pending</li>
 *   <li>{@link UnknownDevice}: the peripheral is not tracked or cannot be resolved</li>
 *   <li>{@link UnknownPath}: no resolved path matches a lookup</li>
 *   <li>{@link RadioError}: the radio layer reported a failure</li>
 * </ul>
 */
public sealed interface StackError
        permits StackError.SystemNotReady,
                StackError.InvalidInstruction,
                StackError.UnknownDevice,
                StackError.UnknownPath,
                StackError.RadioError
{
    /**
     * Short human-readable description for logs.
     */
    String describe();

    record SystemNotReady() implements StackError {
        @Override
        public String describe() {
            return "radio is not powered on";
        }
    }

    record InvalidInstruction(String instruction, Optional<PeripheralId> peripheral) implements StackError {
        public InvalidInstruction {
            Objects.requireNonNull(instruction, "instruction");
            Objects.requireNonNull(peripheral, "peripheral");
        }

        @Override
        public String describe() {
            return peripheral
                    .map(p -> instruction + " already pending for " + p)
                    .orElse(instruction + " already pending");
        }
    }

    record UnknownDevice(PeripheralId peripheral) implements StackError {
        public UnknownDevice {
            Objects.requireNonNull(peripheral, "peripheral");
        }

        @Override
        public String describe() {
            return "unknown device " + peripheral;
        }
    }

    record UnknownPath(PeripheralId peripheral, ServiceId service, CharacteristicId characteristic)
            implements StackError {
        public UnknownPath {
            Objects.requireNonNull(peripheral, "peripheral");
            Objects.requireNonNull(service, "service");
            Objects.requireNonNull(characteristic, "characteristic");
        }

        @Override
        public String describe() {
            return "no path " + service + "/" + characteristic + " on " + peripheral;
        }
    }

    /**
     * Failure reported by the radio layer. The cause is never null: a failure
     * reported without one carries an {@link UnknownRadioError}.
     */
    record RadioError(PeripheralId peripheral, Throwable cause) implements StackError {
        public RadioError {
            Objects.requireNonNull(peripheral, "peripheral");
            Objects.requireNonNull(cause, "cause");
        }

        public static RadioError wrap(PeripheralId peripheral, Optional<? extends Throwable> cause) {
            Throwable actual = cause.isPresent() ? cause.get() : new UnknownRadioError(peripheral);
            return new RadioError(peripheral, actual);
        }

        public boolean isUnknown() {
            return cause instanceof UnknownRadioError;
        }

        @Override
        public String describe() {
            return "radio failure on " + peripheral + ": " + cause.getMessage();
        }
    }

    static SystemNotReady systemNotReady() {
        return new SystemNotReady();
    }

    static InvalidInstruction invalidInstruction(String instruction) {
        return new InvalidInstruction(instruction, Optional.empty());
    }

    static InvalidInstruction invalidInstruction(String instruction, PeripheralId peripheral) {
        return new InvalidInstruction(instruction, Optional.of(peripheral));
    }

    static UnknownDevice unknownDevice(PeripheralId peripheral) {
        return new UnknownDevice(peripheral);
    }
}
