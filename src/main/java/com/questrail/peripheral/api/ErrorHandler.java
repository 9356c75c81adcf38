package com.questrail.peripheral.api;

/**
 * Receives the failure of a command.
 * <p>
 * A handler may be called synchronously from the command method (precondition
 * failures) or later from the event lane (failures reported by the radio). It
 * may be called more than once over the life of a connection when several
 * terminal events each carry an error.
 */
@FunctionalInterface
public interface ErrorHandler
{
    void onError(StackError error);

    static ErrorHandler ignoring() {
        return error -> {};
    }
}
