package com.questrail.peripheral.api;

/**
 * Handle returned by {@link StateView#subscribe}; cancelling stops delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
