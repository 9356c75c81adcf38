package com.questrail.peripheral.api;

import java.util.function.Consumer;

/**
 * StateView
 * -----------------------------------------------------------------------------
 * Read-only, push-updated view of one piece of stack state.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #current()} returns an immutable snapshot and may be called from
 *       any thread</li>
 *   <li>a new subscriber immediately receives the current value</li>
 *   <li>subscribers are then notified once per underlying mutation, in mutation
 *       order, on the thread performing the mutation</li>
 *   <li>views never fail; errors travel only through command error handlers</li>
 * </ul>
 */
public interface StateView<T>
{
    T current();

    Subscription subscribe(Consumer<? super T> subscriber);
}
