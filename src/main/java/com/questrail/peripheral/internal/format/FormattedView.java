package com.questrail.peripheral.internal.format;

import com.questrail.peripheral.api.StateView;
import com.questrail.peripheral.api.Subscription;
import com.questrail.peripheral.internal.state.StateContainer;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * FormattedView
 * -----------------------------------------------------------------------------
 * A {@link StateView} derived from another view by a pure format function.
 *
 * <p>The format runs once per source publication, on the publishing thread, and
 * its result is re-published to this view's subscribers. Formats must be pure:
 * no side effects, no access to other mutable state.</p>
 */
public final class FormattedView<S, T> implements StateView<T>
{
    private final StateContainer<T> formatted;

    public FormattedView(String name, StateView<S> source, Function<? super S, ? extends T> format, Object monitor) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(format, "format");
        this.formatted = new StateContainer<>(name, format.apply(source.current()), monitor);
        // Subscription lives as long as the source; views are never detached.
        source.subscribe(value -> formatted.set(format.apply(value)));
    }

    @Override
    public T current() {
        return formatted.current();
    }

    @Override
    public Subscription subscribe(Consumer<? super T> subscriber) {
        return formatted.subscribe(subscriber);
    }
}
