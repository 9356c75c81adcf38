package com.questrail.peripheral.internal.state;

import com.questrail.peripheral.api.StateView;
import com.questrail.peripheral.api.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * StateContainer
 * -----------------------------------------------------------------------------
 * Holds the latest immutable value of one piece of stack state and pushes every
 * new value to its subscribers.
 *
 * <h2>Threading model</h2>
 * All writes and all subscriptions synchronize on a shared monitor supplied by
 * the owner, so a subscriber registered while a mutation is in progress sees
 * either the old value followed by the new one, or only the new one; never the
 * new one twice or out of order. Subscribers run synchronously on the writing
 * thread while the monitor is held.
 * <p>
 * {@link #current()} is lock-free: the value is published through a volatile
 * field and is always a complete immutable snapshot.
 *
 * <h2>Failing subscribers</h2>
 * A subscriber that throws is logged and skipped; the mutation and the other
 * subscribers are unaffected.
 */
public final class StateContainer<T> implements StateView<T>
{
    private static final Logger log = LoggerFactory.getLogger(StateContainer.class);

    private final String name;
    private final Object monitor;
    private final List<Delivery<T>> subscribers = new CopyOnWriteArrayList<>();

    private volatile T value;

    public StateContainer(String name, T initialValue, Object monitor) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(initialValue, "initialValue");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
    }

    @Override
    public T current() {
        return value;
    }

    /**
     * Replaces the value and notifies every subscriber, even when the new value
     * equals the old one.
     */
    public void set(T newValue) {
        Objects.requireNonNull(newValue, "newValue");
        synchronized (monitor) {
            value = newValue;
            for (Delivery<T> subscriber : subscribers) {
                subscriber.deliver(newValue);
            }
        }
    }

    /**
     * Applies {@code mutation} to the current value and publishes the result.
     *
     * @return the published value
     */
    public T update(UnaryOperator<T> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        synchronized (monitor) {
            T next = mutation.apply(value);
            set(next);
            return next;
        }
    }

    @Override
    public Subscription subscribe(Consumer<? super T> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        Delivery<T> delivery = new Delivery<>(name, subscriber);
        synchronized (monitor) {
            subscribers.add(delivery);
            delivery.deliver(value);
        }
        return () -> subscribers.remove(delivery);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }

    private static final class Delivery<T> {
        private final String name;
        private final Consumer<? super T> subscriber;

        private Delivery(String name, Consumer<? super T> subscriber) {
            this.name = name;
            this.subscriber = subscriber;
        }

        void deliver(T value) {
            try {
                subscriber.accept(value);
            } catch (RuntimeException e) {
                log.warn("Subscriber of {} failed; continuing with remaining subscribers", name, e);
            }
        }
    }
}
