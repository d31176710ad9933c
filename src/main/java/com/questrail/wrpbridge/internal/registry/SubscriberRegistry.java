package com.questrail.wrpbridge.internal.registry;

import com.questrail.wrpbridge.internal.time.Cancellable;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * SubscriberRegistry
 * =============================================================================
 * Ordered set of subscribers owned by a single listener, connection or bridge
 * instance.
 *
 * <p>Every {@link #add(Object)} returns a {@link Cancellable} that removes that
 * registration only; adding the same subscriber twice yields two independent
 * registrations. Visiting iterates a snapshot, so subscribers may add or
 * cancel registrations from inside a callback.</p>
 *
 * @param <T> subscriber type
 */
public final class SubscriberRegistry<T>
{
    private final CopyOnWriteArrayList<Registration<T>> registrations = new CopyOnWriteArrayList<>();

    public Cancellable add(T subscriber) {
        Registration<T> registration = new Registration<>(Objects.requireNonNull(subscriber, "subscriber"));
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /**
     * Call {@code visitor} once per registration, in registration order.
     */
    public void visit(Consumer<? super T> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        for (Registration<T> registration : registrations) {
            visitor.accept(registration.subscriber);
        }
    }

    public int size() {
        return registrations.size();
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }

    // Identity wrapper: two registrations of the same subscriber stay distinct.
    private static final class Registration<T>
    {
        private final T subscriber;

        private Registration(T subscriber) {
            this.subscriber = subscriber;
        }
    }
}
