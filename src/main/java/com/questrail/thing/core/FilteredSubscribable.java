package com.questrail.thing.core;

import com.questrail.thing.api.Subscribable;
import com.questrail.thing.api.Subscription;
import com.questrail.thing.event.EmittedEvent;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * {@link Subscribable} backed by an {@link EventBus} and a filter.
 * Nothing is attached until {@link #subscribe(Consumer)} is called.
 */
public final class FilteredSubscribable implements Subscribable
{
    private final EventBus bus;
    private final Predicate<? super EmittedEvent> filter;

    FilteredSubscribable(EventBus bus, Predicate<? super EmittedEvent> filter) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    @Override
    public Subscription subscribe(Consumer<? super EmittedEvent> onNext) {
        return bus.subscribe(filter, onNext);
    }

    @Override
    public Subscribable filter(Predicate<? super EmittedEvent> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        Predicate<EmittedEvent> combined = event -> filter.test(event) && predicate.test(event);
        return new FilteredSubscribable(bus, combined);
    }
}
