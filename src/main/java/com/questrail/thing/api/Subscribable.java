package com.questrail.thing.api;

import com.questrail.thing.event.EmittedEvent;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A filtered view of a Thing's event stream that consumers may attach to.
 * <p>
 * Creating a {@code Subscribable} does not attach anything; each call to
 * {@link #subscribe(Consumer)} creates an independent subscription that receives
 * its own copy of every matching event, in publish order.
 */
public interface Subscribable
{
    /**
     * Attaches a consumer to this stream.
     *
     * @param onNext callback invoked on the publishing thread for each matching event
     * @return handle used to detach the consumer
     */
    Subscription subscribe(Consumer<? super EmittedEvent> onNext);

    /**
     * Returns a stream further narrowed by {@code predicate}.
     */
    Subscribable filter(Predicate<? super EmittedEvent> predicate);
}
