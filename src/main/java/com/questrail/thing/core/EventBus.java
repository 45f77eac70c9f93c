package com.questrail.thing.core;

import com.questrail.thing.api.Subscription;
import com.questrail.thing.event.EmittedEvent;
import com.questrail.thing.observability.EventPublishedEvent;
import com.questrail.thing.observability.NullObservabilitySink;
import com.questrail.thing.observability.ThingErrorEvent;
import com.questrail.thing.observability.ThingObservabilitySink;
import com.questrail.thing.time.SystemWallClock;
import com.questrail.thing.time.WallClock;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * EventBus
 * =============================================================================
 * Single ordered, multiplexed publish point for the notifications of one Thing.
 *
 * <h2>Delivery model</h2>
 * <ul>
 *   <li>Every event, whatever its kind, goes through the same channel.</li>
 *   <li>A subscription is a (filter, consumer) pair. Delivering an event
 *       evaluates every attached filter and hands the event to each consumer
 *       whose filter holds.</li>
 *   <li>There is no back-pressure; a slow consumer must buffer or drop on its
 *       own side.</li>
 *   <li>Subscriptions are independent. Overlapping filters each receive their
 *       own copy, and nothing is ever "consumed".</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * {@link #publish(EmittedEvent)} appends the event to a pending queue. At most
 * one thread drains the queue at a time, and each event is offered to every
 * subscription before the next one is taken, so all subscriptions observe the
 * same total order: the order in which events were published.
 * <ul>
 *   <li>When no delivery is running, the publishing thread drains the queue
 *       itself and {@code publish} returns once the queue is empty.</li>
 *   <li>When another thread is delivering, the event is queued and
 *       {@code publish} returns immediately. The delivering thread picks it up.</li>
 *   <li>A consumer that publishes from inside its callback queues the new event
 *       behind the one being delivered.</li>
 * </ul>
 * No lock is held while filters or consumers run.
 *
 * <h2>Concurrent mutation</h2>
 * The subscription list is copy-on-write. Attaching or detaching during a
 * delivery never disturbs delivery to other subscriptions. A subscription only
 * sees events whose delivery starts after it was attached. Once
 * {@link Subscription#unsubscribe()} returns, no further delivery to that
 * subscription starts; a callback already running on another thread finishes.
 *
 * <h2>Consumer failures</h2>
 * A consumer or filter that throws is reported to the observability sink. When
 * failures are isolated (the default) delivery simply continues. Otherwise the
 * first failure is rethrown by the thread that drained the queue, after the
 * queue is empty. That thread is not necessarily the one that published the
 * failing event.
 */
public final class EventBus
{
    private final Object queueLock = new Object();
    private final Deque<EmittedEvent> pending = new ArrayDeque<>();
    private boolean delivering;

    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    private final ThingObservabilitySink observabilitySink;
    private final WallClock clock;
    private final boolean isolateSubscriberFailures;

    public EventBus(ThingObservabilitySink observabilitySink, WallClock clock, boolean isolateSubscriberFailures) {
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.isolateSubscriberFailures = isolateSubscriberFailures;
    }

    /**
     * Bus with no observability, the system clock and isolated consumer failures.
     */
    public EventBus() {
        this(NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE, true);
    }

    /**
     * Attaches a consumer that receives every subsequently delivered event for
     * which {@code filter} holds.
     */
    public Subscription subscribe(Predicate<? super EmittedEvent> filter, Consumer<? super EmittedEvent> consumer) {
        Entry entry = new Entry(
                Objects.requireNonNull(filter, "filter"),
                Objects.requireNonNull(consumer, "consumer"));
        entries.add(entry);
        return entry;
    }

    /**
     * Returns a lazily attached view of this bus narrowed by {@code filter}.
     */
    public FilteredSubscribable stream(Predicate<? super EmittedEvent> filter) {
        return new FilteredSubscribable(this, filter);
    }

    /**
     * Queues {@code event} for delivery and, unless another thread is already
     * delivering, drains the queue on the calling thread.
     *
     * @throws RuntimeException the first consumer failure seen while draining,
     *         only when consumer failures are not isolated
     */
    public void publish(EmittedEvent event) {
        Objects.requireNonNull(event, "event");

        synchronized (queueLock) {
            pending.addLast(event);
            if (delivering) {
                return;
            }
            delivering = true;
        }

        RuntimeException firstFailure = null;
        boolean drained = false;
        try {
            while (true) {
                EmittedEvent next;
                synchronized (queueLock) {
                    next = pending.pollFirst();
                    if (next == null) {
                        delivering = false;
                        drained = true;
                        break;
                    }
                }
                RuntimeException failure = deliver(next);
                if (firstFailure == null) {
                    firstFailure = failure;
                }
            }
        } finally {
            if (!drained) {
                synchronized (queueLock) {
                    delivering = false;
                }
            }
        }

        if (firstFailure != null && !isolateSubscriberFailures) {
            throw firstFailure;
        }
    }

    private RuntimeException deliver(EmittedEvent event) {
        int offered = 0;
        int delivered = 0;
        RuntimeException firstFailure = null;

        for (Entry entry : entries) {
            if (!entry.active) {
                continue;
            }
            offered++;
            try {
                if (entry.filter.test(event)) {
                    entry.consumer.accept(event);
                    delivered++;
                }
            } catch (RuntimeException e) {
                observabilitySink.onError(new ThingErrorEvent(
                        clock.now(),
                        "subscriber of '" + event.name() + "'",
                        "Subscriber failed while handling event",
                        e));
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        observabilitySink.onEventPublished(new EventPublishedEvent(event, offered, delivered));
        return firstFailure;
    }

    /**
     * Number of currently attached subscriptions.
     */
    public int subscriptionCount() {
        return entries.size();
    }

    /**
     * Detaches every subscription. The bus stays usable; later events reach
     * only subscriptions attached afterwards.
     */
    public void detachAll() {
        for (Entry entry : entries) {
            entry.active = false;
        }
        entries.clear();
    }

    private final class Entry implements Subscription
    {
        private final Predicate<? super EmittedEvent> filter;
        private final Consumer<? super EmittedEvent> consumer;
        private volatile boolean active = true;

        private Entry(Predicate<? super EmittedEvent> filter, Consumer<? super EmittedEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }

        @Override
        public void unsubscribe() {
            active = false;
            entries.remove(this);
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
