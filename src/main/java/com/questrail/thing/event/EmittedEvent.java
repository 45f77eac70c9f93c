package com.questrail.thing.event;

import java.time.Instant;
import java.util.Objects;

/**
 * EmittedEvent
 * -----------------------------------------------------------------------------
 * A single notification published on a Thing's event bus.
 *
 * <h2>Variants</h2>
 * The set of notifications is closed:
 * <ul>
 *   <li>{@link PropertyChanged} - a property write completed</li>
 *   <li>{@link ActionInvoked} - an action invocation completed</li>
 *   <li>{@link DescriptionChanged} - an interaction was added or removed</li>
 *   <li>{@link Emitted} - the application emitted one of the Thing's own events</li>
 * </ul>
 * Subscription filters match on {@link #name()} and, for property changes, on
 * the payload's property name. No other runtime type inspection is needed.
 *
 * <h2>Lifecycle</h2>
 * Events are immutable and have no identity after publication: the bus does not
 * store them, it only hands them to the subscriptions attached at publish time.
 */
public sealed interface EmittedEvent
        permits EmittedEvent.PropertyChanged,
                EmittedEvent.ActionInvoked,
                EmittedEvent.DescriptionChanged,
                EmittedEvent.Emitted
{
    /**
     * Bus name of the event: one of the {@link DefaultThingEvent} names, or the
     * interaction name for application events.
     */
    String name();

    /**
     * Event payload. Built-in variants narrow the return type.
     */
    Object payload();

    /**
     * Time at which the triggering operation completed.
     */
    Instant timestamp();

    /**
     * Convenience base class holding the common fields.
     */
    abstract class Base {
        private final String name;
        private final Instant timestamp;

        protected Base(String name, Instant timestamp) {
            this.name = Objects.requireNonNull(name, "name");
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        public String name() {
            return name;
        }

        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "{name=" + name + ", payload=" + payloadForDisplay() + "}";
        }

        abstract Object payloadForDisplay();
    }

    final class PropertyChanged extends Base implements EmittedEvent {
        private final PropertyChange payload;

        public PropertyChanged(PropertyChange payload, Instant timestamp) {
            super(DefaultThingEvent.PROPERTY_CHANGE.eventName(), timestamp);
            this.payload = Objects.requireNonNull(payload, "payload");
        }

        @Override
        public PropertyChange payload() {
            return payload;
        }

        @Override
        Object payloadForDisplay() {
            return payload;
        }
    }

    final class ActionInvoked extends Base implements EmittedEvent {
        private final ActionInvocation payload;

        public ActionInvoked(ActionInvocation payload, Instant timestamp) {
            super(DefaultThingEvent.ACTION_INVOCATION.eventName(), timestamp);
            this.payload = Objects.requireNonNull(payload, "payload");
        }

        @Override
        public ActionInvocation payload() {
            return payload;
        }

        @Override
        Object payloadForDisplay() {
            return payload;
        }
    }

    final class DescriptionChanged extends Base implements EmittedEvent {
        private final DescriptionChange payload;

        public DescriptionChanged(DescriptionChange payload, Instant timestamp) {
            super(DefaultThingEvent.DESCRIPTION_CHANGE.eventName(), timestamp);
            this.payload = Objects.requireNonNull(payload, "payload");
        }

        @Override
        public DescriptionChange payload() {
            return payload;
        }

        @Override
        Object payloadForDisplay() {
            return payload.method().wireName() + " " + payload.changeType().wireName() + " " + payload.name();
        }
    }

    /**
     * An application-defined event, published under its interaction name.
     */
    final class Emitted extends Base implements EmittedEvent {
        private final Object payload;

        public Emitted(String eventName, Object payload, Instant timestamp) {
            super(eventName, timestamp);
            this.payload = payload;
        }

        @Override
        public Object payload() {
            return payload;
        }

        @Override
        Object payloadForDisplay() {
            return payload;
        }
    }
}
