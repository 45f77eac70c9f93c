package com.questrail.thing.core;

import com.questrail.thing.api.ActionHandler;
import com.questrail.thing.api.ExposedThing;
import com.questrail.thing.api.HandlerKind;
import com.questrail.thing.api.PropertyReadHandler;
import com.questrail.thing.api.PropertyWriteHandler;
import com.questrail.thing.api.ServientHost;
import com.questrail.thing.api.Subscribable;
import com.questrail.thing.api.error.InteractionNotFoundException;
import com.questrail.thing.api.error.NotObservableException;
import com.questrail.thing.api.error.NotWritableException;
import com.questrail.thing.api.error.UndefinedActionHandlerException;
import com.questrail.thing.api.error.UnknownEventException;
import com.questrail.thing.api.error.UnknownPropertyException;
import com.questrail.thing.config.ThingRuntimeConfig;
import com.questrail.thing.description.ThingDescriptionCodec;
import com.questrail.thing.event.ActionInvocation;
import com.questrail.thing.event.DescriptionChange;
import com.questrail.thing.event.EmittedEvent;
import com.questrail.thing.event.PropertyChange;
import com.questrail.thing.model.ActionDefinition;
import com.questrail.thing.model.ActionInit;
import com.questrail.thing.model.EventDefinition;
import com.questrail.thing.model.EventInit;
import com.questrail.thing.model.Interaction;
import com.questrail.thing.model.InteractionType;
import com.questrail.thing.model.PropertyDefinition;
import com.questrail.thing.model.PropertyInit;
import com.questrail.thing.model.Thing;
import com.questrail.thing.observability.NullObservabilitySink;
import com.questrail.thing.observability.Slf4jThingObservabilitySink;
import com.questrail.thing.observability.ThingErrorEvent;
import com.questrail.thing.observability.ThingObservabilitySink;
import com.questrail.thing.time.SystemWallClock;
import com.questrail.thing.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * DefaultExposedThing
 * =============================================================================
 * Standard {@link ExposedThing} implementation. Coordinates a {@link Thing}
 * (interaction definitions), a {@link HandlerRegistry}, an
 * {@link InteractionStateStore} and an {@link EventBus}, all owned by this
 * instance.
 *
 * <h2>Call flow</h2>
 * <pre>
 *   readProperty / writeProperty / invokeAction
 *     → look up the interaction (throws if unknown, or not writable)
 *     → resolve handler (dedicated, else global)
 *     → invoke handler (asynchronous)
 *     → on success: publish notification, then complete the caller's future
 *     → on failure: report to the observability sink, fail the caller's future
 *                   with the handler's error as-is
 * </pre>
 *
 * <h2>Default handlers</h2>
 * <ul>
 *   <li>read: resolves with the stored value, {@code null} if never set</li>
 *   <li>write: stores the value (last write wins)</li>
 *   <li>invoke: fails with {@link UndefinedActionHandlerException}</li>
 * </ul>
 *
 * <h2>Threading model</h2>
 * No lock is held around handler invocation, so calls on different interactions
 * never block each other. Notifications are published from whichever thread
 * completes the handler's future; see {@link EventBus} for which thread ends
 * up running the subscribers.
 *
 * <h2>Subscriber failures</h2>
 * A write or invocation whose handler succeeded always completes normally,
 * even when a subscriber of the resulting notification throws: the value has
 * been applied and other subscribers may already have seen it. The failure is
 * reported to the observability sink. {@link #emitEvent} has no result and
 * lets the bus rethrow when failures are not isolated.
 *
 * <h2>Equality</h2>
 * Two instances are equal iff they share the same {@link ServientHost} and wrap
 * a Thing with the same id.
 */
public final class DefaultExposedThing implements ExposedThing
{
    private static final Logger log = LoggerFactory.getLogger(DefaultExposedThing.class);

    private final ServientHost host;
    private final Thing thing;
    private final ThingObservabilitySink observabilitySink;
    private final WallClock clock;
    private final ThingDescriptionCodec codec;
    private final EventBus bus;
    private final InteractionStateStore state = new InteractionStateStore();
    private final HandlerRegistry handlers;

    private DefaultExposedThing(ServientHost host,
                                Thing thing,
                                ThingRuntimeConfig config,
                                ThingObservabilitySink observabilitySink,
                                WallClock clock,
                                EventBus bus)
    {
        this.host = host;
        this.thing = thing;
        this.observabilitySink = observabilitySink;
        this.clock = clock;
        this.codec = new ThingDescriptionCodec(config);
        this.bus = bus;
        this.handlers = new HandlerRegistry(
                this::defaultReadProperty,
                this::defaultWriteProperty,
                DefaultExposedThing::defaultInvokeAction);
    }

    /**
     * Creates an empty Thing with a generated identity, logging through SLF4J.
     */
    public static DefaultExposedThing fromName(ServientHost host, String name) {
        return builder()
                .withHost(host)
                .withThing(Thing.fromName(name))
                .withObservabilitySink(new Slf4jThingObservabilitySink(name))
                .build();
    }

    // ------------------------
    // Default handlers
    // ------------------------

    private CompletableFuture<Object> defaultReadProperty(String propertyName) {
        return CompletableFuture.completedFuture(state.get(propertyName).orElse(null));
    }

    private CompletableFuture<Void> defaultWriteProperty(String propertyName, Object value) {
        state.set(propertyName, value);
        return CompletableFuture.completedFuture(null);
    }

    private static CompletableFuture<Object> defaultInvokeAction(String actionName, List<Object> arguments) {
        return CompletableFuture.failedFuture(new UndefinedActionHandlerException(actionName));
    }

    // ------------------------
    // Identity and description
    // ------------------------

    @Override
    public String id() {
        return thing.id();
    }

    @Override
    public String name() {
        return thing.name();
    }

    /**
     * URL-safe name of the underlying Thing.
     */
    public String urlName() {
        return thing.urlName();
    }

    /**
     * The host this Thing is exposed through.
     */
    public ServientHost host() {
        return host;
    }

    @Override
    public String getThingDescription() {
        return codec.encode(thing);
    }

    @Override
    public Map<String, PropertyDefinition> properties() {
        return Collections.unmodifiableMap(thing.interactionsOfType(PropertyDefinition.class));
    }

    @Override
    public Map<String, ActionDefinition> actions() {
        return Collections.unmodifiableMap(thing.interactionsOfType(ActionDefinition.class));
    }

    @Override
    public Map<String, EventDefinition> events() {
        return Collections.unmodifiableMap(thing.interactionsOfType(EventDefinition.class));
    }

    // ------------------------
    // Read / write / invoke
    // ------------------------

    @Override
    public CompletableFuture<Object> readProperty(String name) {
        Objects.requireNonNull(name, "name");
        requireDefinition(name, PropertyDefinition.class);

        PropertyReadHandler handler = handlers.getHandler(HandlerKind.RETRIEVE_PROPERTY, name);
        CompletableFuture<Object> pending = startHandler(() -> handler.read(name));

        CompletableFuture<Object> result = new CompletableFuture<>();
        pending.whenComplete((value, error) -> {
            if (error != null) {
                reportHandlerFailure(name, "Property read handler failed", error);
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    @Override
    public CompletableFuture<Void> writeProperty(String name, Object value) {
        Objects.requireNonNull(name, "name");
        PropertyDefinition property = requireDefinition(name, PropertyDefinition.class);
        if (!property.writable()) {
            throw new NotWritableException(name);
        }

        PropertyWriteHandler handler = handlers.getHandler(HandlerKind.UPDATE_PROPERTY, name);
        CompletableFuture<Void> pending = startHandler(() -> handler.write(name, value));

        CompletableFuture<Void> result = new CompletableFuture<>();
        pending.whenComplete((ignored, error) -> {
            if (error != null) {
                reportHandlerFailure(name, "Property write handler failed", error);
                result.completeExceptionally(error);
                return;
            }
            publishAfterSuccess(name, new EmittedEvent.PropertyChanged(new PropertyChange(name, value), clock.now()));
            result.complete(null);
        });
        return result;
    }

    @Override
    public CompletableFuture<Object> invokeAction(String name, Object... args) {
        Objects.requireNonNull(name, "name");
        requireDefinition(name, ActionDefinition.class);

        List<Object> arguments = args == null
                ? List.of()
                : Collections.unmodifiableList(Arrays.asList(args.clone()));

        ActionHandler handler = handlers.getHandler(HandlerKind.INVOKE_ACTION, name);
        CompletableFuture<Object> pending = startHandler(() -> handler.invoke(name, arguments));

        CompletableFuture<Object> result = new CompletableFuture<>();
        pending.whenComplete((returnValue, error) -> {
            if (error != null) {
                reportHandlerFailure(name, "Action handler failed", error);
                result.completeExceptionally(error);
                return;
            }
            publishAfterSuccess(name, new EmittedEvent.ActionInvoked(new ActionInvocation(name, returnValue), clock.now()));
            result.complete(returnValue);
        });
        return result;
    }

    // ------------------------
    // Subscriptions and events
    // ------------------------

    @Override
    public Subscribable onEvent(String name) {
        Objects.requireNonNull(name, "name");
        if (thing.find(name).isEmpty()) {
            throw new UnknownEventException(name);
        }
        return bus.stream(event -> event.name().equals(name));
    }

    @Override
    public Subscribable onPropertyChange(String name) {
        Objects.requireNonNull(name, "name");
        PropertyDefinition property = thing.find(name, PropertyDefinition.class)
                .orElseThrow(() -> new UnknownPropertyException(name));
        if (!property.observable()) {
            throw new NotObservableException(name);
        }
        return bus.stream(event -> event instanceof EmittedEvent.PropertyChanged changed
                && changed.payload().name().equals(name));
    }

    @Override
    public Subscribable onDescriptionChange() {
        return bus.stream(event -> event instanceof EmittedEvent.DescriptionChanged);
    }

    @Override
    public void emitEvent(String name, Object payload) {
        Objects.requireNonNull(name, "name");
        if (thing.find(name).isEmpty()) {
            throw new UnknownEventException(name);
        }
        bus.publish(new EmittedEvent.Emitted(name, payload, clock.now()));
    }

    // ------------------------
    // Description mutations
    // ------------------------

    @Override
    public void addProperty(String name, PropertyInit init) {
        Objects.requireNonNull(init, "init");
        PropertyDefinition property = PropertyDefinition.from(name, init);

        thing.add(property);
        state.set(name, init.value());

        publishDescriptionChange(DescriptionChange.added(
                InteractionType.PROPERTY,
                name,
                codec.propertyData(property, init.value()),
                codec.describe(thing)));
    }

    @Override
    public void removeProperty(String name) {
        removeInteraction(name, PropertyDefinition.class, InteractionType.PROPERTY);
    }

    @Override
    public void addAction(String name, ActionInit init) {
        Objects.requireNonNull(init, "init");
        addInteraction(ActionDefinition.from(name, init));
    }

    @Override
    public void removeAction(String name) {
        removeInteraction(name, ActionDefinition.class, InteractionType.ACTION);
    }

    @Override
    public void addEvent(String name, EventInit init) {
        Objects.requireNonNull(init, "init");
        addInteraction(EventDefinition.from(name, init));
    }

    @Override
    public void removeEvent(String name) {
        removeInteraction(name, EventDefinition.class, InteractionType.EVENT);
    }

    private void addInteraction(Interaction interaction) {
        thing.add(interaction);
        publishDescriptionChange(DescriptionChange.added(
                interaction.type(),
                interaction.name(),
                codec.interactionData(interaction),
                codec.describe(thing)));
    }

    private void removeInteraction(String name, Class<? extends Interaction> type, InteractionType changeType) {
        Objects.requireNonNull(name, "name");
        requireDefinition(name, type);

        if (thing.remove(name).isEmpty()) {
            throw new InteractionNotFoundException(name);
        }
        state.remove(name);
        handlers.clearInteraction(name);

        publishDescriptionChange(DescriptionChange.removed(changeType, name));
    }

    private void publishDescriptionChange(DescriptionChange change) {
        observabilitySink.onDescriptionChanged(change);
        bus.publish(new EmittedEvent.DescriptionChanged(change, clock.now()));
    }

    // ------------------------
    // Handler configuration
    // ------------------------

    @Override
    public void setActionHandler(ActionHandler handler, String actionName) {
        Objects.requireNonNull(handler, "handler");
        if (actionName != null) {
            requireDefinition(actionName, ActionDefinition.class);
        }
        handlers.setHandler(HandlerKind.INVOKE_ACTION, handler, actionName);
    }

    @Override
    public void setPropertyReadHandler(PropertyReadHandler handler, String propertyName) {
        Objects.requireNonNull(handler, "handler");
        if (propertyName != null) {
            requireDefinition(propertyName, PropertyDefinition.class);
        }
        handlers.setHandler(HandlerKind.RETRIEVE_PROPERTY, handler, propertyName);
    }

    @Override
    public void setPropertyWriteHandler(PropertyWriteHandler handler, String propertyName) {
        Objects.requireNonNull(handler, "handler");
        if (propertyName != null) {
            requireDefinition(propertyName, PropertyDefinition.class);
        }
        handlers.setHandler(HandlerKind.UPDATE_PROPERTY, handler, propertyName);
    }

    // ------------------------
    // Lifecycle
    // ------------------------

    @Override
    public void expose() {
        log.debug("Exposing thing {} ({})", thing.name(), thing.id());
        host.enableExposedThing(thing.id());
    }

    @Override
    public void destroy() {
        log.debug("Destroying thing {} ({}), detaching {} subscriptions",
                thing.name(), thing.id(), bus.subscriptionCount());
        host.removeExposedThing(thing.id());
        bus.detachAll();
    }

    // ------------------------
    // Helpers
    // ------------------------

    private <T extends Interaction> T requireDefinition(String name, Class<T> type) {
        return thing.find(name, type).orElseThrow(() -> new InteractionNotFoundException(name));
    }

    /**
     * Invokes a handler, turning a synchronous throw or a {@code null} future
     * into a failed future so that every failure takes the same path.
     */
    private static <T> CompletableFuture<T> startHandler(Supplier<CompletableFuture<T>> invocation) {
        try {
            return Objects.requireNonNull(invocation.get(), "handler returned a null future");
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Publishes the notification of an operation that has already taken
     * effect. A subscriber failure rethrown by the bus has been reported to the
     * observability sink and does not fail the operation.
     */
    private void publishAfterSuccess(String interactionName, EmittedEvent event) {
        try {
            bus.publish(event);
        } catch (RuntimeException e) {
            log.debug("Subscriber failure after '{}' on thing {} left the call successful",
                    interactionName, thing.id(), e);
        }
    }

    private void reportHandlerFailure(String interactionName, String message, Throwable error) {
        observabilitySink.onError(new ThingErrorEvent(clock.now(), interactionName, message, error));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DefaultExposedThing other)) {
            return false;
        }
        return host.equals(other.host) && thing.id().equals(other.thing.id());
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, thing.id());
    }

    @Override
    public String toString() {
        return "DefaultExposedThing{id=" + thing.id() + ", name=" + thing.name() + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServientHost host;
        private Thing thing;
        private ThingRuntimeConfig config = ThingRuntimeConfig.defaults();
        private ThingObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private EventBus eventBus;

        public Builder withHost(ServientHost host) {
            this.host = host;
            return this;
        }

        public Builder withThing(Thing thing) {
            this.thing = thing;
            return this;
        }

        public Builder withConfig(ThingRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(ThingObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Uses a pre-built bus instead of creating one from the configuration.
         */
        public Builder withEventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public DefaultExposedThing build() {
            Objects.requireNonNull(host, "host");
            Objects.requireNonNull(thing, "thing");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            ThingObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            EventBus bus = eventBus != null
                    ? eventBus
                    : new EventBus(sink, clock, config.isolateSubscriberFailures());

            return new DefaultExposedThing(host, thing, config, sink, clock, bus);
        }
    }
}
