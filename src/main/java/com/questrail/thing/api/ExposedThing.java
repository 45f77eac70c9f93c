package com.questrail.thing.api;

import com.questrail.thing.model.ActionDefinition;
import com.questrail.thing.model.ActionInit;
import com.questrail.thing.model.EventDefinition;
import com.questrail.thing.model.EventInit;
import com.questrail.thing.model.PropertyDefinition;
import com.questrail.thing.model.PropertyInit;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * ExposedThing
 * -----------------------------------------------------------------------------
 * {@code ExposedThing} is the server-side façade of a Thing hosted by a
 * servient: the point where a declarative set of properties, actions and
 * events is bound to application behavior.
 *
 * <h2>Core Responsibilities</h2>
 * An {@code ExposedThing} is responsible for:
 * <ul>
 *   <li>Resolving the handler for each read, write and invoke, with a handler
 *       dedicated to one interaction taking precedence over the global one</li>
 *   <li>Keeping the current value of every property served by the default
 *       handlers</li>
 *   <li>Publishing a single ordered stream of notifications (property changes,
 *       action results, description changes, application events)</li>
 *   <li>Applying description mutations and announcing them on that stream</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Parsing or producing Thing Description documents beyond its own rendering</li>
 *   <li>Carrying calls over HTTP, CoAP, MQTT or WebSocket</li>
 *   <li>Tracking which Things a servient exposes (see {@link ServientHost})</li>
 *   <li>Authorization of callers</li>
 * </ul>
 *
 * <h2>Asynchronous calls</h2>
 * {@link #readProperty}, {@link #writeProperty} and {@link #invokeAction} return
 * futures. Each is a single attempt: there is no retry, no timeout and no
 * cancellation once a handler has started. Checks owned by the Thing itself
 * (existence, writability) throw synchronously before a handler is resolved.
 * Handler failures reach the caller through the future exactly as raised.
 * <p>
 * A failed write or invocation publishes nothing.
 *
 * <h2>Ordering</h2>
 * Notifications are published in the order their triggering operations
 * completed. Calls on the same property are not ordered against each other;
 * a handler that needs ordering must provide it.
 *
 * <h2>Writes vs observation</h2>
 * A write succeeds for any writable property and always publishes a change
 * notification. Only <em>subscribing</em> to changes of a specific property is
 * gated on its {@code observable} flag.
 *
 * <h2>Threading and Concurrency</h2>
 * The façade takes no locks around handler invocation or subscriber callbacks.
 * Subscribers usually run on the thread that completes the triggering
 * operation; while another thread is delivering, that thread runs them instead
 * and the publishing call returns without waiting. A blocking subscriber delays
 * later notifications but never blocks callers on other threads.
 */
public interface ExposedThing
{
    /**
     * Stable identity of the underlying Thing.
     */
    String id();

    /**
     * Human-readable name of the underlying Thing.
     */
    String name();

    /**
     * Returns the serialized description of the Thing as it currently stands.
     */
    String getThingDescription();

    /**
     * Reads a property through its read handler.
     *
     * @param name property name
     * @return future resolving with the value; with the default handler, a
     *         property that was never set resolves with {@code null}
     * @throws com.questrail.thing.api.error.InteractionNotFoundException if no
     *         property with that name exists
     */
    CompletableFuture<Object> readProperty(String name);

    /**
     * Writes a property through its write handler and, once the handler
     * completes successfully, publishes a property-change notification.
     *
     * @param name  property name
     * @param value new value ({@code null} allowed)
     * @return future completing when the write has been applied
     * @throws com.questrail.thing.api.error.InteractionNotFoundException if no
     *         property with that name exists
     * @throws com.questrail.thing.api.error.NotWritableException if the
     *         property is not writable
     */
    CompletableFuture<Void> writeProperty(String name, Object value);

    /**
     * Invokes an action through its handler. On success an action-invocation
     * notification is published before the returned future resolves.
     * <p>
     * With no handler configured the call fails with
     * {@link com.questrail.thing.api.error.UndefinedActionHandlerException}.
     *
     * @param name action name
     * @param args invocation arguments
     * @return future resolving with the handler's result
     * @throws com.questrail.thing.api.error.InteractionNotFoundException if no
     *         action with that name exists
     */
    CompletableFuture<Object> invokeAction(String name, Object... args);

    /**
     * Stream of notifications published under {@code name}.
     *
     * @throws com.questrail.thing.api.error.UnknownEventException if no
     *         interaction with that name exists
     */
    Subscribable onEvent(String name);

    /**
     * Stream of change notifications of one property.
     *
     * @throws com.questrail.thing.api.error.UnknownPropertyException if no
     *         property with that name exists
     * @throws com.questrail.thing.api.error.NotObservableException if the
     *         property is not observable
     */
    Subscribable onPropertyChange(String name);

    /**
     * Stream of description-change notifications. Always available.
     */
    Subscribable onDescriptionChange();

    /**
     * Publishes an application event under the name of one of the Thing's
     * interactions.
     *
     * @throws com.questrail.thing.api.error.UnknownEventException if no
     *         interaction with that name exists
     */
    void emitEvent(String name, Object payload);

    /**
     * Adds a property, seeds its value and announces the change.
     *
     * @throws IllegalArgumentException if an interaction with that name exists
     */
    void addProperty(String name, PropertyInit init);

    /**
     * Removes a property, its stored value and any handlers dedicated to it,
     * and announces the change.
     *
     * @throws com.questrail.thing.api.error.InteractionNotFoundException if no
     *         property with that name exists
     */
    void removeProperty(String name);

    void addAction(String name, ActionInit init);

    void removeAction(String name);

    void addEvent(String name, EventInit init);

    void removeEvent(String name);

    /**
     * Sets the handler for one action, or the global action handler when
     * {@code actionName} is {@code null}.
     *
     * @throws com.questrail.thing.api.error.InteractionNotFoundException if
     *         {@code actionName} does not name an action
     */
    void setActionHandler(ActionHandler handler, String actionName);

    default void setActionHandler(ActionHandler handler) {
        setActionHandler(handler, null);
    }

    /**
     * Sets the read handler for one property, or the global read handler when
     * {@code propertyName} is {@code null}.
     */
    void setPropertyReadHandler(PropertyReadHandler handler, String propertyName);

    default void setPropertyReadHandler(PropertyReadHandler handler) {
        setPropertyReadHandler(handler, null);
    }

    /**
     * Sets the write handler for one property, or the global write handler when
     * {@code propertyName} is {@code null}.
     */
    void setPropertyWriteHandler(PropertyWriteHandler handler, String propertyName);

    default void setPropertyWriteHandler(PropertyWriteHandler handler) {
        setPropertyWriteHandler(handler, null);
    }

    /**
     * Current property definitions, keyed by name.
     */
    Map<String, PropertyDefinition> properties();

    /**
     * Current action definitions, keyed by name.
     */
    Map<String, ActionDefinition> actions();

    /**
     * Current event definitions, keyed by name.
     */
    Map<String, EventDefinition> events();

    /**
     * Asks the host to start serving external requests for this Thing.
     */
    void expose();

    /**
     * Asks the host to stop serving this Thing and detaches every subscription.
     */
    void destroy();
}
