package com.questrail.thing.api;

import java.util.List;
import java.util.Objects;

/**
 * HandlerKind
 * -----------------------------------------------------------------------------
 * Typed key naming one slot of the handler table.
 *
 * <p>
 * Each kind is bound to the functional interface its handlers implement, so
 * lookups need no casts at the call site:
 * </p>
 * <pre>{@code
 * PropertyReadHandler h = registry.getHandler(HandlerKind.RETRIEVE_PROPERTY, "temp");
 * }</pre>
 *
 * The set of kinds is closed; instances are compared by identity.
 *
 * @param <H> handler interface stored under this kind
 */
public final class HandlerKind<H>
{
    public static final HandlerKind<PropertyReadHandler> RETRIEVE_PROPERTY =
            new HandlerKind<>("retrieve_property", PropertyReadHandler.class);

    public static final HandlerKind<PropertyWriteHandler> UPDATE_PROPERTY =
            new HandlerKind<>("update_property", PropertyWriteHandler.class);

    public static final HandlerKind<ActionHandler> INVOKE_ACTION =
            new HandlerKind<>("invoke_action", ActionHandler.class);

    private static final List<HandlerKind<?>> ALL = List.of(RETRIEVE_PROPERTY, UPDATE_PROPERTY, INVOKE_ACTION);

    private final String key;
    private final Class<H> handlerType;

    private HandlerKind(String key, Class<H> handlerType) {
        this.key = Objects.requireNonNull(key, "key");
        this.handlerType = Objects.requireNonNull(handlerType, "handlerType");
    }

    /**
     * All handler kinds, in declaration order.
     */
    public static List<HandlerKind<?>> values() {
        return ALL;
    }

    public Class<H> handlerType() {
        return handlerType;
    }

    /**
     * Checked cast of a stored handler to this kind's interface.
     */
    public H cast(Object handler) {
        return handlerType.cast(handler);
    }

    @Override
    public String toString() {
        return key;
    }
}
