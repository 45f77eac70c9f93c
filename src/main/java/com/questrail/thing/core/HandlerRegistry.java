package com.questrail.thing.core;

import com.questrail.thing.api.ActionHandler;
import com.questrail.thing.api.HandlerKind;
import com.questrail.thing.api.PropertyReadHandler;
import com.questrail.thing.api.PropertyWriteHandler;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HandlerRegistry
 * -----------------------------------------------------------------------------
 * Lookup table from a {@link HandlerKind} to either a global handler or a
 * handler dedicated to one interaction.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Exactly one global handler exists per kind at all times. The constructor
 *       seeds one for every kind; a global handler can be replaced but never
 *       removed.</li>
 *   <li>At most one dedicated handler exists per (kind, interaction) pair.</li>
 * </ul>
 *
 * <h2>Resolution</h2>
 * {@link #getHandler(HandlerKind, String)} returns the handler dedicated to the
 * exact interaction if one exists, otherwise the global handler for the kind.
 * Falling back is silent: an interaction without a dedicated handler is normal.
 *
 * <p>
 * This is a pure table. It does not invoke handlers and knows nothing about
 * which interactions exist; callers validate names before registering.
 * Each exposed Thing owns its own instance.
 * </p>
 */
public final class HandlerRegistry
{
    private final Map<HandlerKind<?>, Object> global = new ConcurrentHashMap<>();
    private final Map<HandlerKind<?>, Map<String, Object>> dedicated = new ConcurrentHashMap<>();

    /**
     * Creates a registry seeded with the global default for every kind.
     */
    public HandlerRegistry(PropertyReadHandler defaultReadHandler,
                           PropertyWriteHandler defaultWriteHandler,
                           ActionHandler defaultActionHandler)
    {
        seed(HandlerKind.RETRIEVE_PROPERTY, defaultReadHandler);
        seed(HandlerKind.UPDATE_PROPERTY, defaultWriteHandler);
        seed(HandlerKind.INVOKE_ACTION, defaultActionHandler);
    }

    private <H> void seed(HandlerKind<H> kind, H handler) {
        global.put(kind, Objects.requireNonNull(handler, "default " + kind + " handler"));
        dedicated.put(kind, new ConcurrentHashMap<>());
    }

    /**
     * Stores {@code handler} as the handler dedicated to {@code interaction}, or
     * replaces the global handler for {@code kind} when {@code interaction} is
     * {@code null}.
     */
    public <H> void setHandler(HandlerKind<H> kind, H handler, String interaction) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");

        if (interaction == null) {
            global.put(kind, handler);
        } else {
            dedicated.get(kind).put(interaction, handler);
        }
    }

    /**
     * Resolves the handler for {@code kind}: the one dedicated to
     * {@code interaction} if present, otherwise the global one. Never returns
     * {@code null}.
     */
    public <H> H getHandler(HandlerKind<H> kind, String interaction) {
        Objects.requireNonNull(kind, "kind");

        if (interaction != null) {
            Object handler = dedicated.get(kind).get(interaction);
            if (handler != null) {
                return kind.cast(handler);
            }
        }
        return kind.cast(global.get(kind));
    }

    /**
     * Returns the handler dedicated to {@code interaction}, without fallback.
     */
    public <H> Optional<H> findDedicatedHandler(HandlerKind<H> kind, String interaction) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(interaction, "interaction");
        return Optional.ofNullable(dedicated.get(kind).get(interaction)).map(kind::cast);
    }

    /**
     * Removes the handler dedicated to {@code interaction}; the global handler
     * applies again afterwards.
     *
     * @return {@code true} if a dedicated handler was removed
     */
    public boolean clearHandler(HandlerKind<?> kind, String interaction) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(interaction, "interaction");
        return dedicated.get(kind).remove(interaction) != null;
    }

    /**
     * Removes every handler dedicated to {@code interaction}, across all kinds.
     */
    public void clearInteraction(String interaction) {
        Objects.requireNonNull(interaction, "interaction");
        for (Map<String, Object> handlers : dedicated.values()) {
            handlers.remove(interaction);
        }
    }
}
