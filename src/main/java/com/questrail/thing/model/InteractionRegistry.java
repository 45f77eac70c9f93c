package com.questrail.thing.model;

import java.util.List;
import java.util.Optional;

/**
 * InteractionRegistry
 * -----------------------------------------------------------------------------
 * Boundary to the component that owns the interaction definitions of a single
 * Thing.
 *
 * <p>
 * The exposed-thing runtime only needs lookup by name and the ability to add
 * and remove definitions. Parsing or producing a full Thing Description document
 * is not part of this contract.
 * </p>
 *
 * <h2>Threading</h2>
 * Implementations must tolerate lookups concurrent with add/remove. A lookup
 * observes either the state before or after a mutation, never a partial one.
 */
public interface InteractionRegistry
{
    /**
     * Stable identity of the Thing (typically a URN).
     */
    String id();

    /**
     * Human-readable name of the Thing.
     */
    String name();

    /**
     * Looks up an interaction of any type by name.
     */
    Optional<Interaction> find(String name);

    /**
     * Looks up an interaction by name, matching only the given definition type.
     */
    default <T extends Interaction> Optional<T> find(String name, Class<T> type) {
        return find(name).filter(type::isInstance).map(type::cast);
    }

    /**
     * Adds a definition.
     *
     * @throws IllegalArgumentException if an interaction with the same name exists
     */
    void add(Interaction interaction);

    /**
     * Removes the interaction with the given name.
     *
     * @return the removed definition, or {@link Optional#empty()} if none existed
     */
    Optional<Interaction> remove(String name);

    /**
     * Snapshot of all definitions in insertion order.
     */
    List<Interaction> interactions();
}
