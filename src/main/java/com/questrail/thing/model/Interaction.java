package com.questrail.thing.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interaction
 * -----------------------------------------------------------------------------
 * A named affordance declared by a Thing: a property, an action or an event.
 *
 * <h2>Identity</h2>
 * The name is the identity of an interaction and is unique within a Thing,
 * regardless of affordance type. Every other component of the runtime (handler
 * overrides, stored property values, subscriptions) refers to an interaction by
 * its name only.
 *
 * <h2>Ownership</h2>
 * Definitions are immutable and owned by the {@link InteractionRegistry}. The
 * runtime never mutates a definition; it only keeps runtime state keyed by name.
 */
public sealed interface Interaction permits PropertyDefinition, ActionDefinition, EventDefinition
{
    /**
     * Unique name of this interaction within its Thing.
     */
    String name();

    /**
     * Affordance kind of this interaction.
     */
    InteractionType type();

    /**
     * Immutable, order-preserving copy of a data schema; {@code null} becomes empty.
     */
    static Map<String, Object> copySchema(Map<String, Object> schema) {
        if (schema == null || schema.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(schema));
    }

    /**
     * Rejects names that cannot identify an interaction.
     */
    static String requireName(String name) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("Interaction name must not be blank");
        }
        return name;
    }
}
