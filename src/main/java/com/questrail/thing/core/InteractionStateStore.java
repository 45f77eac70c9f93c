package com.questrail.thing.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InteractionStateStore
 * -----------------------------------------------------------------------------
 * Current value of each property, keyed by property name.
 *
 * <p>
 * This is the only mutable runtime state of a Thing. Writes are last-write-wins
 * and no history is kept. The store provides per-entry atomicity only: two
 * concurrent writers of the same property race, and the later one wins.
 * </p>
 *
 * <p>
 * {@code null} is a legal property value but is indistinguishable from "never
 * set": storing {@code null} clears the entry.
 * </p>
 */
public final class InteractionStateStore
{
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    /**
     * Returns the stored value of a property, if one was set.
     */
    public Optional<Object> get(String propertyName) {
        Objects.requireNonNull(propertyName, "propertyName");
        return Optional.ofNullable(values.get(propertyName));
    }

    /**
     * Stores the value of a property, replacing any previous value.
     */
    public void set(String propertyName, Object value) {
        Objects.requireNonNull(propertyName, "propertyName");
        if (value == null) {
            values.remove(propertyName);
        } else {
            values.put(propertyName, value);
        }
    }

    /**
     * Forgets the value of a property.
     */
    public void remove(String propertyName) {
        Objects.requireNonNull(propertyName, "propertyName");
        values.remove(propertyName);
    }

    public boolean contains(String propertyName) {
        Objects.requireNonNull(propertyName, "propertyName");
        return values.containsKey(propertyName);
    }

    /**
     * Point-in-time copy of all stored values.
     */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(values));
    }
}
