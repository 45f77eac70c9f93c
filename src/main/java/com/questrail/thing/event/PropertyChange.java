package com.questrail.thing.event;

import java.util.Objects;

/**
 * Payload of a property-change notification.
 *
 * @param name  property name
 * @param value value that was written ({@code null} allowed)
 */
public record PropertyChange(String name, Object value) {
    public PropertyChange {
        Objects.requireNonNull(name, "name");
    }
}
