package com.questrail.thing.api;

import java.util.concurrent.CompletableFuture;

/**
 * Application-supplied behavior for writing a property.
 */
@FunctionalInterface
public interface PropertyWriteHandler
{
    /**
     * Applies a new value to a property.
     * <p>
     * A property-change notification is published only if the returned future
     * completes normally.
     *
     * @param propertyName name of the property being written
     * @param value        new value ({@code null} allowed)
     * @return future completing when the write has been applied
     */
    CompletableFuture<Void> write(String propertyName, Object value);
}
