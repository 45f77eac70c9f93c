package com.questrail.thing.api;

import java.util.concurrent.CompletableFuture;

/**
 * Application-supplied behavior for reading a property.
 */
@FunctionalInterface
public interface PropertyReadHandler
{
    /**
     * Produces the current value of a property.
     *
     * @param propertyName name of the property being read
     * @return future resolving with the value ({@code null} allowed) or failing
     *         with an error that is handed to the caller unchanged
     */
    CompletableFuture<Object> read(String propertyName);
}
