package com.questrail.thing.api.error;

import java.util.Objects;

/**
 * Base class for every error raised by the exposed-thing runtime itself.
 * <p>
 * Existence, writability and observability failures are thrown synchronously at
 * the call or subscribe boundary, before any handler runs. The one exception is
 * {@link UndefinedActionHandlerException}, which is the failure of the default
 * action handler and therefore arrives through the returned future.
 * <p>
 * Errors produced by application handlers are never wrapped in a
 * {@code ThingException}; they reach the caller exactly as the handler raised them.
 */
public abstract class ThingException extends RuntimeException
{
    private final String interactionName;

    protected ThingException(String interactionName, String message) {
        super(message);
        this.interactionName = Objects.requireNonNull(interactionName, "interactionName");
    }

    /**
     * Name of the interaction the failed call referred to.
     */
    public String interactionName() {
        return interactionName;
    }
}
