package com.questrail.thing.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Application-supplied behavior for an action.
 */
@FunctionalInterface
public interface ActionHandler
{
    /**
     * Runs an action.
     *
     * @param actionName name of the invoked action, so a single global handler
     *                   can serve several actions
     * @param arguments  invocation arguments in call order (unmodifiable, may
     *                   contain {@code null})
     * @return future resolving with the action result
     */
    CompletableFuture<Object> invoke(String actionName, List<Object> arguments);
}
