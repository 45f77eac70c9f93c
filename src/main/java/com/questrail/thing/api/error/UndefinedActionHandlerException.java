package com.questrail.thing.api.error;

/**
 * Failure produced by the default action handler.
 * <p>
 * An action invoked with neither a dedicated nor a global handler configured is a
 * misconfiguration, so the default handler fails the call rather than returning nothing.
 */
public final class UndefinedActionHandlerException extends ThingException
{
    public UndefinedActionHandlerException(String interactionName) {
        super(interactionName, "Undefined action handler: " + interactionName);
    }
}
