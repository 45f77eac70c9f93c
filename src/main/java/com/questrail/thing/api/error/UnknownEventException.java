package com.questrail.thing.api.error;

/**
 * Raised when subscribing to, or emitting, an event whose name is not defined on the Thing.
 */
public final class UnknownEventException extends ThingException
{
    public UnknownEventException(String interactionName) {
        super(interactionName, "Unknown event: " + interactionName);
    }
}
