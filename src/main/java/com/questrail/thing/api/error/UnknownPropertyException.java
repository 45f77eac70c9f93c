package com.questrail.thing.api.error;

/**
 * Raised when subscribing to changes of a property that is not defined on the Thing.
 */
public final class UnknownPropertyException extends ThingException
{
    public UnknownPropertyException(String interactionName) {
        super(interactionName, "Unknown property: " + interactionName);
    }
}
