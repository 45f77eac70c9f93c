package com.questrail.thing.api.error;

/**
 * Raised when subscribing to changes of a property declared non-observable.
 */
public final class NotObservableException extends ThingException
{
    public NotObservableException(String interactionName) {
        super(interactionName, "Property is not observable: " + interactionName);
    }
}
