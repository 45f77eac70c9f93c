package com.questrail.thing.api.error;

/**
 * Raised by a property write when the property is declared non-writable.
 * The check happens before any write handler is resolved.
 */
public final class NotWritableException extends ThingException
{
    public NotWritableException(String interactionName) {
        super(interactionName, "Property is non-writable: " + interactionName);
    }
}
