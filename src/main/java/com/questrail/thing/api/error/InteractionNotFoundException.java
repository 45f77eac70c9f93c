package com.questrail.thing.api.error;

/**
 * Raised when a call names an interaction that is not defined on the Thing,
 * or that is defined with a different affordance type than the call requires.
 */
public final class InteractionNotFoundException extends ThingException
{
    public InteractionNotFoundException(String interactionName) {
        super(interactionName, "Interaction not found: " + interactionName);
    }
}
