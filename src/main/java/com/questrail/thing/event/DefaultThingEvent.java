package com.questrail.thing.event;

/**
 * Bus names of the notifications the runtime publishes on its own behalf.
 * <p>
 * User-defined events are published under their interaction name, so a Thing
 * should not declare events with these names.
 */
public enum DefaultThingEvent
{
    PROPERTY_CHANGE("propertychange"),
    ACTION_INVOCATION("actioninvocation"),
    DESCRIPTION_CHANGE("descriptionchange");

    private final String eventName;

    DefaultThingEvent(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
