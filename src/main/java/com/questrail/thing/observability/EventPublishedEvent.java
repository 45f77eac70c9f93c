package com.questrail.thing.observability;

import com.questrail.thing.event.EmittedEvent;

/**
 * Record describing one publish on a Thing's event bus.
 *
 * @param event       the published event
 * @param subscribers number of subscriptions attached at publish time
 * @param delivered   number of subscriptions whose filter accepted the event
 */
public record EventPublishedEvent(
    EmittedEvent event,
    int subscribers,
    int delivered
) {
}
