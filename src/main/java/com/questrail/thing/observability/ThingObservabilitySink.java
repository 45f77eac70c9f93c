package com.questrail.thing.observability;

import com.questrail.thing.event.DescriptionChange;

/**
 * Main interface for receiving exposed-thing observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ThingObservabilitySink {
    /**
     * Called after an event has been offered to every attached subscription.
     * @param event the publish details
     */
    void onEventPublished(EventPublishedEvent event);

    /**
     * Called when an interaction is added to or removed from the Thing.
     * @param change the description change
     */
    void onDescriptionChanged(DescriptionChange change);

    /**
     * Called when a handler fails or a subscriber callback throws.
     * @param event the error event
     */
    void onError(ThingErrorEvent event);
}
