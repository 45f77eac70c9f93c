package com.questrail.thing.observability;

import com.questrail.thing.event.DescriptionChange;

/**
 * No-op implementation of ThingObservabilitySink.
 */
public final class NullObservabilitySink implements ThingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEventPublished(EventPublishedEvent event) {}

    @Override
    public void onDescriptionChanged(DescriptionChange change) {}

    @Override
    public void onError(ThingErrorEvent event) {}
}
