package com.questrail.thing.observability;

import com.questrail.thing.event.DescriptionChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ThingObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jThingObservabilitySink implements ThingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jThingObservabilitySink.class);

    private final String thingName;

    public Slf4jThingObservabilitySink(String thingName) {
        this.thingName = thingName;
    }

    @Override
    public void onEventPublished(EventPublishedEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("[{}] Published '{}' to {}/{} subscriptions",
                thingName,
                event.event().name(),
                event.delivered(),
                event.subscribers());
        }
    }

    @Override
    public void onDescriptionChanged(DescriptionChange change) {
        log.info("[{}] Description change: {} {} '{}'",
            thingName,
            change.method().wireName(),
            change.changeType().wireName(),
            change.name());
    }

    @Override
    public void onError(ThingErrorEvent event) {
        log.warn("[{}] {} ({})", thingName, event.message(), event.source(), event.cause());
    }
}
