package com.questrail.thing.observability;

import com.questrail.thing.event.DescriptionChange;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ThingObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onEventPublished(EventPublishedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDescriptionChanged(DescriptionChange change) {
        events.add(change);
    }

    @Override
    public synchronized void onError(ThingErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ThingErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof ThingErrorEvent)
            .map(e -> (ThingErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<EventPublishedEvent> getPublishes() {
        return events.stream()
            .filter(e -> e instanceof EventPublishedEvent)
            .map(e -> (EventPublishedEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
