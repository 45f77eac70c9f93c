package com.questrail.thing.model;

import java.util.Map;

/**
 * Definition of an event affordance.
 *
 * @param name        unique interaction name
 * @param label       optional human-readable label ({@code null} if absent)
 * @param description optional free-text description ({@code null} if absent)
 * @param dataSchema  schema of the event payload (may be empty)
 */
public record EventDefinition(
        String name,
        String label,
        String description,
        Map<String, Object> dataSchema
) implements Interaction
{
    public EventDefinition {
        Interaction.requireName(name);
        dataSchema = Interaction.copySchema(dataSchema);
    }

    public static EventDefinition from(String name, EventInit init) {
        return new EventDefinition(name, init.label(), init.description(), init.dataSchema());
    }

    @Override
    public InteractionType type() {
        return InteractionType.EVENT;
    }
}
