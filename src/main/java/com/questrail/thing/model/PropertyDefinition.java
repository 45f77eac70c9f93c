package com.questrail.thing.model;

import java.util.Map;

/**
 * Definition of a property affordance.
 *
 * @param name        unique interaction name
 * @param label       optional human-readable label ({@code null} if absent)
 * @param description optional free-text description ({@code null} if absent)
 * @param schema      data schema of the property value (never {@code null}, may be empty)
 * @param writable    whether remote writes are accepted
 * @param observable  whether change notifications may be subscribed to
 */
public record PropertyDefinition(
        String name,
        String label,
        String description,
        Map<String, Object> schema,
        boolean writable,
        boolean observable
) implements Interaction
{
    public PropertyDefinition {
        Interaction.requireName(name);
        schema = Interaction.copySchema(schema);
    }

    /**
     * Builds the definition described by a property initializer.
     */
    public static PropertyDefinition from(String name, PropertyInit init) {
        return new PropertyDefinition(
                name,
                init.label(),
                init.description(),
                init.schema(),
                init.writable(),
                init.observable()
        );
    }

    @Override
    public InteractionType type() {
        return InteractionType.PROPERTY;
    }
}
