package com.questrail.thing.model;

import java.util.Map;

/**
 * Definition of an action affordance.
 *
 * @param name         unique interaction name
 * @param label        optional human-readable label ({@code null} if absent)
 * @param description  optional free-text description ({@code null} if absent)
 * @param inputSchema  schema of the invocation input (may be empty)
 * @param outputSchema schema of the invocation result (may be empty)
 */
public record ActionDefinition(
        String name,
        String label,
        String description,
        Map<String, Object> inputSchema,
        Map<String, Object> outputSchema
) implements Interaction
{
    public ActionDefinition {
        Interaction.requireName(name);
        inputSchema = Interaction.copySchema(inputSchema);
        outputSchema = Interaction.copySchema(outputSchema);
    }

    public static ActionDefinition from(String name, ActionInit init) {
        return new ActionDefinition(
                name,
                init.label(),
                init.description(),
                init.inputSchema(),
                init.outputSchema()
        );
    }

    @Override
    public InteractionType type() {
        return InteractionType.ACTION;
    }
}
