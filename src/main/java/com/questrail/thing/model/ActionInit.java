package com.questrail.thing.model;

import java.util.Map;

/**
 * Initializer for an action added at runtime.
 */
public record ActionInit(
        String label,
        String description,
        Map<String, Object> inputSchema,
        Map<String, Object> outputSchema
) {
    public ActionInit {
        inputSchema = Interaction.copySchema(inputSchema);
        outputSchema = Interaction.copySchema(outputSchema);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String label;
        private String description;
        private Map<String, Object> inputSchema = Map.of();
        private Map<String, Object> outputSchema = Map.of();

        public Builder withLabel(String label) {
            this.label = label;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder withInputSchema(Map<String, Object> inputSchema) {
            this.inputSchema = inputSchema;
            return this;
        }

        public Builder withOutputSchema(Map<String, Object> outputSchema) {
            this.outputSchema = outputSchema;
            return this;
        }

        public ActionInit build() {
            return new ActionInit(label, description, inputSchema, outputSchema);
        }
    }
}
