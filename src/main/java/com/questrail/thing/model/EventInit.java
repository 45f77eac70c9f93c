package com.questrail.thing.model;

import java.util.Map;

/**
 * Initializer for an event added at runtime.
 */
public record EventInit(
        String label,
        String description,
        Map<String, Object> dataSchema
) {
    public EventInit {
        dataSchema = Interaction.copySchema(dataSchema);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String label;
        private String description;
        private Map<String, Object> dataSchema = Map.of();

        public Builder withLabel(String label) {
            this.label = label;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder withDataSchema(Map<String, Object> dataSchema) {
            this.dataSchema = dataSchema;
            return this;
        }

        public EventInit build() {
            return new EventInit(label, description, dataSchema);
        }
    }
}
