package com.questrail.thing.model;

import java.util.Map;

/**
 * Initializer for a property added at runtime.
 * <p>
 * Carries the declarative part of the property together with its initial value,
 * which seeds the interaction state when the property is added. Properties are
 * neither writable nor observable unless requested.
 *
 * @param value       initial value ({@code null} leaves the property unset)
 * @param label       optional label
 * @param description optional free-text description
 * @param schema      data schema of the value
 * @param writable    whether writes are accepted
 * @param observable  whether change subscriptions are allowed
 */
public record PropertyInit(
        Object value,
        String label,
        String description,
        Map<String, Object> schema,
        boolean writable,
        boolean observable
) {
    public PropertyInit {
        schema = Interaction.copySchema(schema);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Object value;
        private String label;
        private String description;
        private Map<String, Object> schema = Map.of();
        private boolean writable;
        private boolean observable;

        public Builder withValue(Object value) {
            this.value = value;
            return this;
        }

        public Builder withLabel(String label) {
            this.label = label;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder withSchema(Map<String, Object> schema) {
            this.schema = schema;
            return this;
        }

        public Builder writable(boolean writable) {
            this.writable = writable;
            return this;
        }

        public Builder observable(boolean observable) {
            this.observable = observable;
            return this;
        }

        public PropertyInit build() {
            return new PropertyInit(value, label, description, schema, writable, observable);
        }
    }
}
