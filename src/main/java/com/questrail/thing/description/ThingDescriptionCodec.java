package com.questrail.thing.description;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.questrail.thing.config.ThingRuntimeConfig;
import com.questrail.thing.event.DescriptionChange;
import com.questrail.thing.model.ActionDefinition;
import com.questrail.thing.model.EventDefinition;
import com.questrail.thing.model.Interaction;
import com.questrail.thing.model.InteractionRegistry;
import com.questrail.thing.model.PropertyDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ThingDescriptionCodec
 * -----------------------------------------------------------------------------
 * Renders the current state of an {@link InteractionRegistry} as a Thing
 * description, and interaction definitions as the {@code data} objects carried
 * by description-change notifications.
 *
 * <h2>Shape</h2>
 * <pre>
 * {
 *   "@context": "...",
 *   "id": "urn:...",
 *   "name": "...",
 *   "properties": { "temp": { "name": "temp", "schema": {...}, "writable": true, "observable": true } },
 *   "actions":    { "reset": { "name": "reset", "input": {...}, "output": {...} } },
 *   "events":     { "overheat": { "name": "overheat", "data": {...} } }
 * }
 * </pre>
 * Absent labels, descriptions and empty schemas are omitted. Map key order is
 * stable (insertion order of the registry).
 *
 * <p>This codec only writes. Parsing description documents is not supported.</p>
 */
public final class ThingDescriptionCodec
{
    private final ObjectMapper mapper;
    private final ThingRuntimeConfig config;

    public ThingDescriptionCodec(ThingRuntimeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = new ObjectMapper();
    }

    /**
     * Full description of the Thing as an ordered, unmodifiable map.
     */
    public Map<String, Object> describe(InteractionRegistry thing) {
        Objects.requireNonNull(thing, "thing");

        Map<String, Object> properties = new LinkedHashMap<>();
        Map<String, Object> actions = new LinkedHashMap<>();
        Map<String, Object> events = new LinkedHashMap<>();

        for (Interaction interaction : thing.interactions()) {
            Map<String, Object> data = interactionData(interaction);
            switch (interaction.type()) {
                case PROPERTY -> properties.put(interaction.name(), data);
                case ACTION -> actions.put(interaction.name(), data);
                case EVENT -> events.put(interaction.name(), data);
            }
        }

        Map<String, Object> td = new LinkedHashMap<>();
        td.put("@context", config.descriptionContext());
        td.put("id", thing.id());
        td.put("name", thing.name());
        td.put("properties", Collections.unmodifiableMap(properties));
        td.put("actions", Collections.unmodifiableMap(actions));
        td.put("events", Collections.unmodifiableMap(events));
        return Collections.unmodifiableMap(td);
    }

    /**
     * Full description of the Thing serialized as JSON.
     */
    public String encode(InteractionRegistry thing) {
        return write(describe(thing), config.prettyPrintDescription());
    }

    /**
     * Serialized form of a single interaction definition.
     */
    public Map<String, Object> interactionData(Interaction interaction) {
        Objects.requireNonNull(interaction, "interaction");

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", interaction.name());

        if (interaction instanceof PropertyDefinition property) {
            putCommon(data, property.label(), property.description());
            putSchema(data, "schema", property.schema());
            data.put("writable", property.writable());
            data.put("observable", property.observable());
        } else if (interaction instanceof ActionDefinition action) {
            putCommon(data, action.label(), action.description());
            putSchema(data, "input", action.inputSchema());
            putSchema(data, "output", action.outputSchema());
        } else if (interaction instanceof EventDefinition event) {
            putCommon(data, event.label(), event.description());
            putSchema(data, "data", event.dataSchema());
        }
        return Collections.unmodifiableMap(data);
    }

    /**
     * Serialized form of a property definition together with the value it was
     * initialized with.
     */
    public Map<String, Object> propertyData(PropertyDefinition property, Object initialValue) {
        Map<String, Object> data = new LinkedHashMap<>(interactionData(property));
        if (initialValue != null) {
            data.put("value", initialValue);
        }
        return Collections.unmodifiableMap(data);
    }

    /**
     * Wire form of a description-change payload:
     * {@code {changeType, method, name, data?, description?}} with lower-case
     * enum tokens.
     */
    public String encodeDescriptionChange(DescriptionChange change) {
        Objects.requireNonNull(change, "change");

        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("changeType", change.changeType().wireName());
        wire.put("method", change.method().wireName());
        wire.put("name", change.name());
        change.dataIfPresent().ifPresent(d -> wire.put("data", d));
        change.descriptionIfPresent().ifPresent(d -> wire.put("description", d));
        return write(wire, false);
    }

    private String write(Map<String, Object> value, boolean pretty) {
        try {
            if (pretty) {
                return mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value);
            }
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DescriptionEncodingException("Cannot render description as JSON", e);
        }
    }

    private static void putCommon(Map<String, Object> data, String label, String description) {
        if (label != null) {
            data.put("label", label);
        }
        if (description != null) {
            data.put("description", description);
        }
    }

    private static void putSchema(Map<String, Object> data, String key, Map<String, Object> schema) {
        if (!schema.isEmpty()) {
            data.put(key, schema);
        }
    }
}
