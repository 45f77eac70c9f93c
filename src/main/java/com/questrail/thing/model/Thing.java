package com.questrail.thing.model;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Thing
 * -----------------------------------------------------------------------------
 * In-memory {@link InteractionRegistry} holding the definitions of one Thing.
 *
 * <h2>Threading model</h2>
 * A single private lock guards the definition map. Lookups and snapshots copy
 * out under the lock, so callers never observe a half-applied add or remove.
 *
 * <h2>Equality</h2>
 * Two {@code Thing}s are equal iff their ids are equal. Definitions are runtime
 * state and do not take part in identity.
 */
public final class Thing implements InteractionRegistry
{
    private final Object lock = new Object();

    private final String id;
    private final String name;
    private final Map<String, Interaction> interactions = new LinkedHashMap<>();

    public Thing(String id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Thing id must not be blank");
        }
    }

    /**
     * Creates an empty Thing with a generated {@code urn:uuid:} identity.
     */
    public static Thing fromName(String name) {
        return new Thing("urn:uuid:" + UUID.randomUUID(), name);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * URL-safe slug of the Thing name, suitable as a path segment in protocol
     * bindings. Falls back to the id when the name has no usable characters.
     */
    public String urlName() {
        String slug = slugify(name);
        return slug.isEmpty() ? slugify(id) : slug;
    }

    @Override
    public Optional<Interaction> find(String name) {
        Objects.requireNonNull(name, "name");
        synchronized (lock) {
            return Optional.ofNullable(interactions.get(name));
        }
    }

    @Override
    public void add(Interaction interaction) {
        Objects.requireNonNull(interaction, "interaction");
        synchronized (lock) {
            if (interactions.containsKey(interaction.name())) {
                throw new IllegalArgumentException("Duplicate interaction: " + interaction.name());
            }
            interactions.put(interaction.name(), interaction);
        }
    }

    @Override
    public Optional<Interaction> remove(String name) {
        Objects.requireNonNull(name, "name");
        synchronized (lock) {
            return Optional.ofNullable(interactions.remove(name));
        }
    }

    @Override
    public List<Interaction> interactions() {
        synchronized (lock) {
            return List.copyOf(interactions.values());
        }
    }

    /**
     * Snapshot of the definitions of one type, keyed by name, in insertion order.
     */
    public <T extends Interaction> Map<String, T> interactionsOfType(Class<T> type) {
        Objects.requireNonNull(type, "type");
        Map<String, T> result = new LinkedHashMap<>();
        for (Interaction interaction : interactions()) {
            if (type.isInstance(interaction)) {
                result.put(interaction.name(), type.cast(interaction));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Thing other)) {
            return false;
        }
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Thing{id=" + id + ", name=" + name + "}";
    }

    private static String slugify(String text) {
        String ascii = Normalizer.normalize(text, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "");
        return ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
    }
}
