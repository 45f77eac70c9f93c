package com.questrail.thing.event;

import com.questrail.thing.model.InteractionType;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DescriptionChange
 * -----------------------------------------------------------------------------
 * Payload of a description-change notification.
 *
 * <p>
 * {@code data} (the serialized definition of the affected interaction) and
 * {@code description} (the full description after the change) are present for
 * {@link ChangeMethod#ADD} and absent for {@link ChangeMethod#REMOVE}.
 * </p>
 *
 * @param changeType  affordance type of the affected interaction
 * @param method      add or remove
 * @param name        name of the affected interaction
 * @param data        serialized interaction definition, {@code null} on remove
 * @param description full Thing description, {@code null} on remove
 */
public record DescriptionChange(
        InteractionType changeType,
        ChangeMethod method,
        String name,
        Map<String, Object> data,
        Map<String, Object> description
) {
    public DescriptionChange {
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(name, "name");
        if (method == ChangeMethod.REMOVE && (data != null || description != null)) {
            throw new IllegalArgumentException("Remove changes carry neither data nor description");
        }
    }

    public static DescriptionChange added(InteractionType changeType,
                                          String name,
                                          Map<String, Object> data,
                                          Map<String, Object> description) {
        return new DescriptionChange(
                changeType,
                ChangeMethod.ADD,
                name,
                Objects.requireNonNull(data, "data"),
                Objects.requireNonNull(description, "description"));
    }

    public static DescriptionChange removed(InteractionType changeType, String name) {
        return new DescriptionChange(changeType, ChangeMethod.REMOVE, name, null, null);
    }

    public Optional<Map<String, Object>> dataIfPresent() {
        return Optional.ofNullable(data);
    }

    public Optional<Map<String, Object>> descriptionIfPresent() {
        return Optional.ofNullable(description);
    }
}
