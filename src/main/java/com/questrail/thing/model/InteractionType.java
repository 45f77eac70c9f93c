package com.questrail.thing.model;

/**
 * The three affordance kinds a Thing can declare.
 * <p>
 * The wire name is the lower-case token used in description-change
 * notifications ({@code "property"}, {@code "action"}, {@code "event"}).
 */
public enum InteractionType
{
    PROPERTY("property"),
    ACTION("action"),
    EVENT("event");

    private final String wireName;

    InteractionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
