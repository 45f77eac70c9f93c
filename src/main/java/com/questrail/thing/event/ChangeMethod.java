package com.questrail.thing.event;

/**
 * Whether a description change added or removed an interaction.
 */
public enum ChangeMethod
{
    ADD("add"),
    REMOVE("remove");

    private final String wireName;

    ChangeMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
