package com.questrail.thing.api;

/**
 * ServientHost
 * -----------------------------------------------------------------------------
 * Boundary to the host registry that decides which Things are reachable through
 * protocol bindings.
 *
 * <p>
 * The exposed-thing runtime only forwards lifecycle requests here. Which
 * bindings serve a Thing, and how, is entirely the host's concern.
 * </p>
 */
public interface ServientHost
{
    /**
     * Starts serving external requests for the Thing with the given id.
     */
    void enableExposedThing(String thingId);

    /**
     * Stops serving the Thing with the given id and forgets it.
     */
    void removeExposedThing(String thingId);
}
