package com.questrail.thing.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

class LocalServientHostTest
{
    @Test
    void tracksExposedThingsInExposureOrder() {
        LocalServientHost host = new LocalServientHost();

        host.enableExposedThing("urn:b");
        host.enableExposedThing("urn:a");
        host.enableExposedThing("urn:b");

        assertEquals(List.of("urn:b", "urn:a"), new ArrayList<>(host.exposedThingIds()));
        assertTrue(host.isExposed("urn:a"));
    }

    @Test
    void removingUnknownThingIsHarmless() {
        LocalServientHost host = new LocalServientHost();
        host.enableExposedThing("urn:a");

        host.removeExposedThing("urn:missing");
        host.removeExposedThing("urn:a");

        assertFalse(host.isExposed("urn:a"));
        assertTrue(host.exposedThingIds().isEmpty());
    }

    @Test
    void snapshotIsDetachedAndUnmodifiable() {
        LocalServientHost host = new LocalServientHost();
        host.enableExposedThing("urn:a");

        var snapshot = host.exposedThingIds();
        host.enableExposedThing("urn:b");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("urn:c"));
    }
}
