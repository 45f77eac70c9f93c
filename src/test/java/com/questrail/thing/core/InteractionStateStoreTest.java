package com.questrail.thing.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InteractionStateStoreTest {

    @Test
    void unsetPropertyHasNoValue() {
        InteractionStateStore store = new InteractionStateStore();
        assertTrue(store.get("temp").isEmpty());
        assertFalse(store.contains("temp"));
    }

    @Test
    void lastWriteWins() {
        InteractionStateStore store = new InteractionStateStore();
        store.set("temp", 20);
        store.set("temp", 21);
        assertEquals(21, store.get("temp").orElseThrow());
    }

    @Test
    void storingNullClearsTheValue() {
        InteractionStateStore store = new InteractionStateStore();
        store.set("temp", 20);
        store.set("temp", null);
        assertTrue(store.get("temp").isEmpty());
    }

    @Test
    void removeForgetsTheValue() {
        InteractionStateStore store = new InteractionStateStore();
        store.set("temp", 20);
        store.remove("temp");
        assertFalse(store.contains("temp"));
    }

    @Test
    void snapshotIsDetachedFromLaterWrites() {
        InteractionStateStore store = new InteractionStateStore();
        store.set("temp", 20);
        Map<String, Object> snapshot = store.snapshot();

        store.set("temp", 30);

        assertEquals(20, snapshot.get("temp"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("x", 1));
    }
}
