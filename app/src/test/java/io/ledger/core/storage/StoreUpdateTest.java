package io.ledger.core.storage;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoreUpdateTest {

    @Test
    void commitsWhenAllParticipantsSucceed() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.createRegion("r");
        List<String> undone = new ArrayList<>();

        StoreUpdate.update(store,
                tx -> { tx.put("r", "a".getBytes(), "1".getBytes()); return () -> undone.add("a"); },
                tx -> { tx.put("r", "b".getBytes(), "2".getBytes()); return () -> undone.add("b"); });

        assertNotNull(store.get("r", "a".getBytes()));
        assertNotNull(store.get("r", "b".getBytes()));
        assertTrue(undone.isEmpty());
    }

    @Test
    void failingParticipantUnwindsEarlierOnesNewestFirst() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.createRegion("r");
        List<String> undone = new ArrayList<>();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                StoreUpdate.update(store,
                        tx -> { tx.put("r", "a".getBytes(), "1".getBytes()); return () -> undone.add("a"); },
                        tx -> { tx.put("r", "b".getBytes(), "2".getBytes()); return () -> undone.add("b"); },
                        tx -> { throw new IllegalArgumentException("index rejected block"); }));

        assertEquals("index rejected block", ex.getMessage());
        assertEquals(List.of("b", "a"), undone);
        assertNull(store.get("r", "a".getBytes()));
        assertNull(store.get("r", "b".getBytes()));
    }

    @Test
    void rollbackFailureIsAttachedAsSuppressed() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.createRegion("r");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () ->
                StoreUpdate.update(store,
                        tx -> () -> { throw new UnsupportedOperationException("undo broke"); },
                        tx -> { throw new IllegalStateException("boom"); }));

        assertEquals(1, ex.getSuppressed().length);
        assertEquals("undo broke", ex.getSuppressed()[0].getMessage());
    }
}
