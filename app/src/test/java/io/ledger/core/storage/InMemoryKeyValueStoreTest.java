package io.ledger.core.storage;

import io.ledger.core.exception.StoreException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryKeyValueStoreTest {

    private static byte[] b(String s) {
        return s.getBytes();
    }

    @Test
    void writesBecomeVisibleOnlyOnCommit() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.createRegion("r");

        try (StoreTransaction tx = store.begin()) {
            tx.put("r", b("k"), b("v"));
            assertArrayEquals(b("v"), tx.get("r", b("k")));
            assertNull(store.get("r", b("k")));
            tx.commit();
        }
        assertArrayEquals(b("v"), store.get("r", b("k")));
    }

    @Test
    void rollbackAndCloseDiscardWrites() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.createRegion("r");

        try (StoreTransaction tx = store.begin()) {
            tx.put("r", b("a"), b("1"));
            tx.rollback();
        }
        try (StoreTransaction tx = store.begin()) {
            tx.put("r", b("b"), b("2"));
        }
        assertNull(store.get("r", b("a")));
        assertNull(store.get("r", b("b")));
    }

    @Test
    void deleteInsideTransactionHidesCommittedValue() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.createRegion("r");
        try (StoreTransaction tx = store.begin()) {
            tx.put("r", b("k"), b("v"));
            tx.commit();
        }

        try (StoreTransaction tx = store.begin()) {
            tx.delete("r", b("k"));
            assertNull(tx.get("r", b("k")));
            assertNotNull(store.get("r", b("k")));
            tx.commit();
        }
        assertNull(store.get("r", b("k")));
    }

    @Test
    void forEachVisitsInKeyOrder() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.createRegion("r");
        try (StoreTransaction tx = store.begin()) {
            tx.put("r", new byte[] {(byte) 0xff}, b("high"));
            tx.put("r", new byte[] {0x01}, b("low"));
            tx.commit();
        }

        List<String> seen = new ArrayList<>();
        store.forEach("r", (k, v) -> seen.add(new String(v)));
        assertEquals(List.of("low", "high"), seen);
    }

    @Test
    void unknownRegionFails() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        assertThrows(StoreException.class, () -> store.get("missing", b("k")));
        try (StoreTransaction tx = store.begin()) {
            assertThrows(StoreException.class, () -> tx.put("missing", b("k"), b("v")));
        }
    }

    @Test
    void finishedTransactionRejectsWrites() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.createRegion("r");
        StoreTransaction tx = store.begin();
        tx.commit();
        assertThrows(StoreException.class, () -> tx.put("r", b("k"), b("v")));
        tx.close();
    }
}
