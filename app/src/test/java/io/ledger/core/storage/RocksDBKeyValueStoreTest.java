package io.ledger.core.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBKeyValueStoreTest {

    @TempDir
    Path tempDir;

    private static byte[] b(String s) {
        return s.getBytes();
    }

    @Test
    void committedDataSurvivesReopen() {
        String dir = tempDir.resolve("db").toString();
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(dir, false)) {
            store.createRegion("outputs");
            store.createRegion("meta");
            try (StoreTransaction tx = store.begin()) {
                tx.put("outputs", b("k1"), b("v1"));
                tx.put("meta", b("head"), b("h"));
                tx.commit();
            }
        }

        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(dir, false)) {
            // regions are rediscovered from disk; createRegion is then a no-op
            store.createRegion("outputs");
            assertArrayEquals(b("v1"), store.get("outputs", b("k1")));
            assertArrayEquals(b("h"), store.get("meta", b("head")));
        }
    }

    @Test
    void rolledBackTransactionLeavesNoTrace() {
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(tempDir.toString(), false)) {
            store.createRegion("r");
            try (StoreTransaction tx = store.begin()) {
                tx.put("r", b("k"), b("v"));
                assertArrayEquals(b("v"), tx.get("r", b("k")));
                tx.rollback();
            }
            assertNull(store.get("r", b("k")));

            AtomicInteger count = new AtomicInteger();
            store.forEach("r", (k, v) -> count.incrementAndGet());
            assertEquals(0, count.get());
        }
    }

    @Test
    void deleteWithinTransaction() {
        try (RocksDBKeyValueStore store = RocksDBKeyValueStore.open(tempDir.toString(), false)) {
            store.createRegion("r");
            try (StoreTransaction tx = store.begin()) {
                tx.put("r", b("k"), b("v"));
                tx.commit();
            }
            try (StoreTransaction tx = store.begin()) {
                tx.delete("r", b("k"));
                assertNull(tx.get("r", b("k")));
                tx.commit();
            }
            assertNull(store.get("r", b("k")));
        }
    }
}
