package io.ledger.core.storage;

import io.ledger.core.exception.StoreException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Simple, fast in-memory store. Good for tests and throwaway nodes.
 *
 * Transactions buffer their writes (deletes as tombstones) and publish them to
 * the committed maps in one step under the store monitor. Not persistent.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private static final byte[] TOMBSTONE = new byte[0];

    /** region -> (key -> value), committed state only */
    private final Map<String, TreeMap<BytesKey, byte[]>> regions = new HashMap<>();
    private boolean closed;

    @Override
    public synchronized void createRegion(String region) {
        ensureOpen();
        regions.computeIfAbsent(region, r -> new TreeMap<>());
    }

    @Override
    public synchronized byte[] get(String region, byte[] key) {
        byte[] v = region(region).get(new BytesKey(key));
        return v == null ? null : v.clone();
    }

    @Override
    public void forEach(String region, EntryVisitor visitor) {
        List<Map.Entry<BytesKey, byte[]>> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(region(region).entrySet());
        }
        for (Map.Entry<BytesKey, byte[]> e : snapshot) {
            visitor.visit(e.getKey().bytes(), e.getValue().clone());
        }
    }

    @Override
    public synchronized StoreTransaction begin() {
        ensureOpen();
        return new MemoryTransaction();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private TreeMap<BytesKey, byte[]> region(String name) {
        ensureOpen();
        TreeMap<BytesKey, byte[]> r = regions.get(name);
        if (r == null) throw new StoreException("Unknown region: " + name);
        return r;
    }

    private void ensureOpen() {
        if (closed) throw new StoreException("Store is closed");
    }

    private synchronized void publish(Map<String, Map<BytesKey, byte[]>> writes) {
        // check every region first so a bad write cannot leave a half-applied commit
        for (String name : writes.keySet()) {
            region(name);
        }
        for (Map.Entry<String, Map<BytesKey, byte[]>> r : writes.entrySet()) {
            TreeMap<BytesKey, byte[]> target = regions.get(r.getKey());
            for (Map.Entry<BytesKey, byte[]> e : r.getValue().entrySet()) {
                if (e.getValue() == TOMBSTONE) {
                    target.remove(e.getKey());
                } else {
                    target.put(e.getKey(), e.getValue());
                }
            }
        }
    }

    private final class MemoryTransaction implements StoreTransaction {
        private final Map<String, Map<BytesKey, byte[]>> writes = new LinkedHashMap<>();
        private boolean finished;

        @Override
        public byte[] get(String region, byte[] key) {
            ensureActive();
            Map<BytesKey, byte[]> pending = writes.get(region);
            if (pending != null) {
                byte[] v = pending.get(new BytesKey(key));
                if (v == TOMBSTONE) return null;
                if (v != null) return v.clone();
            }
            return InMemoryKeyValueStore.this.get(region, key);
        }

        @Override
        public void put(String region, byte[] key, byte[] value) {
            ensureActive();
            if (value == null) throw new IllegalArgumentException("null value");
            pending(region).put(new BytesKey(key), value.clone());
        }

        @Override
        public void delete(String region, byte[] key) {
            ensureActive();
            pending(region).put(new BytesKey(key), TOMBSTONE);
        }

        @Override
        public void commit() {
            ensureActive();
            finished = true;
            publish(writes);
            writes.clear();
        }

        @Override
        public void rollback() {
            finished = true;
            writes.clear();
        }

        @Override
        public void close() {
            if (!finished) rollback();
        }

        private Map<BytesKey, byte[]> pending(String region) {
            synchronized (InMemoryKeyValueStore.this) {
                region(region);
            }
            return writes.computeIfAbsent(region, r -> new HashMap<>());
        }

        private void ensureActive() {
            if (finished) throw new StoreException("Transaction already finished");
        }
    }
}
