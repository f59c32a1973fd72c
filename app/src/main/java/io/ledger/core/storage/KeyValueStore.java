package io.ledger.core.storage;

/**
 * Transactional key-value store split into named regions (column families).
 *
 * Notes:
 * - Regions must be created once before they are read or written.
 * - Reads outside a transaction see committed state only.
 * - All writes go through a {@link StoreTransaction}; see {@link StoreUpdate}
 *   for the usual open / run participants / commit sequence.
 */
public interface KeyValueStore extends AutoCloseable {

    /** Open the region, creating it if missing. Idempotent. */
    void createRegion(String region);

    /** Committed value for a key, or null. */
    byte[] get(String region, byte[] key);

    /** Visit every committed entry of a region in key order. */
    void forEach(String region, EntryVisitor visitor);

    /** Begin a transaction. The caller owns it and must commit or roll back. */
    StoreTransaction begin();

    @Override
    void close();

    @FunctionalInterface
    interface EntryVisitor {
        void visit(byte[] key, byte[] value);
    }
}
