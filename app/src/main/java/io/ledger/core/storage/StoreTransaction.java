package io.ledger.core.storage;

/**
 * A unit of atomic work against a {@link KeyValueStore}. Reads observe the
 * transaction's own uncommitted writes.
 */
public interface StoreTransaction extends AutoCloseable {

    byte[] get(String region, byte[] key);

    void put(String region, byte[] key, byte[] value);

    void delete(String region, byte[] key);

    void commit();

    void rollback();

    /** Release resources. Rolls back if neither commit nor rollback happened. */
    @Override
    void close();
}
