package io.ledger.core.unspent;

import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.UxOut;
import io.ledger.core.protocol.UxOutCodec;
import io.ledger.core.storage.StoreTransaction;

/** Output region seen through one store transaction: id(32) -> UxOut bytes. */
final class OutputRegion {
    static final String NAME = "unspent_pool";

    private final StoreTransaction tx;

    OutputRegion(StoreTransaction tx) {
        this.tx = tx;
    }

    /** Stored record, or null when absent. */
    UxOut get(Hash id) {
        byte[] v = tx.get(NAME, id.bytes());
        return v == null ? null : UxOutCodec.fromBytes(v);
    }

    boolean contains(Hash id) {
        return tx.get(NAME, id.bytes()) != null;
    }

    void put(UxOut ux) {
        tx.put(NAME, ux.hash().bytes(), UxOutCodec.toBytes(ux));
    }

    void delete(Hash id) {
        tx.delete(NAME, id.bytes());
    }
}
