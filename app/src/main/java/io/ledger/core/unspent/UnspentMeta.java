package io.ledger.core.unspent;

import io.ledger.core.exception.DecodeException;
import io.ledger.core.protocol.Hash;
import io.ledger.core.storage.StoreTransaction;

import java.nio.charset.StandardCharsets;

/** Meta region holding the aggregate checksum as raw 32 bytes under "xorhash". */
final class UnspentMeta {
    static final String NAME = "unspent_meta";
    static final byte[] XOR_HASH_KEY = "xorhash".getBytes(StandardCharsets.US_ASCII);

    private final StoreTransaction tx;

    UnspentMeta(StoreTransaction tx) {
        this.tx = tx;
    }

    Hash getXorHash() {
        return decode(tx.get(NAME, XOR_HASH_KEY));
    }

    void setXorHash(Hash hash) {
        tx.put(NAME, XOR_HASH_KEY, hash.bytes());
    }

    /** Absent value means an empty pool, so zero. */
    static Hash decode(byte[] v) {
        if (v == null) return Hash.ZERO;
        if (v.length != Hash.LENGTH) {
            throw new DecodeException("stored xorhash has " + v.length + " bytes, expected " + Hash.LENGTH);
        }
        return new Hash(v);
    }
}
