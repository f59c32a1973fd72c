package io.ledger.core.exception;

import io.ledger.core.protocol.Hash;

/** An output with the same id is already present in the pool. */
public class DuplicateInsertException extends LedgerException {
    private final Hash id;

    public DuplicateInsertException(Hash id) {
        super("attempt to insert unspent output " + id.hex() + " twice into the unspent pool");
        this.id = id;
    }

    public Hash id() {
        return id;
    }
}
