package io.ledger.core.exception;

import io.ledger.core.protocol.Hash;

/** A requested unspent output does not exist. */
public class NotFoundException extends LedgerException {
    private final Hash id;

    public NotFoundException(Hash id) {
        this(id, "unspent output of " + id.hex() + " does not exist");
    }

    public NotFoundException(Hash id, String message) {
        super(message);
        this.id = id;
    }

    public Hash id() {
        return id;
    }
}
