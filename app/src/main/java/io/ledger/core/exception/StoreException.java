package io.ledger.core.exception;

/** A durable store read, write, commit or open failed. */
public class StoreException extends LedgerException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
