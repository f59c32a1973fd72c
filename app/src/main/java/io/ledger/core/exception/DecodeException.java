package io.ledger.core.exception;

/** Stored or received bytes could not be decoded into a record. */
public class DecodeException extends LedgerException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
