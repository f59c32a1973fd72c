package io.ledger.core.exception;

/**
 * Base type for failures raised by the unspent ledger. Unchecked: callers either
 * abort the enclosing store transaction or report the failure upward.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
