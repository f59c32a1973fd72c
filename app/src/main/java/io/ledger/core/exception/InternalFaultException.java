package io.ledger.core.exception;

/** Unexpected runtime fault converted into a reportable error. */
public class InternalFaultException extends LedgerException {

    public InternalFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
