package io.ledger.core.storage;

/** Compensating action that reverts a participant's in-memory effects. */
@FunctionalInterface
public interface Rollback {

    void rollback();
}
