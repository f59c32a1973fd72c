package io.ledger.core.storage;

/**
 * One participant of an outer store transaction. Writes through the given
 * transaction, then applies its in-memory effects and returns the action that
 * undoes them if a later participant or the commit fails.
 */
@FunctionalInterface
public interface TxHandler {

    Rollback handle(StoreTransaction tx);
}
