package io.ledger.core.storage;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs several {@link TxHandler}s inside one store transaction.
 *
 * All handlers succeed and the transaction commits, or the rollbacks of the
 * handlers that already ran are invoked newest-first, the store transaction is
 * rolled back and the original failure is rethrown.
 */
public final class StoreUpdate {
    private static final Logger LOG = Logger.getLogger(StoreUpdate.class.getName());

    private StoreUpdate() {}

    public static void update(KeyValueStore store, TxHandler... handlers) {
        update(store, Arrays.asList(handlers));
    }

    public static void update(KeyValueStore store, List<TxHandler> handlers) {
        Deque<Rollback> done = new ArrayDeque<>(handlers.size());
        try (StoreTransaction tx = store.begin()) {
            try {
                for (TxHandler handler : handlers) {
                    done.push(handler.handle(tx));
                }
                tx.commit();
            } catch (RuntimeException e) {
                unwind(done, e);
                try {
                    tx.rollback();
                } catch (RuntimeException rollbackEx) {
                    e.addSuppressed(rollbackEx);
                }
                throw e;
            }
        }
    }

    private static void unwind(Deque<Rollback> done, RuntimeException cause) {
        if (!done.isEmpty()) {
            LOG.warning("Store update failed, reverting " + done.size() + " participant(s): " + cause.getMessage());
        }
        while (!done.isEmpty()) {
            Rollback rb = done.pop();
            try {
                rb.rollback();
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "Participant rollback failed", e);
                cause.addSuppressed(e);
            }
        }
    }
}
