package io.ledger.core.node;

import io.ledger.core.chain.BlockIndex;
import io.ledger.core.metrics.LedgerMetrics;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.storage.InMemoryKeyValueStore;
import io.ledger.core.storage.KeyValueStore;
import io.ledger.core.storage.RocksDBKeyValueStore;
import io.ledger.core.storage.StoreUpdate;
import io.ledger.core.unspent.UnspentPool;

import java.util.List;
import java.util.logging.Logger;

/**
 * Wires the store, the unspent pool and the block index.
 *
 * Blocks are executed one at a time: each runs the pool and the index as
 * participants of one store transaction.
 */
public final class LedgerNode implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(LedgerNode.class.getName());

    private final KeyValueStore store;
    private final UnspentPool pool;
    private final BlockIndex index;
    private final LedgerConfig config;

    public LedgerNode(KeyValueStore store, LedgerConfig config) {
        this.store = store;
        this.config = config;
        this.pool = new UnspentPool(store);
        this.index = new BlockIndex(store);
    }

    /** Convenience factory for an in-memory node. */
    public static LedgerNode inMemory(LedgerConfig config) {
        return new LedgerNode(new InMemoryKeyValueStore(), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static LedgerNode rocks(LedgerConfig config) {
        KeyValueStore store = RocksDBKeyValueStore.open(config.dataDir, config.syncWrites);
        try {
            return new LedgerNode(store, config);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    /** Apply the genesis block if the chain is empty. Safe to call multiple times. */
    public synchronized void start() {
        if (index.head().isPresent()) {
            return;
        }
        if (config.genesisAllocations.isEmpty()) {
            LOG.info("No genesis allocations configured; waiting for an externally supplied genesis block");
            return;
        }
        Block genesis = GenesisBuilder.buildGenesis(config);
        executeBlock(genesis);
        LOG.info("Applied genesis block " + genesis.hash().hex() + " with " + pool.len() + " outputs");
    }

    /**
     * Applies a block to the pool and the index in one store transaction.
     * On failure nothing is committed and both in-memory views are reverted.
     */
    public synchronized void executeBlock(Block block) {
        try {
            LedgerMetrics.recordApply(() -> {
                StoreUpdate.update(store, pool.processBlock(block), index.processBlock(block));
                return null;
            });
        } catch (RuntimeException e) {
            LedgerMetrics.blockRejected();
            LOG.warning("Block seq=" + block.seq() + " rejected: " + e.getMessage());
            throw e;
        }
    }

    /** Child block of the current head carrying the given transactions. */
    public synchronized Block nextBlock(List<Transaction> txs, long time) {
        return BlockAssembler.next(index.head(), pool, txs, time);
    }

    /** Store/cache/checksum audit; serialized with block execution. */
    public synchronized boolean verify() {
        return pool.verifyStore();
    }

    public UnspentPool pool() { return pool; }
    public BlockIndex index() { return index; }
    public LedgerConfig config() { return config; }

    @Override
    public void close() {
        store.close();
    }
}
