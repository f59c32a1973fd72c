package io.ledger.core.unspent;

import io.ledger.core.exception.DecodeException;
import io.ledger.core.exception.InternalFaultException;
import io.ledger.core.exception.LedgerException;
import io.ledger.core.exception.NotFoundException;
import io.ledger.core.exception.DuplicateInsertException;
import io.ledger.core.metrics.LedgerMetrics;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.protocol.UxOut;
import io.ledger.core.protocol.UxOutCodec;
import io.ledger.core.storage.KeyValueStore;
import io.ledger.core.storage.Rollback;
import io.ledger.core.storage.StoreTransaction;
import io.ledger.core.storage.TxHandler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * The unspent output pool.
 *
 * The durable regions (outputs keyed by id, plus the checksum in the meta
 * region) are the source of truth. An {@link UnspentCache} mirrors them and
 * answers every query. Blocks are applied through a caller-owned store
 * transaction: all store writes happen first, then the cache is updated in a
 * single lock hold, and the returned {@link Rollback} reverts the cache if the
 * outer transaction is abandoned later.
 */
public final class UnspentPool implements UnspentGetter {
    private static final Logger LOG = Logger.getLogger(UnspentPool.class.getName());

    private final KeyValueStore store;
    private final UnspentCache cache = new UnspentCache();

    /**
     * Opens both regions and loads the cache from them.
     *
     * @throws DecodeException if a stored record or the checksum cannot be decoded
     * @throws io.ledger.core.exception.StoreException if the store cannot be read
     */
    public UnspentPool(KeyValueStore store) {
        this.store = store;
        store.createRegion(OutputRegion.NAME);
        store.createRegion(UnspentMeta.NAME);
        syncCache();
        LedgerMetrics.trackUnspentSize(this::len);
    }

    private void syncCache() {
        Map<Hash, UxOut> outputs = loadOutputs();
        Hash uxHash = UnspentMeta.decode(store.get(UnspentMeta.NAME, UnspentMeta.XOR_HASH_KEY));
        cache.reset(outputs, uxHash);
        LOG.info("Loaded " + outputs.size() + " unspent outputs, uxhash=" + uxHash.hex());
    }

    private Map<Hash, UxOut> loadOutputs() {
        Map<Hash, UxOut> outputs = new HashMap<>();
        store.forEach(OutputRegion.NAME, (k, v) -> {
            UxOut ux;
            try {
                ux = UxOutCodec.fromBytes(v);
            } catch (DecodeException e) {
                throw new DecodeException("load unspent outputs from db failed", e);
            }
            Hash key = new Hash(k);
            if (!key.equals(ux.hash())) {
                throw new DecodeException("stored unspent output key " + key.hex() + " does not match its content hash");
            }
            outputs.put(key, ux);
        });
        return outputs;
    }

    // -------------- block application ----------------

    /** Participant form of {@link #applyBlock(Block, StoreTransaction)} for {@link io.ledger.core.storage.StoreUpdate}. */
    public TxHandler processBlock(Block block) {
        return tx -> applyBlock(block, tx);
    }

    /**
     * Applies every transaction of the block, in order, to the store through
     * {@code tx} and then to the cache. The transaction is owned by the caller;
     * on failure the caller must discard it, and the cache is untouched.
     *
     * Inputs may only reference outputs that existed before this block: the
     * resolve step reads the cache, which is updated only after the last
     * transaction of the block was written.
     *
     * @return action restoring the cache to its state before this call
     * @throws NotFoundException if an input is not in the pool
     * @throws DuplicateInsertException if a created output id already exists
     */
    public Rollback applyBlock(Block block, StoreTransaction tx) {
        OutputRegion outputs = new OutputRegion(tx);
        UnspentMeta meta = new UnspentMeta(tx);

        List<UxOut> delUxs = new ArrayList<>();
        List<UxOut> addUxs = new ArrayList<>();
        Hash oldUxHash = cache.uxHash();
        Hash uxHash = meta.getXorHash();

        for (Transaction txn : block.transactions()) {
            // uxouts that need to be deleted
            List<UxOut> uxs = cache.getArray(txn.inputs());
            delUxs.addAll(uxs);

            // remove spent outputs
            uxHash = deleteWithTx(outputs, meta, txn.inputs(), uxHash);

            // create new outputs
            List<UxOut> txUxs = addWithTx(outputs, meta, block, txn);
            addUxs.addAll(txUxs);
            if (!txUxs.isEmpty()) {
                uxHash = meta.getXorHash();
            }
        }

        cache.apply(delUxs, addUxs, uxHash);
        LedgerMetrics.blockApplied(delUxs.size(), addUxs.size());
        LOG.fine("Applied block seq=" + block.seq() + ": spent " + delUxs.size()
                + ", created " + addUxs.size() + ", uxhash=" + uxHash.hex());

        return () -> {
            // reverse the cache
            cache.apply(addUxs, delUxs, oldUxHash);
            LedgerMetrics.blockUndone();
            LOG.warning("Reverted unspent cache for block seq=" + block.seq());
        };
    }

    /**
     * Deletes the inputs one by one, folding each snapshot hash out of the stored
     * checksum after every deletion. An input missing from the output region is a
     * hard failure, which also rejects a block spending the same output twice.
     * Unexpected runtime faults are reported as {@link InternalFaultException}.
     */
    private Hash deleteWithTx(OutputRegion outputs, UnspentMeta meta, List<Hash> ids, Hash current) {
        Hash uxHash = current;
        for (Hash id : ids) {
            try {
                UxOut ux = outputs.get(id);
                if (ux == null) {
                    throw new NotFoundException(id, "unspent output " + id.hex() + " is not in the output region");
                }

                uxHash = meta.getXorHash().xor(ux.snapshotHash());
                meta.setXorHash(uxHash);
                outputs.delete(id);
            } catch (LedgerException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new InternalFaultException("unspent pool delete uxout " + id.hex() + " failed: " + e, e);
            }
        }
        return uxHash;
    }

    /**
     * Materializes and inserts the outputs of one transaction, folding each
     * snapshot hash into the stored checksum. Unexpected runtime faults are
     * reported as {@link InternalFaultException} so the caller can discard the
     * store transaction.
     */
    private List<UxOut> addWithTx(OutputRegion outputs, UnspentMeta meta, Block block, Transaction txn) {
        try {
            List<UxOut> txUxs = block.createUnspents(txn);
            for (UxOut ux : txUxs) {
                Hash h = ux.hash();
                if (cache.contains(h) || outputs.contains(h)) {
                    throw new DuplicateInsertException(h);
                }

                Hash xorhash = meta.getXorHash().xor(ux.snapshotHash());
                meta.setXorHash(xorhash);
                outputs.put(ux);
            }
            return txUxs;
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InternalFaultException("unspent pool add uxout failed for tx " + txn.hash().hex() + ": " + e, e);
        }
    }

    // -------------- queries ----------------

    @Override
    public Optional<UxOut> get(Hash id) {
        return cache.get(id);
    }

    @Override
    public List<UxOut> getArray(List<Hash> ids) {
        return cache.getArray(ids);
    }

    @Override
    public List<UxOut> getAll() {
        return cache.getAll();
    }

    @Override
    public int len() {
        return cache.size();
    }

    @Override
    public boolean contains(Hash id) {
        return cache.contains(id);
    }

    @Override
    public boolean collides(Collection<Hash> ids) {
        return cache.collides(ids);
    }

    @Override
    public List<UxOut> getUnspentsOfAddr(String address) {
        return cache.forAddress(address);
    }

    @Override
    public Map<String, List<UxOut>> getUnspentsOfAddrs(Collection<String> addresses) {
        return cache.forAddresses(addresses);
    }

    /**
     * Checksum of the pool. Read it after the block is assembled and before its
     * outputs are applied to get the value that goes into the block header.
     */
    @Override
    public Hash getUxHash() {
        return cache.uxHash();
    }

    // -------------- audits ----------------

    /** XOR of the snapshot hashes of every cached output. */
    public Hash recomputeUxHash() {
        return cache.recompute();
    }

    /**
     * Rescans the durable regions and compares them with the cache and with the
     * recomputed checksum. Must not run while a block is being applied.
     */
    public boolean verifyStore() {
        Map<Hash, UxOut> stored = loadOutputs();
        Hash storedHash = UnspentMeta.decode(store.get(UnspentMeta.NAME, UnspentMeta.XOR_HASH_KEY));

        boolean ok = true;
        List<UxOut> cached = cache.getAll();
        if (cached.size() != stored.size()) {
            LOG.warning("Cache holds " + cached.size() + " outputs, store holds " + stored.size());
            ok = false;
        }
        for (UxOut ux : cached) {
            if (!ux.equals(stored.get(ux.hash()))) {
                LOG.warning("Cached output " + ux.hash().hex() + " differs from the store");
                ok = false;
            }
        }
        if (!storedHash.equals(cache.uxHash())) {
            LOG.warning("Stored uxhash " + storedHash.hex() + " != cached " + cache.uxHash().hex());
            ok = false;
        }
        Hash recomputed = cache.recompute();
        if (!recomputed.equals(cache.uxHash())) {
            LOG.warning("Recomputed uxhash " + recomputed.hex() + " != cached " + cache.uxHash().hex());
            ok = false;
        }
        return ok;
    }
}
