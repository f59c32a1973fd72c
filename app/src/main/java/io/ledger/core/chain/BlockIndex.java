package io.ledger.core.chain;

import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.BlockCodec;
import io.ledger.core.protocol.BlockHeader;
import io.ledger.core.protocol.Hash;
import io.ledger.core.storage.KeyValueStore;
import io.ledger.core.storage.Rollback;
import io.ledger.core.storage.StoreTransaction;
import io.ledger.core.storage.TxHandler;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Persists applied blocks and tracks the chain head.
 *
 * Layout (regions):
 *  - "blocks"     : key = blockHash(32), val = block.serialize()
 *  - "block_seqs" : key = seq(8, big-endian), val = blockHash(32)
 *  - "chain_meta" : key = "head", val = blockHash(32)
 *
 * Runs as a participant of the same store transaction as the unspent pool; a
 * block that does not extend the current head fails here and the whole outer
 * transaction is abandoned.
 */
public final class BlockIndex {
    private static final Logger LOG = Logger.getLogger(BlockIndex.class.getName());

    static final String BLOCKS = "blocks";
    static final String SEQS = "block_seqs";
    static final String META = "chain_meta";
    static final byte[] HEAD_KEY = "head".getBytes(StandardCharsets.US_ASCII);

    private final KeyValueStore store;
    private BlockHeader head; // null until the first block

    public BlockIndex(KeyValueStore store) {
        this.store = store;
        store.createRegion(BLOCKS);
        store.createRegion(SEQS);
        store.createRegion(META);

        byte[] headHash = store.get(META, HEAD_KEY);
        if (headHash != null) {
            Hash h = new Hash(headHash);
            this.head = getBlock(h)
                    .orElseThrow(() -> new IllegalStateException("Head block " + h.hex() + " missing from store"))
                    .header();
            LOG.info("Chain head seq=" + head.seq() + " hash=" + h.hex());
        }
    }

    public synchronized Optional<BlockHeader> head() {
        return Optional.ofNullable(head);
    }

    public Optional<Block> getBlock(Hash hash) {
        byte[] body = store.get(BLOCKS, hash.bytes());
        return body == null ? Optional.empty() : Optional.of(BlockCodec.fromBytes(body));
    }

    public Optional<Block> getBlockBySeq(long seq) {
        byte[] hash = store.get(SEQS, seqKey(seq));
        return hash == null ? Optional.empty() : getBlock(new Hash(hash));
    }

    public TxHandler processBlock(Block block) {
        return tx -> addBlock(block, tx);
    }

    Rollback addBlock(Block block, StoreTransaction tx) {
        BlockHeader prev = head().orElse(null);
        BlockHeader hdr = block.header();
        verifyLink(prev, hdr);
        if (!hdr.bodyHash().equals(block.computeBodyHash())) {
            throw new IllegalArgumentException("Body hash mismatch for block seq=" + hdr.seq());
        }

        Hash hash = hdr.hash();
        tx.put(BLOCKS, hash.bytes(), block.serialize());
        tx.put(SEQS, seqKey(hdr.seq()), hash.bytes());
        tx.put(META, HEAD_KEY, hash.bytes());

        synchronized (this) {
            head = hdr;
        }
        return () -> {
            synchronized (BlockIndex.this) {
                head = prev;
            }
        };
    }

    private static void verifyLink(BlockHeader prev, BlockHeader hdr) {
        long expectedSeq = prev == null ? 0L : prev.seq() + 1;
        Hash expectedPrev = prev == null ? Hash.ZERO : prev.hash();
        if (hdr.seq() != expectedSeq) {
            throw new IllegalArgumentException("Bad block seq: expected " + expectedSeq + ", got " + hdr.seq());
        }
        if (!hdr.prevHash().equals(expectedPrev)) {
            throw new IllegalArgumentException("Block seq=" + hdr.seq() + " does not extend the current head");
        }
    }

    private static byte[] seqKey(long seq) {
        return ByteBuffer.allocate(8).putLong(seq).array();
    }
}
