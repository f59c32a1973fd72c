package io.ledger.core.node;

import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.BlockHeader;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.unspent.UnspentGetter;

import java.util.List;
import java.util.Optional;

/**
 * Builds the child block of the current head. The header's uxHash is the pool
 * checksum before the block's outputs are applied.
 */
public final class BlockAssembler {
    private BlockAssembler() {}

    public static Block next(Optional<BlockHeader> head, UnspentGetter pool, List<Transaction> txs, long time) {
        long seq = head.map(h -> h.seq() + 1).orElse(0L);
        Hash prev = head.map(BlockHeader::hash).orElse(Hash.ZERO);
        long blockTime = head.map(h -> Math.max(time, h.time())).orElse(time);

        BlockHeader hdr = new BlockHeader(
                BlockHeader.VERSION,
                blockTime,
                seq,
                prev,
                Block.computeBodyHash(txs),
                pool.getUxHash()
        );
        return new Block(hdr, txs);
    }
}
