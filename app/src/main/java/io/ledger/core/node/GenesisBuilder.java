package io.ledger.core.node;

import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.BlockHeader;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;

import java.util.List;
import java.util.Map;

/**
 * Creates the genesis block.
 * - seq = 0, prevHash = zero, uxHash = zero (empty pool)
 * - a single transaction without inputs paying every configured allocation
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static Block buildGenesis(LedgerConfig config) {
        Transaction.Builder tx = Transaction.builder();
        for (Map.Entry<String, Long> e : config.genesisAllocations.entrySet()) {
            tx.output(e.getKey(), e.getValue() == null ? 0L : e.getValue(), config.genesisHours);
        }
        List<Transaction> txs = List.of(tx.build());
        BlockHeader hdr = new BlockHeader(
                BlockHeader.VERSION,
                config.genesisTime,
                0L,
                Hash.ZERO,
                Block.computeBodyHash(txs),
                Hash.ZERO
        );
        return new Block(hdr, txs);
    }
}
