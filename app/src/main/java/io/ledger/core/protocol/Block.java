package io.ledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Block = header + ordered list of transactions.
 * Body encoding: header bytes first, then N, then each tx length-prefixed.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;

    public Block(BlockHeader header, List<Transaction> txs) {
        this.header = header;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        basicValidate();
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public Hash hash() { return header.hash(); }
    public long seq() { return header.seq(); }

    /**
     * Materializes the outputs a transaction of this block creates. Each output's
     * head carries this block's time and sequence.
     */
    public List<UxOut> createUnspents(Transaction tx) {
        List<UxOut> out = new ArrayList<>(tx.outputs().size());
        Hash src = tx.hash();
        for (TransactionOutput o : tx.outputs()) {
            out.add(new UxOut(header.time(), header.seq(), src, o.address(), o.coins(), o.hours()));
        }
        return out;
    }

    public byte[] serialize() {
        int size = BlockHeader.SIZE + 4;
        List<byte[]> encoded = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            byte[] b = tx.serialize();
            encoded.add(b);
            size += 4 + b.length;
        }

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.put(header.serialize());
        buf.putInt(encoded.size());
        for (byte[] b : encoded) {
            buf.putInt(b.length);
            buf.put(b);
        }
        return Codecs.toArray(buf);
    }

    /** Merkle root over the transaction hashes. */
    public Hash computeBodyHash() {
        return computeBodyHash(transactions);
    }

    public static Hash computeBodyHash(List<Transaction> txs) {
        List<Hash> leaves = new ArrayList<>(txs.size());
        for (Transaction tx : txs) leaves.add(tx.hash());
        return Merkle.rootOf(leaves);
    }

    public void basicValidate() {
        if (header == null) throw new IllegalArgumentException("missing header");
        if (transactions.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
    }

    @Override public String toString() {
        return "Block{seq=" + header.seq() + ", txs=" + transactions.size() + "}";
    }
}
