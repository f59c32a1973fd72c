package io.ledger.core.protocol;

import io.ledger.core.exception.DecodeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionRoundTripTest {

    @Test
    void roundTrip() {
        Transaction tx = Transaction.builder()
                .input(Hash.of("a".getBytes()))
                .input(Hash.of("b".getBytes()))
                .output("alice123456", 123, 4)
                .output("bob654321", 77, 0)
                .build();

        Transaction tx2 = TransactionCodec.fromBytes(tx.serialize());

        assertEquals(tx.inputs(), tx2.inputs());
        assertEquals(tx.outputs(), tx2.outputs());
        // hash should be stable
        assertEquals(tx.hash(), tx2.hash());
    }

    @Test
    void blockRoundTripKeepsHeaderAndOrder() {
        Transaction t1 = Transaction.builder().output("alice123456", 10, 1).build();
        Transaction t2 = Transaction.builder().input(Hash.of("x".getBytes())).output("bob654321", 5, 0).build();
        List<Transaction> txs = List.of(t1, t2);
        BlockHeader hdr = new BlockHeader(BlockHeader.VERSION, 1_000, 3, Hash.of("p".getBytes()),
                Block.computeBodyHash(txs), Hash.of("u".getBytes()));
        Block block = new Block(hdr, txs);

        Block back = BlockCodec.fromBytes(block.serialize());

        assertEquals(block.hash(), back.hash());
        assertEquals(3, back.seq());
        assertEquals(t1.hash(), back.transactions().get(0).hash());
        assertEquals(t2.hash(), back.transactions().get(1).hash());
        assertEquals(hdr.uxHash(), back.header().uxHash());
    }

    @Test
    void createUnspentsCopiesBlockHead() {
        Transaction tx = Transaction.builder()
                .output("alice123456", 10, 1)
                .output("bob654321", 20, 2)
                .build();
        List<Transaction> txs = List.of(tx);
        Block block = new Block(new BlockHeader(BlockHeader.VERSION, 5_000, 9, Hash.ZERO,
                Block.computeBodyHash(txs), Hash.ZERO), txs);

        List<UxOut> uxs = block.createUnspents(tx);

        assertEquals(2, uxs.size());
        for (UxOut ux : uxs) {
            assertEquals(5_000, ux.time());
            assertEquals(9, ux.bkSeq());
            assertEquals(tx.hash(), ux.srcTransaction());
        }
        assertNotEquals(uxs.get(0).hash(), uxs.get(1).hash());
    }

    @Test
    void malformedBlockBytesRejected() {
        assertThrows(DecodeException.class, () -> BlockCodec.fromBytes(new byte[] {0, 0, 0, 1, 2}));
    }
}
