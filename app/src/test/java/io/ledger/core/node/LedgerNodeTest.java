package io.ledger.core.node;

import io.ledger.core.exception.NotFoundException;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.BlockHeader;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.protocol.UxOut;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LedgerNodeTest {

    @Test
    void startAppliesGenesisOnce() {
        try (LedgerNode node = LedgerNode.inMemory(LedgerConfig.defaultLocal())) {
            node.start();
            node.start();

            assertEquals(2, node.pool().len());
            assertEquals(0L, node.index().head().orElseThrow().seq());
            UxOut alice = node.pool().getUnspentsOfAddr("alice123456").get(0);
            assertEquals(1_000_000L, alice.coins());
            assertEquals(1_000L, alice.hours());
            assertEquals(1_426_562_704L, alice.time());
            assertTrue(node.verify());
        }
    }

    @Test
    void nextBlockSpendsAndCarriesChecksum() {
        try (LedgerNode node = LedgerNode.inMemory(LedgerConfig.defaultLocal())) {
            node.start();
            UxOut alice = node.pool().getUnspentsOfAddr("alice123456").get(0);
            Hash before = node.pool().getUxHash();

            Transaction pay = Transaction.builder()
                    .input(alice.hash())
                    .output("carol777777", 400_000, 0)
                    .output("alice123456", 600_000, 0)
                    .build();
            Block block = node.nextBlock(List.of(pay), 1_500_000_000L);
            assertEquals(1L, block.seq());
            assertEquals(before, block.header().uxHash());

            node.executeBlock(block);

            assertEquals(3, node.pool().len());
            assertFalse(node.pool().contains(alice.hash()));
            assertEquals(block.hash(), node.index().head().orElseThrow().hash());
            assertEquals(node.pool().recomputeUxHash(), node.pool().getUxHash());
            assertTrue(node.verify());
        }
    }

    @Test
    void rejectedBlockLeavesPoolAndHeadUntouched() {
        try (LedgerNode node = LedgerNode.inMemory(LedgerConfig.defaultLocal())) {
            node.start();
            UxOut alice = node.pool().getUnspentsOfAddr("alice123456").get(0);
            List<UxOut> before = node.pool().getAll();
            Hash beforeHash = node.pool().getUxHash();
            BlockHeader head = node.index().head().orElseThrow();

            // the pool accepts this spend but the index refuses the stale link
            List<Transaction> txs = List.of(Transaction.builder()
                    .input(alice.hash())
                    .output("carol777777", 1, 0)
                    .build());
            Block orphan = new Block(new BlockHeader(BlockHeader.VERSION, 2_000_000_000L, 1L,
                    Hash.of("not-the-head".getBytes()), Block.computeBodyHash(txs), beforeHash), txs);

            assertThrows(IllegalArgumentException.class, () -> node.executeBlock(orphan));

            assertEquals(new HashSet<>(before), new HashSet<>(node.pool().getAll()));
            assertEquals(beforeHash, node.pool().getUxHash());
            assertEquals(head.hash(), node.index().head().orElseThrow().hash());
            assertTrue(node.verify());
        }
    }

    @Test
    void spendingUnknownOutputIsRejected() {
        try (LedgerNode node = LedgerNode.inMemory(LedgerConfig.defaultLocal())) {
            node.start();
            Block bad = node.nextBlock(List.of(Transaction.builder()
                    .input(Hash.of("nothing".getBytes()))
                    .output("carol777777", 1, 0)
                    .build()), 1_500_000_000L);

            assertThrows(NotFoundException.class, () -> node.executeBlock(bad));
            assertEquals(0L, node.index().head().orElseThrow().seq());
            assertEquals(2, node.pool().len());
        }
    }

    @Test
    void emptyAllocationsSkipGenesis() {
        LedgerConfig config = new LedgerConfig("unused", false, 0L, 0L, Map.of());
        try (LedgerNode node = LedgerNode.inMemory(config)) {
            node.start();
            assertTrue(node.index().head().isEmpty());
            assertEquals(0, node.pool().len());
            assertEquals(Hash.ZERO, node.pool().getUxHash());
        }
    }

    @Test
    void restartReloadsPoolFromRocksDb(@TempDir Path dir) {
        LedgerConfig config = LedgerConfig.defaultLocal().withDataDir(dir.resolve("ledger").toString());
        Hash uxHash;
        Hash headHash;
        List<UxOut> outputs;

        try (LedgerNode node = LedgerNode.rocks(config)) {
            node.start();
            UxOut bob = node.pool().getUnspentsOfAddr("bob654321").get(0);
            node.executeBlock(node.nextBlock(List.of(Transaction.builder()
                    .input(bob.hash())
                    .output("dave8888888", 500_000, 10)
                    .build()), 1_500_000_000L));
            uxHash = node.pool().getUxHash();
            headHash = node.index().head().orElseThrow().hash();
            outputs = node.pool().getAll();
        }

        try (LedgerNode node = LedgerNode.rocks(config)) {
            node.start();
            assertEquals(uxHash, node.pool().getUxHash());
            assertEquals(headHash, node.index().head().orElseThrow().hash());
            assertEquals(new HashSet<>(outputs), new HashSet<>(node.pool().getAll()));
            assertTrue(node.verify());
        }
    }
}
