package io.ledger.core.node;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LedgerConfigTest {

    @Test
    void loadsFileAndKeepsDefaultsForMissingKeys() throws URISyntaxException {
        Path file = Path.of(getClass().getResource("/ledger-test.json").toURI());
        LedgerConfig config = LedgerConfig.load(file);

        assertEquals("./data/test-ledger", config.dataDir);
        assertFalse(config.syncWrites);
        assertEquals(1_600_000_000L, config.genesisTime);
        assertEquals(LedgerConfig.defaultLocal().genesisHours, config.genesisHours);
        assertEquals(2, config.genesisAllocations.size());
        assertEquals(42L, config.genesisAllocations.get("erin0000000"));
    }

    @Test
    void rejectsNegativeAllocation(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"genesisAllocations\": {\"alice123456\": -5}}");
        assertThrows(IllegalStateException.class, () -> LedgerConfig.load(file));
    }

    @Test
    void rejectsNonObjectRoot(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("list.json");
        Files.writeString(file, "[1, 2]");
        assertThrows(IllegalStateException.class, () -> LedgerConfig.load(file));
    }

    @Test
    void withDataDirKeepsEverythingElse() {
        LedgerConfig base = LedgerConfig.defaultLocal();
        LedgerConfig moved = base.withDataDir("/tmp/elsewhere");
        assertEquals("/tmp/elsewhere", moved.dataDir);
        assertEquals(base.genesisAllocations, moved.genesisAllocations);
        assertEquals(base.genesisTime, moved.genesisTime);
    }
}
