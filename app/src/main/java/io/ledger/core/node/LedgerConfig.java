package io.ledger.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/** Simple config holder for a ledger node. */
public final class LedgerConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    public final String dataDir;
    public final boolean syncWrites;
    public final long genesisTime;
    public final long genesisHours;
    /** address -> coins, sorted so the genesis block is deterministic */
    public final Map<String, Long> genesisAllocations;

    public LedgerConfig(String dataDir, boolean syncWrites, long genesisTime, long genesisHours,
                        Map<String, Long> genesisAllocations) {
        this.dataDir = dataDir;
        this.syncWrites = syncWrites;
        this.genesisTime = genesisTime;
        this.genesisHours = genesisHours;
        this.genesisAllocations = genesisAllocations == null
                ? new TreeMap<>()
                : new TreeMap<>(genesisAllocations);
    }

    public static LedgerConfig defaultLocal() {
        Map<String, Long> alloc = new TreeMap<>();
        alloc.put("alice123456", 1_000_000L);
        alloc.put("bob654321",     500_000L);
        return new LedgerConfig(
                "./data/ledger",
                true,           // fsync every commit
                1_426_562_704L, // fixed genesis time keeps the genesis hash stable
                1_000L,
                alloc
        );
    }

    /**
     * Reads a JSON config file. Missing keys keep the {@link #defaultLocal()} values:
     * <pre>
     * { "dataDir": "...", "syncWrites": true, "genesisTime": 0, "genesisHours": 0,
     *   "genesisAllocations": { "address": coins } }
     * </pre>
     */
    public static LedgerConfig load(Path file) {
        LedgerConfig d = defaultLocal();
        JsonNode root;
        try {
            root = JSON.readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ledger config from " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Ledger config " + file + " must be a JSON object");
        }

        Map<String, Long> alloc = d.genesisAllocations;
        JsonNode allocNode = root.get("genesisAllocations");
        if (allocNode != null) {
            alloc = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = allocNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().canConvertToLong() || e.getValue().asLong() < 0) {
                    throw new IllegalStateException("Invalid allocation for " + e.getKey() + ": " + e.getValue());
                }
                alloc.put(e.getKey(), e.getValue().asLong());
            }
        }

        return new LedgerConfig(
                root.path("dataDir").asText(d.dataDir),
                root.path("syncWrites").asBoolean(d.syncWrites),
                root.path("genesisTime").asLong(d.genesisTime),
                root.path("genesisHours").asLong(d.genesisHours),
                alloc
        );
    }

    public LedgerConfig withDataDir(String dataDir) {
        return new LedgerConfig(dataDir, syncWrites, genesisTime, genesisHours, genesisAllocations);
    }
}
