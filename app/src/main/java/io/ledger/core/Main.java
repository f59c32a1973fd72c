package io.ledger.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledger.core.metrics.LedgerMetrics;
import io.ledger.core.node.LedgerConfig;
import io.ledger.core.node.LedgerNode;
import io.ledger.core.protocol.UxOut;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    static final int EXIT_VERIFY_FAILED = 2;

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        int exit = run(options);
        if (exit != 0) {
            System.exit(exit);
        }
    }

    static int run(CliOptions options) throws Exception {
        LedgerConfig config = loadConfig(options);
        LOG.info("Opening ledger at " + config.dataDir);

        try (LedgerNode node = LedgerNode.rocks(config)) {
            node.start();

            ObjectNode report = summary(node);
            if (options.listAll()) {
                report.set("outputs", toJson(node.pool().getAll()));
            }
            if (!options.addresses().isEmpty()) {
                ObjectNode byAddr = report.putObject("addresses");
                Map<String, List<UxOut>> found = node.pool().getUnspentsOfAddrs(options.addresses());
                for (String address : options.addresses()) {
                    byAddr.set(address, toJson(found.getOrDefault(address, List.of())));
                }
            }

            boolean consistent = true;
            if (options.verify()) {
                consistent = node.verify();
                report.put("consistent", consistent);
            }

            System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            if (options.metrics()) {
                System.out.println(LedgerMetrics.scrapeMetrics());
            }
            return consistent ? 0 : EXIT_VERIFY_FAILED;
        }
    }

    private static LedgerConfig loadConfig(CliOptions options) {
        LedgerConfig config;
        if (options.configFile() != null) {
            if (!Files.exists(options.configFile())) {
                throw new IllegalStateException("Config file not found: " + options.configFile());
            }
            config = LedgerConfig.load(options.configFile());
        } else {
            config = LedgerConfig.defaultLocal();
        }
        if (options.dataDir() != null) {
            config = config.withDataDir(options.dataDir().toAbsolutePath().normalize().toString());
        }
        return config;
    }

    static ObjectNode summary(LedgerNode node) {
        ObjectNode out = JSON.createObjectNode();
        out.put("unspent", node.pool().len());
        out.put("uxhash", node.pool().getUxHash().hex());
        node.index().head().ifPresentOrElse(
                h -> {
                    out.put("headSeq", h.seq());
                    out.put("headHash", h.hash().hex());
                },
                () -> out.putNull("headSeq"));
        return out;
    }

    static ArrayNode toJson(List<UxOut> uxs) {
        List<UxOut> sorted = new ArrayList<>(uxs);
        sorted.sort(Comparator.comparingLong(UxOut::bkSeq).thenComparing(ux -> ux.hash().hex()));
        ArrayNode arr = JSON.createArrayNode();
        for (UxOut ux : sorted) {
            ObjectNode n = arr.addObject();
            n.put("hash", ux.hash().hex());
            n.put("address", ux.address());
            n.put("coins", ux.coins());
            n.put("hours", ux.hours());
            n.put("time", ux.time());
            n.put("bkSeq", ux.bkSeq());
            n.put("srcTransaction", ux.srcTransaction().hex());
        }
        return arr;
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            Path configFile,
            List<String> addresses,
            boolean listAll,
            boolean verify,
            boolean metrics
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("LEDGER_DATA_DIR", null);
            Path configFile = envPath("LEDGER_CONFIG", null);
            List<String> addresses = new ArrayList<>();
            boolean listAll = false;
            boolean verify = false;
            boolean metrics = false;
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--config=")) {
                        configFile = Path.of(arg.substring("--config=".length()));
                    } else if (arg.startsWith("--address=")) {
                        String address = arg.substring("--address=".length()).trim();
                        if (address.isEmpty()) {
                            showHelp = true;
                            error = "Empty value for --address";
                        } else if (!addresses.contains(address)) {
                            addresses.add(address);
                        }
                    } else if (arg.equals("--all")) {
                        listAll = true;
                    } else if (arg.equals("--verify")) {
                        verify = true;
                    } else if (arg.equals("--metrics")) {
                        metrics = true;
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            return new CliOptions(showHelp, error, dataDir, configFile, List.copyOf(addresses), listAll, verify, metrics);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: utxo-ledger [options]

Opens the ledger, applies the genesis block if the chain is empty and prints a
JSON summary of the unspent pool.

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Ledger data directory (default from config, ./data/ledger)
  --config=<file>            JSON config file (dataDir, syncWrites, genesis*)
  --address=<addr>           Print the unspent outputs of an address (repeatable)
  --all                      Print every unspent output
  --verify                   Rescan the store and check the checksum (exit 2 on mismatch)
  --metrics                  Print ledger metrics after the summary

Environment overrides:
  LEDGER_DATA_DIR            Default for --data-dir
  LEDGER_CONFIG              Default for --config
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }
    }
}
