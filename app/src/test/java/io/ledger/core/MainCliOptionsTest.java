package io.ledger.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertFalse(options.listAll());
        assertFalse(options.verify());
        assertFalse(options.metrics());
        assertTrue(options.addresses().isEmpty());
    }

    @Test
    void parsesQueryFlags() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--data-dir=/tmp/ledger",
                "--config=ledger.json",
                "--address=alice123456",
                "--address=bob654321",
                "--address=alice123456",
                "--all",
                "--verify",
                "--metrics"
        });
        assertFalse(options.showHelp());
        assertEquals(Path.of("/tmp/ledger"), options.dataDir());
        assertEquals(Path.of("ledger.json"), options.configFile());
        assertEquals(List.of("alice123456", "bob654321"), options.addresses());
        assertTrue(options.listAll());
        assertTrue(options.verify());
        assertTrue(options.metrics());
    }

    @Test
    void emptyAddressSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--address="});
        assertTrue(options.showHelp());
        assertNotNull(options.errorMessage());
        assertTrue(options.errorMessage().contains("--address"));
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }
}
