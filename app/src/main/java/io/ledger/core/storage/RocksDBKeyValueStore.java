package io.ledger.core.storage;

import io.ledger.core.exception.StoreException;
import org.rocksdb.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Persistent KeyValueStore on a RocksDB TransactionDB.
 *
 * Layout: one column family per region, named after the region. Column families
 * found on disk are opened at startup; new regions are created on demand.
 */
public final class RocksDBKeyValueStore implements KeyValueStore {
    private static final Logger LOG = Logger.getLogger(RocksDBKeyValueStore.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final TransactionDB db;
    private final DBOptions dbOptions;
    private final TransactionDBOptions txDbOptions;
    private final WriteOptions writeOptions;
    private final ReadOptions readOptions;
    private final List<ColumnFamilyHandle> openHandles;
    private final Map<String, ColumnFamilyHandle> regions = new ConcurrentHashMap<>();

    private RocksDBKeyValueStore(TransactionDB db,
                                 DBOptions dbOptions,
                                 TransactionDBOptions txDbOptions,
                                 WriteOptions writeOptions,
                                 List<ColumnFamilyHandle> openHandles) {
        this.db = db;
        this.dbOptions = dbOptions;
        this.txDbOptions = txDbOptions;
        this.writeOptions = writeOptions;
        this.readOptions = new ReadOptions();
        this.openHandles = openHandles;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBKeyValueStore open(String dataDir, boolean syncWrites) {
        try {
            Files.createDirectories(Path.of(dataDir));
        } catch (IOException e) {
            throw new StoreException("Failed to create data directory " + dataDir, e);
        }
        try {
            List<ColumnFamilyDescriptor> cfDescs = new ArrayList<>();
            cfDescs.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
            for (byte[] name : existingColumnFamilies(dataDir)) {
                if (!java.util.Arrays.equals(name, RocksDB.DEFAULT_COLUMN_FAMILY)) {
                    cfDescs.add(new ColumnFamilyDescriptor(name));
                }
            }

            DBOptions dbOpts = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true);
            TransactionDBOptions txOpts = new TransactionDBOptions();
            WriteOptions wo = new WriteOptions().setSync(syncWrites);

            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            TransactionDB db = TransactionDB.open(dbOpts, txOpts, dataDir, cfDescs, cfHandles);

            RocksDBKeyValueStore store = new RocksDBKeyValueStore(db, dbOpts, txOpts, wo, cfHandles);
            // skip the default CF at index 0
            for (int i = 1; i < cfDescs.size(); i++) {
                String name = new String(cfDescs.get(i).getName(), StandardCharsets.UTF_8);
                store.regions.put(name, cfHandles.get(i));
            }
            LOG.info("Opened RocksDB at " + dataDir + " with regions " + store.regions.keySet());
            return store;
        } catch (RocksDBException e) {
            throw new StoreException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    private static List<byte[]> existingColumnFamilies(String dataDir) throws RocksDBException {
        if (!Files.exists(Path.of(dataDir, "CURRENT"))) {
            return List.of();
        }
        try (Options opts = new Options()) {
            return RocksDB.listColumnFamilies(opts, dataDir);
        }
    }

    // -------------- KeyValueStore API ----------------

    @Override
    public synchronized void createRegion(String region) {
        if (regions.containsKey(region)) return;
        try {
            ColumnFamilyHandle handle = db.createColumnFamily(
                    new ColumnFamilyDescriptor(region.getBytes(StandardCharsets.UTF_8)));
            openHandles.add(handle);
            regions.put(region, handle);
        } catch (RocksDBException e) {
            throw new StoreException("createRegion " + region + " failed", e);
        }
    }

    @Override
    public byte[] get(String region, byte[] key) {
        try {
            return db.get(handle(region), key);
        } catch (RocksDBException e) {
            throw new StoreException("get from " + region + " failed", e);
        }
    }

    @Override
    public void forEach(String region, EntryVisitor visitor) {
        try (RocksIterator it = db.newIterator(handle(region))) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                visitor.visit(it.key(), it.value());
            }
            it.status();
        } catch (RocksDBException e) {
            throw new StoreException("iterate " + region + " failed", e);
        }
    }

    @Override
    public StoreTransaction begin() {
        return new RocksTransaction(db.beginTransaction(writeOptions));
    }

    @Override
    public void close() {
        // Close CF handles first, then DB/options
        for (ColumnFamilyHandle h : openHandles) {
            h.close();
        }
        db.close();
        readOptions.close();
        writeOptions.close();
        txDbOptions.close();
        dbOptions.close();
    }

    private ColumnFamilyHandle handle(String region) {
        ColumnFamilyHandle h = regions.get(region);
        if (h == null) throw new StoreException("Unknown region: " + region);
        return h;
    }

    private final class RocksTransaction implements StoreTransaction {
        private final Transaction tx;
        private boolean finished;

        RocksTransaction(Transaction tx) {
            this.tx = tx;
        }

        @Override
        public byte[] get(String region, byte[] key) {
            try {
                return tx.get(handle(region), readOptions, key);
            } catch (RocksDBException e) {
                throw new StoreException("tx get from " + region + " failed", e);
            }
        }

        @Override
        public void put(String region, byte[] key, byte[] value) {
            try {
                tx.put(handle(region), key, value);
            } catch (RocksDBException e) {
                throw new StoreException("tx put into " + region + " failed", e);
            }
        }

        @Override
        public void delete(String region, byte[] key) {
            try {
                tx.delete(handle(region), key);
            } catch (RocksDBException e) {
                throw new StoreException("tx delete from " + region + " failed", e);
            }
        }

        @Override
        public void commit() {
            try {
                tx.commit();
                finished = true;
            } catch (RocksDBException e) {
                throw new StoreException("commit failed", e);
            }
        }

        @Override
        public void rollback() {
            finished = true;
            try {
                tx.rollback();
            } catch (RocksDBException e) {
                throw new StoreException("rollback failed", e);
            }
        }

        @Override
        public void close() {
            try {
                if (!finished) rollback();
            } finally {
                tx.close();
            }
        }
    }
}
