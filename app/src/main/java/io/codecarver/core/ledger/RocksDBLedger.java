package io.codecarver.core.ledger;

import io.codecarver.core.protocol.CodeAddress;
import io.codecarver.core.protocol.HostRules;
import org.rocksdb.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Persistent ledger using RocksDB.
 *
 * Layout (column families):
 *  - "code" : key = address(20), val = stored runtime code (may be empty)
 *
 * Each unit of work is written as a single WriteBatch, so a unit is all-or-nothing
 * on disk as well as in memory.
 */
public final class RocksDBLedger extends AbstractPlacementLedger implements AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfCode;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;

    private RocksDBLedger(HostRules rules,
                          RocksDB db,
                          ColumnFamilyHandle cfCode,
                          List<ColumnFamilyHandle> handles,
                          DBOptions dbOptions,
                          ColumnFamilyOptions cfOptions) {
        super(rules);
        this.db = db;
        this.cfCode = cfCode;
        this.handles = handles;
        this.dbOptions = dbOptions;
        this.cfOptions = cfOptions;
    }

    /** Factory: open/create a ledger in the given directory path. */
    public static RocksDBLedger open(String dataDir) {
        return open(dataDir, HostRules.defaults());
    }

    public static RocksDBLedger open(String dataDir, HostRules rules) {
        ColumnFamilyOptions cfOpts = new ColumnFamilyOptions();
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOpts),
                    new ColumnFamilyDescriptor("code".getBytes(), cfOpts)
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBLedger(rules, db, cfHandles.get(1), cfHandles, dbOpts, cfOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            cfOpts.close();
            throw new RuntimeException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    protected byte[] loadCode(CodeAddress address) {
        try {
            return db.get(cfCode, address.bytes());
        } catch (RocksDBException e) {
            throw new RuntimeException("loadCode failed", e);
        }
    }

    @Override
    protected void commit(Map<CodeAddress, byte[]> placements) {
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            for (Map.Entry<CodeAddress, byte[]> e : placements.entrySet()) {
                batch.put(cfCode, e.getKey().bytes(), e.getValue());
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new RuntimeException("commit failed", e);
        }
    }

    @Override
    public long size() {
        try (RocksIterator it = db.newIterator(cfCode)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
        cfOptions.close();
    }
}
