package io.tabletree.core;

import io.tabletree.storage.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry resolving integer table ids to {@link DataTable} instances.
 * <p>
 * Rows never hold their sub-tables directly, only an id that is resolved here. This keeps a tree of
 * tables a forest of independently owned instances and allows a caller to load only the branches it
 * needs.
 * <p>
 * Ids start at 1 and are never reused within an arena; id 0 is reserved for the root entry of a
 * serialized table map. A table stays registered until it is closed or marked deleted; closing a
 * parent table does not delete its sub-tables.
 * <p>
 * Multiple arenas can coexist, which gives test isolation (fresh arena per test). Most callers use
 * {@link #shared()}.
 */
public final class TableArena implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TableArena.class);
    private static final AtomicLong ARENA_IDS = new AtomicLong();

    private final long arenaId;
    private final TableTreeConfiguration configuration;

    private final Map<Integer, DataTable> tables = new HashMap<>();
    private final Set<Integer> deletedIds = new HashSet<>();
    private final AtomicInteger lastTableId = new AtomicInteger(0);
    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TableArena() {
        this(TableTreeConfiguration.defaults());
    }

    public TableArena(TableTreeConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.arenaId = ARENA_IDS.incrementAndGet();
        this.configuration = configuration;
    }

    /**
     * The process-wide arena used by tables created without an explicit arena.
     */
    public static TableArena shared() {
        return SharedHolder.INSTANCE;
    }

    public long getArenaId() {
        return arenaId;
    }

    public TableTreeConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Register a table and assign its id.
     *
     * @param table the table to register
     * @return the new id
     */
    public int register(DataTable table) {
        if (table == null) {
            throw new IllegalArgumentException("table required");
        }
        var writeLock = lifecycleLock.writeLock();
        writeLock.lock();
        try {
            assertOpen();
            int id = lastTableId.incrementAndGet();
            tables.put(id, table);
            log.debug("Arena {} registered table {}", arenaId, id);
            return id;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Resolve a table id.
     *
     * @param id the table id
     * @return the table
     * @throws LookupException if the id was never registered or the table was deleted
     */
    public DataTable get(int id) {
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            assertOpen();
            if (deletedIds.contains(id)) {
                throw new LookupException(id, "Table id " + id + " has been deleted from the arena.");
            }
            DataTable table = tables.get(id);
            if (table == null) {
                throw new LookupException(id, "Table id " + id + " not found in the arena.");
            }
            return table;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Check first variant of {@link #get(int)}.
     */
    public boolean contains(int id) {
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            assertOpen();
            return tables.containsKey(id) && !deletedIds.contains(id);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Drop the reference to a table. Further lookups of the id fail.
     */
    public void markDeleted(int id) {
        var writeLock = lifecycleLock.writeLock();
        writeLock.lock();
        try {
            assertOpen();
            if (tables.remove(id) != null) {
                deletedIds.add(id);
                log.debug("Arena {} deleted table {}", arenaId, id);
            }
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isDeleted(int id) {
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            return deletedIds.contains(id);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Number of live tables.
     */
    public int getTableCount() {
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            assertOpen();
            return tables.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Id handed out by the last registration, 0 if none.
     */
    public int getMostRecentTableId() {
        return lastTableId.get();
    }

    /**
     * Mark every live table deleted. Ids keep increasing afterwards.
     */
    public void deleteAll() {
        var writeLock = lifecycleLock.writeLock();
        writeLock.lock();
        try {
            assertOpen();
            deletedIds.addAll(tables.keySet());
            log.debug("Arena {} deleted {} tables", arenaId, tables.size());
            tables.clear();
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        var writeLock = lifecycleLock.writeLock();
        writeLock.lock();
        try {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            tables.clear();
            deletedIds.clear();
        } finally {
            writeLock.unlock();
        }
    }

    private void assertOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Arena is closed");
        }
    }

    private static final class SharedHolder {
        private static final TableArena INSTANCE = new TableArena();
    }
}
