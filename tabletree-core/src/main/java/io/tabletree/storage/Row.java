package io.tabletree.storage;

import io.tabletree.core.TableArena;
import io.tabletree.core.TableTreeException;
import io.tabletree.kernel.AggregationOperation;
import io.tabletree.kernel.AggregationPolicy;
import io.tabletree.kernel.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A single record of a {@link DataTable}.
 * <p>
 * A row is made of
 * <ul>
 * <li>ordered columns, typically a {@code label} plus numeric metrics,</li>
 * <li>metadata (logo, url, ...) that is never aggregated,</li>
 * <li>optionally the id of a sub-table holding a breakdown of this row.</li>
 * </ul>
 * The sub-table is referenced by id only and resolved through the arena of the table that owns the
 * row. When a sub-table is attached in memory the row also caches the instance; the cache is dropped
 * by {@link #cleanPostSerialize()}.
 */
public class Row {

    private static final Logger log = LoggerFactory.getLogger(Row.class);

    /** Column holding the row label. */
    public static final String LABEL = "label";

    /** Keys understood by the map form of a row, see {@link #fromMap(Map)}. */
    public static final String COLUMNS = "columns";
    public static final String METADATA = "metadata";
    public static final String SUBTABLE_ID = "idsubdatatable";
    public static final String SUBTABLE = "subtable";

    private static final Set<String> UNSUMMABLE_COLUMNS = Set.of(LABEL);

    private final Map<String, Object> columns = new LinkedHashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private Integer subtableId;
    private DataTable subtableCache;
    private TableArena arena;

    public Row() {
    }

    public Row(Map<String, ?> columns) {
        if (columns != null) {
            this.columns.putAll(columns);
        }
    }

    public Row(Map<String, ?> columns, Map<String, ?> metadata) {
        this(columns);
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
    }

    /**
     * Build a row from its map form:
     * {@code {columns: {...}, metadata: {...}, idsubdatatable: 12}} or, instead of the id,
     * {@code subtable: <DataTable>}.
     */
    public static Row fromMap(Map<?, ?> map) {
        if (map == null) {
            throw new IllegalArgumentException("map required");
        }
        Row row = new Row(stringKeyed(map.get(COLUMNS), COLUMNS), stringKeyed(map.get(METADATA), METADATA));
        Object subtable = map.get(SUBTABLE);
        if (subtable instanceof DataTable table) {
            row.setSubtable(table);
        } else if (subtable != null) {
            throw new IllegalArgumentException("subtable must be a DataTable, got " + subtable.getClass().getName());
        }
        Object subtableId = map.get(SUBTABLE_ID);
        if (subtableId instanceof Number number && row.subtableId == null) {
            row.subtableId = number.intValue();
        }
        return row;
    }

    // columns

    public Object getColumn(String name) {
        return columns.get(name);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Shortcut for {@code getColumn("label")}.
     */
    public Object getLabel() {
        return columns.get(LABEL);
    }

    public void setColumn(String name, Object value) {
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        columns.put(name, value);
    }

    /**
     * Replace every column.
     */
    public void setColumns(Map<String, ?> newColumns) {
        columns.clear();
        if (newColumns != null) {
            columns.putAll(newColumns);
        }
    }

    /**
     * @return true if the column existed
     */
    public boolean deleteColumn(String name) {
        if (!columns.containsKey(name)) {
            return false;
        }
        columns.remove(name);
        return true;
    }

    /**
     * Rename a column, keeping its position.
     */
    public void renameColumn(String oldName, String newName) {
        if (!columns.containsKey(oldName) || oldName.equals(newName)) {
            return;
        }
        Map<String, Object> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : columns.entrySet()) {
            if (entry.getKey().equals(oldName)) {
                renamed.put(newName, entry.getValue());
            } else if (!entry.getKey().equals(newName)) {
                renamed.put(entry.getKey(), entry.getValue());
            }
        }
        columns.clear();
        columns.putAll(renamed);
    }

    /**
     * @return an unmodifiable view of the columns, in insertion order
     */
    public Map<String, Object> getColumns() {
        return Collections.unmodifiableMap(columns);
    }

    // metadata

    public Object getMetadata(String name) {
        return metadata.get(name);
    }

    public void setMetadata(String name, Object value) {
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        metadata.put(name, value);
    }

    public boolean deleteMetadata(String name) {
        if (!metadata.containsKey(name)) {
            return false;
        }
        metadata.remove(name);
        return true;
    }

    public void deleteMetadata() {
        metadata.clear();
    }

    public Map<String, Object> getAllMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    // sub-table

    public Integer getSubtableId() {
        return subtableId;
    }

    /**
     * Reference a table by id only. It is resolved lazily through the owning table's arena.
     */
    public void setSubtableId(int id) {
        this.subtableId = id;
        this.subtableCache = null;
    }

    /**
     * Attach a sub-table, replacing any previous one.
     *
     * @return the attached table
     */
    public DataTable setSubtable(DataTable subtable) {
        if (subtable == null) {
            throw new IllegalArgumentException("subtable required");
        }
        if (subtableId != null && subtableId != subtable.getId()) {
            log.warn("Row {} replaces sub-table {} with {}", getLabel(), subtableId, subtable.getId());
        }
        this.subtableId = subtable.getId();
        this.subtableCache = subtable;
        if (arena == null) {
            arena = subtable.getArena();
        }
        return subtable;
    }

    /**
     * Attach a sub-table to a row that has none yet.
     *
     * @throws TableTreeException if the row already has a sub-table
     */
    public DataTable addSubtable(DataTable subtable) {
        if (subtableId != null) {
            throw new TableTreeException("Adding a subtable to the row, but it already has a subtable associated.");
        }
        return setSubtable(subtable);
    }

    public void removeSubtable() {
        subtableId = null;
        subtableCache = null;
    }

    /**
     * True if a sub-table instance is cached on this row, i.e. it was attached in memory and not
     * merely referenced by id.
     */
    public boolean isSubtableLoaded() {
        return subtableCache != null;
    }

    /**
     * Resolve the sub-table.
     *
     * @return the sub-table, or null if this row has none
     * @throws io.tabletree.core.LookupException if the id is unknown to the arena
     */
    public DataTable getSubtable() {
        if (subtableId == null) {
            return null;
        }
        if (subtableCache != null && !subtableCache.isClosed()) {
            return subtableCache;
        }
        TableArena resolver = arena != null ? arena : TableArena.shared();
        return resolver.get(subtableId);
    }

    /**
     * Merge {@code other} into this row's sub-table, creating the sub-table if this row has none.
     */
    public void sumSubtable(DataTable other) {
        if (other == null) {
            return;
        }
        DataTable thisSubtable = getSubtable();
        if (thisSubtable == null) {
            thisSubtable = new DataTable(other.getArena());
            thisSubtable.setColumnAggregationOperations(other.getColumnAggregationOperations());
            setSubtable(thisSubtable);
        }
        thisSubtable.addDataTable(other);
    }

    /**
     * Drop transient state built while the row was used in memory.
     */
    public void cleanPostSerialize() {
        subtableCache = null;
    }

    // aggregation

    public void sumRow(Row other) {
        sumRow(other, true, AggregationPolicy.sumEverything());
    }

    /**
     * Sum the columns of {@code other} into this row.
     * <p>
     * Each column of {@code other} other than the label is combined with the operator the policy
     * gives for it; columns missing here are created with the incoming value.
     *
     * @param other                 the row to add
     * @param copyMetadataIfAbsent  copy metadata entries this row lacks
     * @param policy                per-column operators
     */
    public void sumRow(Row other, boolean copyMetadataIfAbsent, AggregationPolicy policy) {
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        AggregationPolicy effective = policy != null ? policy : AggregationPolicy.sumEverything();
        for (Map.Entry<String, Object> entry : other.columns.entrySet()) {
            String name = entry.getKey();
            if (UNSUMMABLE_COLUMNS.contains(name)) {
                if (!columns.containsKey(name)) {
                    columns.put(name, entry.getValue());
                }
                continue;
            }
            if (!columns.containsKey(name)) {
                columns.put(name, entry.getValue());
                continue;
            }
            AggregationOperation operation = effective.operationFor(name);
            columns.put(name, operation.aggregate(columns.get(name), entry.getValue()));
        }
        if (copyMetadataIfAbsent) {
            for (Map.Entry<String, Object> entry : other.metadata.entrySet()) {
                metadata.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * Shallow copy: same column and metadata values, same sub-table id.
     */
    public Row copy() {
        Row copy = new Row(columns, metadata);
        copy.subtableId = subtableId;
        copy.subtableCache = subtableCache;
        copy.arena = arena;
        return copy;
    }

    /**
     * Used in tests: same columns and same metadata, regardless of order. Numbers are compared by
     * value. Sub-tables are not compared.
     */
    public static boolean isEqual(Row left, Row right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        return Values.looselyEquals(left.columns, right.columns)
                && Values.looselyEquals(left.metadata, right.metadata);
    }

    TableArena getArena() {
        return arena;
    }

    void bindArena(TableArena owner) {
        if (arena == null) {
            arena = owner;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Row{columns=").append(columns);
        if (!metadata.isEmpty()) {
            sb.append(", metadata=").append(metadata);
        }
        if (subtableId != null) {
            sb.append(", subtable=").append(subtableId);
        }
        return sb.append('}').toString();
    }

    private static Map<String, Object> stringKeyed(Object value, String what) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(what + " must be a map, got " + value.getClass().getName());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }
}
