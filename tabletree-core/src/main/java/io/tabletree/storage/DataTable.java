package io.tabletree.storage;

import io.tabletree.core.RecursionLimitException;
import io.tabletree.core.TableArena;
import io.tabletree.core.TableTreeException;
import io.tabletree.core.UnknownRowException;
import io.tabletree.core.UnserializationException;
import io.tabletree.filter.AddSummaryRowFilter;
import io.tabletree.filter.Filter;
import io.tabletree.filter.FilterFunction;
import io.tabletree.filter.FilterParameters;
import io.tabletree.index.LabelIndex;
import io.tabletree.kernel.AggregationPolicy;
import io.tabletree.kernel.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A table of report data: ordered {@link Row}s plus at most one summary row.
 * <p>
 * Rows may reference a sub-table by id (e.g. the keywords of one search engine). Sub-tables are
 * independent tables registered in the same {@link TableArena}; a table never owns them.
 * <p>
 * Features:
 * <ul>
 * <li>label lookup through a lazily rebuilt index,</li>
 * <li>a row cap: rows added to a full table are folded into the summary row,</li>
 * <li>merging of another table by label with per-column aggregation operators,</li>
 * <li>flat serialization of the table and all its sub-tables, one blob per table,</li>
 * <li>named filters, applied now or queued for later.</li>
 * </ul>
 * Row ids are dense on append; deleting a row leaves a gap until the table is sorted or
 * offset-deleted. The summary row always has id {@link #ID_SUMMARY_ROW}.
 * <p>
 * Not thread-safe. A table and the sub-tables reachable from it must be guarded as one unit.
 */
public class DataTable implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DataTable.class);

    /** Row id of the summary row. */
    public static final int ID_SUMMARY_ROW = -1;
    /** Label of the summary row. */
    public static final Integer LABEL_SUMMARY_ROW = -1;

    /** Table metadata recording when a report was archived. */
    public static final String ARCHIVED_DATE_METADATA_NAME = "archived_date";
    /** Table metadata listing columns that are empty and should not be shown. */
    public static final String EMPTY_COLUMNS_METADATA_NAME = "empty_column";

    private final TableArena arena;
    private final int id;

    private final Map<Integer, Row> rows = new LinkedHashMap<>();
    private int nextRowId;
    private Row summaryRow;
    private final LabelIndex index = new LabelIndex();

    private String sortedByColumn;
    private boolean recursiveSort;
    private boolean recursiveFilters;
    private final List<QueuedFilter> queuedFilters = new ArrayList<>();
    private int rowsCountBeforeLimitFilter;

    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private int maximumAllowedRows;
    private final Map<String, String> columnAggregationOperations = new LinkedHashMap<>();
    private boolean closed;

    /**
     * Create a table registered in the shared arena.
     */
    public DataTable() {
        this(TableArena.shared());
    }

    public DataTable(TableArena arena) {
        if (arena == null) {
            throw new IllegalArgumentException("arena required");
        }
        this.arena = arena;
        this.id = arena.register(this);
    }

    public int getId() {
        return id;
    }

    public TableArena getArena() {
        return arena;
    }

    // sorting

    /**
     * Sort the rows (the summary row stays last). Row ids are renumbered.
     *
     * @param comparator     row order
     * @param columnSortedBy column name reported by {@link #getSortedByColumnName()}
     */
    public void sort(Comparator<? super Row> comparator, String columnSortedBy) {
        sort(comparator, columnSortedBy, 0);
    }

    private void sort(Comparator<? super Row> comparator, String columnSortedBy, int depth) {
        checkDepth(depth);
        sortedByColumn = columnSortedBy;
        List<Row> sorted = new ArrayList<>(rows.values());
        sorted.sort(comparator);
        renumber(sorted);

        if (recursiveSort) {
            for (Row row : sorted) {
                DataTable subtable = row.getSubtable();
                if (subtable != null) {
                    subtable.enableRecursiveSort();
                    subtable.sort(comparator, columnSortedBy, depth + 1);
                }
            }
        }
    }

    public String getSortedByColumnName() {
        return sortedByColumn;
    }

    /**
     * Make {@link #sort} also sort every sub-table with the same comparator.
     */
    public void enableRecursiveSort() {
        recursiveSort = true;
    }

    public boolean isRecursiveSortEnabled() {
        return recursiveSort;
    }

    /**
     * Make filters applied through {@link #filter(String, Object...)} also run on sub-tables.
     */
    public void enableRecursiveFilters() {
        recursiveFilters = true;
    }

    public boolean isRecursiveFiltersEnabled() {
        return recursiveFilters;
    }

    /**
     * @return the row count saved by {@link #setRowsCountBeforeLimitFilter()}, or the current row
     * count if none was saved
     */
    public int getRowsCountBeforeLimitFilter() {
        return rowsCountBeforeLimitFilter == 0 ? getRowsCount() : rowsCountBeforeLimitFilter;
    }

    public void setRowsCountBeforeLimitFilter() {
        rowsCountBeforeLimitFilter = getRowsCount();
    }

    // filters

    /**
     * Apply the filter registered under {@code name} now.
     *
     * @param name       filter name, e.g. "Sort"
     * @param parameters positional filter parameters, e.g. "nb_visits", "asc"
     */
    public void filter(String name, Object... parameters) {
        Filter filter = arena.getConfiguration().filterRegistry()
                .create(name, this, new FilterParameters(parameters));
        filter.enableRecursive(recursiveFilters);
        log.debug("Applying filter {} to table {}", name, id);
        filter.filter(this);
    }

    /**
     * Invoke {@code function} now with this table followed by {@code parameters}.
     */
    public void filter(FilterFunction function, Object... parameters) {
        if (function == null) {
            throw new IllegalArgumentException("function required");
        }
        function.apply(this, parameters);
    }

    /**
     * Queue a named filter for {@link #applyQueuedFilters()}.
     */
    public void queueFilter(String name, Object... parameters) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        queuedFilters.add(new QueuedFilter(name, null, parameters));
    }

    public void queueFilter(FilterFunction function, Object... parameters) {
        if (function == null) {
            throw new IllegalArgumentException("function required");
        }
        queuedFilters.add(new QueuedFilter(null, function, parameters));
    }

    /**
     * Apply the queued filters in the order they were queued, then forget them.
     */
    public void applyQueuedFilters() {
        List<QueuedFilter> toApply = new ArrayList<>(queuedFilters);
        for (QueuedFilter queued : toApply) {
            if (queued.function() != null) {
                filter(queued.function(), queued.parameters());
            } else {
                filter(queued.name(), queued.parameters());
            }
        }
        queuedFilters.subList(0, toApply.size()).clear();
    }

    public int getQueuedFiltersCount() {
        return queuedFilters.size();
    }

    // merging

    /**
     * Add the rows of {@code tableToSum} to this table.
     * <ul>
     * <li>a row whose label is not in this table is added;</li>
     * <li>a row whose label exists is summed into the existing row, using this table's aggregation
     * operations, and its sub-table is merged recursively into the existing row's sub-table.</li>
     * </ul>
     */
    public void addDataTable(DataTable tableToSum) {
        if (tableToSum == null) {
            throw new IllegalArgumentException("tableToSum required");
        }
        addDataTable(tableToSum, 0);
    }

    private void addDataTable(DataTable tableToSum, int depth) {
        checkDepth(depth);
        AggregationPolicy policy = aggregationPolicy();
        for (Row row : tableToSum.getRows()) {
            Object label = row.getLabel();
            Row rowFound = getRowFromLabel(label);
            if (rowFound == null) {
                if (isSummaryLabel(label)) {
                    addSummaryRow(row.copy());
                } else {
                    addRow(row.copy());
                }
                continue;
            }
            rowFound.sumRow(row, true, policy);

            DataTable subtableToSum = row.getSubtable();
            if (subtableToSum != null) {
                subtableToSum.setColumnAggregationOperations(columnAggregationOperations);
                DataTable target = rowFound.getSubtable();
                if (target == null) {
                    target = new DataTable(arena);
                    target.setColumnAggregationOperations(subtableToSum.getColumnAggregationOperations());
                    rowFound.setSubtable(target);
                }
                target.addDataTable(subtableToSum, depth + 1);
            }
        }
    }

    // label index

    /**
     * Find the row carrying {@code label}. The summary label resolves to the summary row.
     * <p>
     * Calling this switches the index to continuous maintenance.
     *
     * @return the row, or null if no row has this label
     */
    public Row getRowFromLabel(Object label) {
        Integer rowId = getRowIdFromLabel(label);
        if (rowId == null) {
            return null;
        }
        return getRowFromId(rowId);
    }

    /**
     * @return the id of the row carrying {@code label}, {@link #ID_SUMMARY_ROW} for the summary
     * row, or null if not found
     */
    public Integer getRowIdFromLabel(Object label) {
        index.enableContinuousMaintenance();
        if (index.isStale()) {
            rebuildIndex();
        }
        if (label == null) {
            return null;
        }
        if (isSummaryLabel(label) && summaryRow != null) {
            return ID_SUMMARY_ROW;
        }
        Integer rowId = index.lookup(Values.labelKey(label));
        if (rowId == null) {
            return null;
        }
        if (rowId == ID_SUMMARY_ROW) {
            return summaryRow != null ? rowId : null;
        }
        return rows.containsKey(rowId) ? rowId : null;
    }

    LabelIndex.State getIndexState() {
        return index.state();
    }

    boolean isIndexContinuous() {
        return index.isContinuous();
    }

    private void rebuildIndex() {
        index.rebuild(put -> {
            for (Map.Entry<Integer, Row> entry : rows.entrySet()) {
                Object label = entry.getValue().getLabel();
                if (label != null) {
                    put.accept(Values.labelKey(label), entry.getKey());
                }
            }
            if (summaryRow != null && summaryRow.getLabel() != null) {
                put.accept(Values.labelKey(summaryRow.getLabel()), ID_SUMMARY_ROW);
            }
        });
    }

    // row access

    /**
     * An empty table in the same arena with the same metadata.
     *
     * @param keepFilters also copy the queued filters
     */
    public DataTable getEmptyClone(boolean keepFilters) {
        DataTable clone = new DataTable(arena);
        if (keepFilters) {
            clone.queuedFilters.addAll(queuedFilters);
        }
        clone.metadata.putAll(metadata);
        return clone;
    }

    /**
     * @return the row with this id, the summary row for {@link #ID_SUMMARY_ROW}, or null
     */
    public Row getRowFromId(int rowId) {
        Row row = rows.get(rowId);
        if (row == null && rowId == ID_SUMMARY_ROW) {
            return summaryRow;
        }
        return row;
    }

    /**
     * @return the first row referencing sub-table {@code subtableId}, or null
     */
    public Row getRowFromIdSubDataTable(int subtableId) {
        for (Row row : rows.values()) {
            Integer rowSubtableId = row.getSubtableId();
            if (rowSubtableId != null && rowSubtableId == subtableId) {
                return row;
            }
        }
        return null;
    }

    /**
     * Append a row.
     * <p>
     * If the table has a row cap and holds {@code maximumAllowedRows - 1} rows or more, the row is
     * folded into the summary row instead: the first such row becomes the summary row (relabeled),
     * later ones are summed into it without copying metadata.
     *
     * @return {@code row}, or the summary row it was folded into
     */
    public Row addRow(Row row) {
        if (row == null) {
            throw new IllegalArgumentException("row required");
        }
        if (maximumAllowedRows > 0 && getRowsCount() >= maximumAllowedRows - 1) {
            if (summaryRow == null) {
                Row summary = new Row(row.getColumns());
                summary.setColumn(Row.LABEL, LABEL_SUMMARY_ROW);
                addSummaryRow(summary);
            } else {
                summaryRow.sumRow(row, false, aggregationPolicy());
            }
            return summaryRow;
        }

        row.bindArena(arena);
        int rowId = nextRowId++;
        rows.put(rowId, row);
        Object label = row.getLabel();
        index.onAppend(label == null ? null : Values.labelKey(label), rowId);
        return row;
    }

    /**
     * Set the summary row, replacing any previous one.
     *
     * @return {@code row}
     */
    public Row addSummaryRow(Row row) {
        if (row == null) {
            throw new IllegalArgumentException("row required");
        }
        row.bindArena(arena);
        summaryRow = row;
        Object label = row.getLabel();
        if (label != null) {
            index.put(Values.labelKey(label), ID_SUMMARY_ROW);
        }
        return row;
    }

    public Row getSummaryRow() {
        return summaryRow;
    }

    /**
     * @return every row, the summary row last
     */
    public List<Row> getRows() {
        List<Row> all = new ArrayList<>(rows.values());
        if (summaryRow != null) {
            all.add(summaryRow);
        }
        return all;
    }

    public List<Row> getRowsWithoutSummaryRow() {
        return new ArrayList<>(rows.values());
    }

    /**
     * @return rows keyed by row id, the summary row last under {@link #ID_SUMMARY_ROW}
     */
    public Map<Integer, Row> getRowsById() {
        Map<Integer, Row> all = new LinkedHashMap<>(rows);
        if (summaryRow != null) {
            all.put(ID_SUMMARY_ROW, summaryRow);
        }
        return all;
    }

    /**
     * Value of one column across all rows, null where a row lacks it.
     */
    public List<Object> getColumn(String name) {
        List<Object> values = new ArrayList<>();
        for (Row row : getRows()) {
            values.add(row.getColumn(name));
        }
        return values;
    }

    /**
     * Values of every column whose name starts with {@code prefix}, row after row.
     */
    public List<Object> getColumnsStartingWith(String prefix) {
        List<Object> values = new ArrayList<>();
        for (Row row : getRows()) {
            for (Map.Entry<String, Object> column : row.getColumns().entrySet()) {
                if (column.getKey().startsWith(prefix)) {
                    values.add(column.getValue());
                }
            }
        }
        return values;
    }

    /**
     * Column names of the first row that has any, assumed to be shared by every row.
     */
    public List<String> getColumns() {
        for (Row row : getRows()) {
            if (!row.getColumns().isEmpty()) {
                return new ArrayList<>(row.getColumns().keySet());
            }
        }
        return new ArrayList<>();
    }

    public List<Object> getRowsMetadata(String name) {
        List<Object> values = new ArrayList<>();
        for (Row row : getRows()) {
            values.add(row.getMetadata(name));
        }
        return values;
    }

    /**
     * @return number of rows, summary row included
     */
    public int getRowsCount() {
        return summaryRow == null ? rows.size() : rows.size() + 1;
    }

    public int getRowsCountWithoutSummaryRow() {
        return rows.size();
    }

    /**
     * @return the first row, the summary row if there is no other, or null
     */
    public Row getFirstRow() {
        if (rows.isEmpty()) {
            return summaryRow;
        }
        return rows.values().iterator().next();
    }

    /**
     * @return the summary row if any, otherwise the last row, or null
     */
    public Row getLastRow() {
        if (summaryRow != null) {
            return summaryRow;
        }
        Row last = null;
        for (Row row : rows.values()) {
            last = row;
        }
        return last;
    }

    /**
     * Row count of this table plus the recursive row counts of all sub-tables.
     */
    public int getRowsCountRecursive() {
        return getRowsCountRecursive(0);
    }

    private int getRowsCountRecursive(int depth) {
        checkDepth(depth);
        int total = 0;
        for (Row row : rows.values()) {
            DataTable subtable = row.getSubtable();
            if (subtable != null) {
                total += subtable.getRowsCountRecursive(depth + 1);
            }
        }
        return total + getRowsCount();
    }

    // column and row deletion

    public void deleteColumn(String name) {
        deleteColumns(List.of(name), false);
    }

    /**
     * Delete columns from every row, summary row included.
     *
     * @param recursive also delete them in every sub-table
     */
    public void deleteColumns(Collection<String> names, boolean recursive) {
        deleteColumns(names, recursive, 0);
    }

    private void deleteColumns(Collection<String> names, boolean recursive, int depth) {
        checkDepth(depth);
        for (Row row : getRows()) {
            for (String name : names) {
                row.deleteColumn(name);
            }
            if (recursive) {
                DataTable subtable = row.getSubtable();
                if (subtable != null) {
                    subtable.deleteColumns(names, true, depth + 1);
                }
            }
        }
    }

    /**
     * Rename a column in every row of this table and of its sub-tables.
     */
    public void renameColumn(String oldName, String newName) {
        renameColumn(oldName, newName, 0);
    }

    private void renameColumn(String oldName, String newName, int depth) {
        checkDepth(depth);
        for (Row row : getRows()) {
            row.renameColumn(oldName, newName);
            DataTable subtable = row.getSubtable();
            if (subtable != null) {
                subtable.renameColumn(oldName, newName, depth + 1);
            }
        }
        if (Row.LABEL.equals(oldName) || Row.LABEL.equals(newName)) {
            index.markStale();
        }
    }

    /**
     * Delete one row. Ids of the other rows do not change.
     *
     * @throws UnknownRowException if there is no row with this id
     */
    public void deleteRow(int rowId) {
        if (rowId == ID_SUMMARY_ROW) {
            summaryRow = null;
            index.markStale();
            return;
        }
        if (!rows.containsKey(rowId)) {
            throw new UnknownRowException(rowId);
        }
        rows.remove(rowId);
        index.markStale();
    }

    public void deleteRows(Collection<Integer> rowIds) {
        for (Integer rowId : rowIds) {
            deleteRow(rowId);
        }
    }

    /**
     * Delete {@code limit} rows starting at position {@code offset}; remaining rows are renumbered.
     * When the deletion reaches the end of the table the summary row is deleted too.
     *
     * @param limit number of rows to delete, null for all rows from {@code offset}
     * @return number of regular rows deleted
     */
    public int deleteRowsOffset(int offset, Integer limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (limit != null && limit == 0) {
            return 0;
        }
        int count = getRowsCount();
        if (offset >= count) {
            return 0;
        }
        if (limit == null || limit >= count) {
            summaryRow = null;
        }

        List<Row> remaining = new ArrayList<>(rows.values());
        int from = Math.min(offset, remaining.size());
        int to = limit == null ? remaining.size() : (int) Math.min((long) offset + limit, remaining.size());
        int deleted = Math.max(0, to - from);
        if (deleted > 0) {
            remaining.subList(from, to).clear();
        }
        renumber(remaining);
        return deleted;
    }

    // equality

    /**
     * Used in tests: same row count and, for every row of {@code left}, a row of {@code right} with
     * the same label that is {@link Row#isEqual row-equal}. Unlabeled rows are matched by id.
     */
    public static boolean isEqual(DataTable left, DataTable right) {
        return isEqual(left, right, false, 0);
    }

    /**
     * Like {@link #isEqual} but matching rows must also have equal sub-tables (or both none).
     * Sub-table ids are not compared.
     */
    public static boolean isEqualRecursive(DataTable left, DataTable right) {
        return isEqual(left, right, true, 0);
    }

    private static boolean isEqual(DataTable left, DataTable right, boolean recursive, int depth) {
        left.checkDepth(depth);
        left.rebuildIndex();
        right.rebuildIndex();
        if (left.getRowsCount() != right.getRowsCount()) {
            return false;
        }
        for (Map.Entry<Integer, Row> entry : left.getRowsById().entrySet()) {
            Row row1 = entry.getValue();
            Row row2 = row1.getLabel() != null
                    ? right.getRowFromLabel(row1.getLabel())
                    : right.getRowFromId(entry.getKey());
            if (row2 == null || !Row.isEqual(row1, row2)) {
                return false;
            }
            if (recursive) {
                DataTable sub1 = row1.getSubtable();
                DataTable sub2 = row2.getSubtable();
                if ((sub1 == null) != (sub2 == null)) {
                    return false;
                }
                if (sub1 != null && !isEqual(sub1, sub2, true, depth + 1)) {
                    return false;
                }
            }
        }
        return true;
    }

    // serialization

    public Map<Integer, byte[]> getSerialized() {
        return getSerialized(null, null, null);
    }

    /**
     * Serialize this table and every sub-table reachable from it, one blob per table.
     * <p>
     * Sub-tables come first (depth first) keyed by their arena id; this table comes last keyed by
     * {@code 0}, whatever its real id. Each blob holds only the rows and summary row of its own
     * table. The truncation parameters, when given, modify the tables before serialization.
     *
     * @param maximumRowsInDataTable     row cap of this table, summary row included, or null
     * @param maximumRowsInSubDataTable  row cap of every sub-table, or null
     * @param columnToSortByBeforeTruncation column sorted descending before truncating, or null
     * @throws RecursionLimitException if sub-tables nest deeper than the configured maximum
     */
    public Map<Integer, byte[]> getSerialized(Integer maximumRowsInDataTable,
                                              Integer maximumRowsInSubDataTable,
                                              String columnToSortByBeforeTruncation) {
        Map<Integer, byte[]> serialized = serialize(maximumRowsInDataTable, maximumRowsInSubDataTable,
                columnToSortByBeforeTruncation, 0);
        log.debug("Serialized table {} into {} blobs", id, serialized.size());
        return serialized;
    }

    private Map<Integer, byte[]> serialize(Integer maximumRows, Integer maximumSubRows, String sortColumn, int depth) {
        checkDepth(depth);
        if (maximumRows != null) {
            if (maximumRows < 1) {
                throw new IllegalArgumentException("maximum rows must be at least 1");
            }
            filter(AddSummaryRowFilter.NAME, maximumRows - 1, LABEL_SUMMARY_ROW, sortColumn, true);
        }

        Map<Integer, byte[]> serialized = new LinkedHashMap<>();
        for (Row row : rows.values()) {
            DataTable subtable = row.getSubtable();
            if (subtable != null) {
                Map<Integer, byte[]> serializedSubtable =
                        subtable.serialize(maximumSubRows, maximumSubRows, sortColumn, depth + 1);
                serializedSubtable.forEach(serialized::putIfAbsent);
            }
        }

        int forcedId = depth == 0 ? 0 : id;
        Map<Integer, Row> own = new LinkedHashMap<>(rows);
        own.put(ID_SUMMARY_ROW, summaryRow);
        serialized.put(forcedId, TableBlobCodec.encode(own));

        for (Row row : rows.values()) {
            row.cleanPostSerialize();
        }
        return serialized;
    }

    /**
     * Load rows from a blob produced by {@link #getSerialized}. Sub-tables are not loaded; rows keep
     * the serialized sub-table ids.
     *
     * @throws UnserializationException if the blob cannot be decoded
     */
    public void addRowsFromSerializedArray(byte[] blob) {
        Map<Integer, Map<?, ?>> decoded = TableBlobCodec.decode(blob);
        try {
            addRowsFromArray(decoded);
        } catch (IllegalArgumentException e) {
            throw new UnserializationException("The unserialization has failed!", e);
        }
    }

    /**
     * Load rows keyed by row id. Values are {@link Row}s or maps as understood by
     * {@link Row#fromMap}. The entry under {@link #ID_SUMMARY_ROW} becomes the summary row.
     */
    public void addRowsFromArray(Map<Integer, ?> array) {
        for (Map.Entry<Integer, ?> entry : array.entrySet()) {
            Row row = toRow(entry.getValue());
            if (entry.getKey() != null && entry.getKey() == ID_SUMMARY_ROW) {
                addSummaryRow(row);
            } else {
                addRow(row);
            }
        }
    }

    /**
     * Load rows in list order.
     */
    public void addRowsFromArray(List<?> array) {
        for (Object value : array) {
            addRow(toRow(value));
        }
    }

    public void addRowFromArray(Map<?, ?> row) {
        addRow(toRow(row));
    }

    /**
     * Load a "simple" structure, see {@link SimpleArrayConverter}.
     *
     * @param array a map or a list
     * @throws io.tabletree.core.ConversionException if it cannot be converted losslessly; rows
     *                                               converted before the failure stay in the table
     */
    public void addRowsFromSimpleArray(Object array) {
        SimpleArrayConverter.convert(array, this::addRow);
    }

    public void addRowFromSimpleArray(Map<?, ?> row) {
        addRowsFromSimpleArray(List.of(row));
    }

    public static DataTable makeFromSimpleArray(TableArena arena, Object array) {
        DataTable table = new DataTable(arena);
        table.addRowsFromSimpleArray(array);
        return table;
    }

    public static DataTable makeFromSimpleArray(Object array) {
        return makeFromSimpleArray(TableArena.shared(), array);
    }

    /**
     * Build a table from {@code label -> columns} or {@code label -> value} entries. The label becomes
     * the first column; a scalar value goes in column {@code value}.
     *
     * @param subtablePerLabel optional sub-table to attach per label
     */
    public static DataTable makeFromIndexedArray(TableArena arena, Map<?, ?> array,
                                                 Map<?, DataTable> subtablePerLabel) {
        DataTable table = new DataTable(arena);
        for (Map.Entry<?, ?> entry : array.entrySet()) {
            Map<String, Object> columns = new LinkedHashMap<>();
            columns.put(Row.LABEL, entry.getKey());
            if (entry.getValue() instanceof Map<?, ?> values) {
                for (Map.Entry<?, ?> value : values.entrySet()) {
                    columns.putIfAbsent(String.valueOf(value.getKey()), value.getValue());
                }
            } else {
                columns.put("value", entry.getValue());
            }
            Row row = new Row(columns);
            if (subtablePerLabel != null && subtablePerLabel.get(entry.getKey()) != null) {
                row.setSubtable(subtablePerLabel.get(entry.getKey()));
            }
            table.addRow(row);
        }
        return table;
    }

    public static DataTable makeFromIndexedArray(Map<?, ?> array) {
        return makeFromIndexedArray(TableArena.shared(), array, null);
    }

    public static DataTable fromSerializedArray(TableArena arena, byte[] blob) {
        DataTable table = new DataTable(arena);
        table.addRowsFromSerializedArray(blob);
        return table;
    }

    public static DataTable fromSerializedArray(byte[] blob) {
        return fromSerializedArray(TableArena.shared(), blob);
    }

    /**
     * Rebuild a whole tree from the output of {@link #getSerialized}: the root blob under key 0,
     * every sub-table blob under the id its parent row references. Each loaded sub-table gets a new
     * id in {@code arena} and the rows are re-pointed to it.
     *
     * @throws UnserializationException if the root or a referenced sub-table blob is missing
     */
    public static DataTable fromSerializedTree(TableArena arena, Map<Integer, byte[]> serialized) {
        byte[] root = serialized.get(0);
        if (root == null) {
            throw new UnserializationException("No root table (key 0) in serialized map");
        }
        return loadTree(arena, serialized, root, 0);
    }

    private static DataTable loadTree(TableArena arena, Map<Integer, byte[]> serialized, byte[] blob, int depth) {
        int maximumDepth = arena.getConfiguration().maximumDepth();
        if (depth > maximumDepth) {
            throw new RecursionLimitException(maximumDepth);
        }
        DataTable table = fromSerializedArray(arena, blob);
        for (Row row : table.getRows()) {
            Integer subtableId = row.getSubtableId();
            if (subtableId == null) {
                continue;
            }
            byte[] subtableBlob = serialized.get(subtableId);
            if (subtableBlob == null) {
                throw new UnserializationException("No serialized sub-table with id " + subtableId);
            }
            row.removeSubtable();
            row.setSubtable(loadTree(arena, serialized, subtableBlob, depth + 1));
        }
        return table;
    }

    // metadata

    public Map<String, Object> getAllTableMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * @return the metadata value, or null if not set
     */
    public Object getMetadata(String name) {
        return metadata.get(name);
    }

    public void setMetadata(String name, Object value) {
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        metadata.put(name, value);
    }

    /**
     * Cap the number of rows, summary row included. 0 means no cap.
     */
    public void setMaximumAllowedRows(int maximumAllowedRows) {
        if (maximumAllowedRows < 0) {
            throw new IllegalArgumentException("maximumAllowedRows must not be negative");
        }
        this.maximumAllowedRows = maximumAllowedRows;
    }

    public int getMaximumAllowedRows() {
        return maximumAllowedRows;
    }

    // path walking

    public PathWalkResult walkPath(List<?> path) {
        return walkPath(path, null, 0);
    }

    /**
     * Follow a path of labels down the sub-tables.
     * <p>
     * With {@code missingRowColumns} set, missing rows are created with the label and these columns,
     * and missing sub-tables are created (capped at {@code maxSubtableRows}, with this table's
     * aggregation operations) for every segment but the last. If a table is full, the walk stops on
     * the summary row the new row was folded into.
     * <p>
     * The walk is found as soon as the last segment's row is found, whether or not that row has a
     * sub-table; a leaf row without a sub-table is a valid destination and is not reported as a miss.
     *
     * @param path              labels, one per level
     * @param missingRowColumns default columns for created rows, or null to only look up
     * @param maxSubtableRows   row cap of created sub-tables, 0 for none
     */
    public PathWalkResult walkPath(List<?> path, Map<String, ?> missingRowColumns, int maxSubtableRows) {
        if (path == null) {
            throw new IllegalArgumentException("path required");
        }
        int length = path.size();
        if (length == 0) {
            return new PathWalkResult(null, this, 0, true);
        }

        DataTable table = this;
        Row next = null;
        for (int i = 0; i < length; i++) {
            Object segment = path.get(i);
            next = table.getRowFromLabel(segment);
            if (next == null) {
                if (missingRowColumns == null) {
                    return PathWalkResult.notFound(table, i);
                }
                Map<String, Object> columns = new LinkedHashMap<>();
                columns.put(Row.LABEL, segment);
                for (Map.Entry<String, ?> column : missingRowColumns.entrySet()) {
                    columns.putIfAbsent(column.getKey(), column.getValue());
                }
                SummaryRow row = new SummaryRow();
                row.setColumns(columns);
                next = table.addRow(row);
                if (next != row) {
                    next.deleteMetadata();
                    return new PathWalkResult(next, table, i, false);
                }
            }

            if (i == length - 1) {
                break;
            }
            DataTable subtable = next.getSubtable();
            if (subtable == null) {
                if (missingRowColumns == null) {
                    return PathWalkResult.notFound(table, i);
                }
                subtable = new DataTable(arena);
                subtable.setMaximumAllowedRows(maxSubtableRows);
                subtable.setColumnAggregationOperations(columnAggregationOperations);
                next.setSubtable(subtable);
                next.deleteMetadata();
            }
            table = subtable;
        }
        return new PathWalkResult(next, table, length, true);
    }

    /**
     * A new table holding a copy of every row of every sub-table of this table. Summary rows of the
     * sub-tables are summed into one summary row.
     *
     * @param labelColumn       if not null, the parent row's label is written to this column of each
     *                          copied row; for {@code "label"} it is prepended to the existing label
     * @param useMetadataColumn write the parent label as metadata instead of as a column
     */
    public DataTable mergeSubtables(String labelColumn, boolean useMetadataColumn) {
        DataTable result = new DataTable(arena);
        AggregationPolicy policy = aggregationPolicy();
        for (Row row : getRows()) {
            DataTable subtable = row.getSubtable();
            if (subtable == null) {
                continue;
            }
            Object parentLabel = row.getLabel();
            for (Map.Entry<Integer, Row> entry : subtable.getRowsById().entrySet()) {
                Row copy = entry.getValue().copy();
                if (entry.getKey() == ID_SUMMARY_ROW) {
                    Row existing = result.getRowFromId(ID_SUMMARY_ROW);
                    if (existing == null) {
                        result.addSummaryRow(copy);
                    } else {
                        existing.sumRow(copy, true, policy);
                    }
                    continue;
                }
                if (labelColumn != null) {
                    Object newLabel = Row.LABEL.equals(labelColumn)
                            ? parentLabel + " - " + copy.getLabel()
                            : parentLabel;
                    if (useMetadataColumn) {
                        copy.setMetadata(labelColumn, newLabel);
                    } else {
                        copy.setColumn(labelColumn, newLabel);
                    }
                }
                result.addRow(copy);
            }
        }
        return result;
    }

    public DataTable mergeSubtables() {
        return mergeSubtables(null, false);
    }

    // aggregation operations

    /**
     * Choose how a column is combined when rows are summed, e.g. "min".
     *
     * @throws TableTreeException if the operation is not registered
     */
    public void setColumnAggregationOperation(String columnName, String operation) {
        if (columnName == null) {
            throw new IllegalArgumentException("columnName required");
        }
        if (!arena.getConfiguration().aggregationRegistry().contains(operation)) {
            throw new TableTreeException("Unknown operation '" + operation + "'.");
        }
        columnAggregationOperations.put(columnName, operation);
    }

    public void setColumnAggregationOperations(Map<String, String> operations) {
        if (operations == null) {
            return;
        }
        for (Map.Entry<String, String> entry : operations.entrySet()) {
            setColumnAggregationOperation(entry.getKey(), entry.getValue());
        }
    }

    public Map<String, String> getColumnAggregationOperations() {
        return Collections.unmodifiableMap(columnAggregationOperations);
    }

    public AggregationPolicy aggregationPolicy() {
        return new AggregationPolicy(arena.getConfiguration().aggregationRegistry(), columnAggregationOperations);
    }

    // lifecycle

    /**
     * Release the rows and mark this table deleted in its arena. Sub-tables are left alone; they
     * belong to whoever manages the arena.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        rows.clear();
        summaryRow = null;
        index.clear();
        queuedFilters.clear();
        if (!arena.isClosed()) {
            arena.markDeleted(id);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Whether {@code label} is the reserved summary-row label, whatever its integral box type.
     */
    public static boolean isSummaryLabel(Object label) {
        return label instanceof Number number && Values.isIntegral(number) && number.longValue() == ID_SUMMARY_ROW;
    }

    @Override
    public String toString() {
        return "DataTable{id=" + id
                + ", rows=" + rows.size()
                + ", summaryRow=" + (summaryRow != null)
                + ", columns=" + getColumns()
                + '}';
    }

    private void renumber(List<Row> ordered) {
        rows.clear();
        int rowId = 0;
        for (Row row : ordered) {
            rows.put(rowId++, row);
        }
        nextRowId = rowId;
        index.markStale();
    }

    private void checkDepth(int depth) {
        int maximumDepth = arena.getConfiguration().maximumDepth();
        if (depth > maximumDepth) {
            throw new RecursionLimitException(maximumDepth);
        }
    }

    private static Row toRow(Object value) {
        if (value instanceof Row row) {
            return row;
        }
        if (value instanceof Map<?, ?> map) {
            return Row.fromMap(map);
        }
        throw new IllegalArgumentException("Cannot build a row from " + (value == null ? "null" : value.getClass().getName()));
    }

    private record QueuedFilter(String name, FilterFunction function, Object[] parameters) {
    }
}
