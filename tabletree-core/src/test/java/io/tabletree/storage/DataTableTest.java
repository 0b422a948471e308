package io.tabletree.storage;

import io.tabletree.core.ConversionException;
import io.tabletree.core.RecursionLimitException;
import io.tabletree.core.TableArena;
import io.tabletree.core.TableTreeConfiguration;
import io.tabletree.core.TableTreeException;
import io.tabletree.core.UnknownRowException;
import io.tabletree.core.UnserializationException;
import io.tabletree.index.LabelIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.tabletree.testutil.TestArenas.row;
import static io.tabletree.testutil.TestArenas.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataTableTest {

    private TableArena arena;

    @BeforeEach
    void setUp() {
        arena = new TableArena();
    }

    @AfterEach
    void tearDown() {
        arena.close();
    }

    @Test
    void addRowAssignsDenseIds() {
        DataTable table = table(arena, row("a", "visits", 1), row("b", "visits", 2));

        assertThat(table.getRowFromId(0).getLabel()).isEqualTo("a");
        assertThat(table.getRowFromId(1).getLabel()).isEqualTo("b");
        assertThat(table.getRowsCount()).isEqualTo(2);
        assertThat(table.getSummaryRow()).isNull();
    }

    @Test
    void rowsBeyondMaximumAreFoldedIntoSummaryRow() {
        DataTable table = new DataTable(arena);
        table.setMaximumAllowedRows(2);

        table.addRow(row("a", "visits", 10));
        table.addRow(row("b", "visits", 5));
        Row returned = table.addRow(row("c", "visits", 7));

        assertThat(table.getRowsCount()).isEqualTo(2);
        assertThat(table.getRowsWithoutSummaryRow()).extracting(Row::getLabel).containsExactly("a");
        assertThat(returned).isSameAs(table.getSummaryRow());
        assertThat(table.getSummaryRow().getColumns())
                .containsEntry("label", DataTable.LABEL_SUMMARY_ROW)
                .containsEntry("visits", 12L);
    }

    @Test
    void overflowKeepsRowCountAtMaximumAndSumsAllOverflowedRows() {
        DataTable table = new DataTable(arena);
        table.setMaximumAllowedRows(3);

        for (int i = 1; i <= 6; i++) {
            table.addRow(row("row" + i, "visits", i));
            assertThat(table.getRowsCount()).isLessThanOrEqualTo(3);
        }

        assertThat(table.getRowsCount()).isEqualTo(3);
        assertThat(table.getSummaryRow().getColumn("visits")).isEqualTo(3L + 4 + 5 + 6);
    }

    @Test
    void mergeOfDisjointTablesKeepsEveryRow() {
        DataTable left = table(arena, row("a", "visits", 1), row("b", "visits", 2));
        DataTable right = table(arena, row("c", "visits", 3));

        left.addDataTable(right);

        assertThat(left.getRowsCount()).isEqualTo(3);
        assertThat(Row.isEqual(left.getRowFromLabel("a"), row("a", "visits", 1))).isTrue();
        assertThat(Row.isEqual(left.getRowFromLabel("c"), right.getRowFromLabel("c"))).isTrue();
    }

    @Test
    void mergeOfOverlappingTablesSumsColumns() {
        DataTable left = table(arena, row("a", "visits", 1, "actions", 4), row("b", "visits", 2));
        DataTable right = table(arena, row("a", "visits", 10, "actions", 1), row("b", "visits", 20));

        left.addDataTable(right);

        assertThat(left.getRowsCount()).isEqualTo(2);
        assertThat(left.getRowFromLabel("a").getColumns()).containsEntry("visits", 11L).containsEntry("actions", 5L);
        assertThat(left.getRowFromLabel("b").getColumn("visits")).isEqualTo(22L);
    }

    @Test
    void mergeDoesNotShareRowsWithSource() {
        DataTable left = new DataTable(arena);
        DataTable right = table(arena, row("a", "visits", 1));

        left.addDataTable(right);
        left.addDataTable(right);

        assertThat(left.getRowFromLabel("a").getColumn("visits")).isEqualTo(2L);
        assertThat(right.getRowFromLabel("a").getColumn("visits")).isEqualTo(1);
    }

    @Test
    void mergeUsesColumnAggregationOperation() {
        DataTable left = table(arena, row("a", "visits", 5), row("b", "visits", 3));
        left.setColumnAggregationOperation("visits", "max");

        left.addDataTable(table(arena, row("a", "visits", 9)));

        assertThat(left.getRowFromLabel("a").getColumn("visits")).isEqualTo(9);
        assertThat(left.getRowFromLabel("b").getColumn("visits")).isEqualTo(3);
    }

    @Test
    void mergeRoutesSummaryLabelToSummaryRow() {
        DataTable left = table(arena, row("a", "visits", 1));
        DataTable right = table(arena, row("b", "visits", 2));
        right.addSummaryRow(row(DataTable.LABEL_SUMMARY_ROW, "visits", 4));

        left.addDataTable(right);
        left.addDataTable(right);

        assertThat(left.getRowsCount()).isEqualTo(3);
        assertThat(left.getSummaryRow().getColumn("visits")).isEqualTo(8L);
    }

    @Test
    void mergeCombinesSubtablesRecursively() {
        Row leftRow = row("a", "visits", 1);
        leftRow.setSubtable(table(arena, row("x", "visits", 1)));
        Row leftWithoutSubtable = row("b", "visits", 1);
        DataTable left = table(arena, leftRow, leftWithoutSubtable);

        Row rightRow = row("a", "visits", 1);
        rightRow.setSubtable(table(arena, row("x", "visits", 2), row("y", "visits", 3)));
        Row rightB = row("b", "visits", 1);
        rightB.setSubtable(table(arena, row("z", "visits", 5)));
        DataTable right = table(arena, rightRow, rightB);

        left.addDataTable(right);

        DataTable mergedA = left.getRowFromLabel("a").getSubtable();
        assertThat(mergedA.getRowFromLabel("x").getColumn("visits")).isEqualTo(3L);
        assertThat(mergedA.getRowFromLabel("y").getColumn("visits")).isEqualTo(3);
        DataTable createdB = left.getRowFromLabel("b").getSubtable();
        assertThat(createdB).isNotNull().isNotSameAs(rightB.getSubtable());
        assertThat(createdB.getRowFromLabel("z").getColumn("visits")).isEqualTo(5);
    }

    @Test
    void labelLookupSwitchesIndexToContinuousMaintenance() {
        DataTable table = table(arena, row("a"), row("b"));
        assertThat(table.getIndexState()).isEqualTo(LabelIndex.State.STALE);

        assertThat(table.getRowIdFromLabel("b")).isEqualTo(1);
        assertThat(table.isIndexContinuous()).isTrue();
        assertThat(table.getIndexState()).isEqualTo(LabelIndex.State.FRESH);

        table.addRow(row("c"));
        assertThat(table.getIndexState()).isEqualTo(LabelIndex.State.FRESH);
        assertThat(table.getRowIdFromLabel("c")).isEqualTo(2);

        table.deleteRow(0);
        assertThat(table.getIndexState()).isEqualTo(LabelIndex.State.STALE);
        assertThat(table.getRowFromLabel("a")).isNull();
    }

    @Test
    void duplicateLabelResolvesToLastRow() {
        DataTable table = table(arena, row("a", "visits", 1), row("a", "visits", 2));

        assertThat(table.getRowIdFromLabel("a")).isEqualTo(1);

        table.addRow(row("a", "visits", 3));
        assertThat(table.getRowIdFromLabel("a")).isEqualTo(2);
    }

    @Test
    void labelLookupComparesStringForms() {
        DataTable table = table(arena, row(3, "visits", 1));

        assertThat(table.getRowFromLabel(3L)).isNotNull();
        assertThat(table.getRowFromLabel("3")).isNotNull();
        assertThat(table.getRowFromLabel(3.0)).isNotNull();
        assertThat(table.getRowFromLabel(null)).isNull();
        assertThat(table.getRowFromLabel("missing")).isNull();
    }

    @Test
    void summaryLabelResolvesToSummaryRow() {
        DataTable table = table(arena, row("a"));
        Row summary = table.addSummaryRow(row(DataTable.LABEL_SUMMARY_ROW, "visits", 3));

        assertThat(table.getRowFromLabel(-1L)).isSameAs(summary);
        assertThat(table.getRowIdFromLabel(-1)).isEqualTo(DataTable.ID_SUMMARY_ROW);
        assertThat(table.getRowFromId(DataTable.ID_SUMMARY_ROW)).isSameAs(summary);
    }

    @Test
    void serializationKeysRootByZeroAndSubtablesById() {
        new DataTable(arena);
        new DataTable(arena);
        DataTable root = new DataTable(arena);
        DataTable subtable = table(arena, row("x", "visits", 2));
        Row parent = row("a", "visits", 1);
        parent.setSubtable(subtable);
        root.addRow(parent);
        assertThat(root.getId()).isNotZero();

        Map<Integer, byte[]> serialized = root.getSerialized();

        assertThat(serialized).containsOnlyKeys(0, subtable.getId());
        assertThat(serialized.keySet()).containsExactly(subtable.getId(), 0);
        Map<Integer, Map<?, ?>> rootRows = TableBlobCodec.decode(serialized.get(0));
        assertThat(rootRows.get(0).get(Row.SUBTABLE_ID)).isEqualTo((long) subtable.getId());
        assertThat(TableBlobCodec.decode(serialized.get(subtable.getId()))).containsOnlyKeys(0);
        assertThat(parent.isSubtableLoaded()).isFalse();
    }

    @Test
    void serializedTreeRoundTripsIntoAnotherArena() {
        DataTable root = table(arena, row("a", "visits", 3), row("b", "visits", 1.5));
        root.getRowFromLabel("a").setMetadata("url", "http://a");
        DataTable level1 = table(arena, row("x", "visits", 2));
        DataTable level2 = table(arena, row("deep", "visits", 1));
        level1.getRowFromLabel("x").setSubtable(level2);
        root.getRowFromLabel("a").setSubtable(level1);
        root.addSummaryRow(row(DataTable.LABEL_SUMMARY_ROW, "visits", 9));

        Map<Integer, byte[]> serialized = root.getSerialized();

        try (var other = new TableArena()) {
            DataTable loaded = DataTable.fromSerializedTree(other, serialized);

            assertThat(serialized).hasSize(3);
            assertThat(DataTable.isEqualRecursive(root, loaded)).isTrue();
            assertThat(loaded.getRowFromLabel("a").getMetadata("url")).isEqualTo("http://a");
            assertThat(loaded.getRowFromLabel("a").getSubtable().getArena()).isSameAs(other);
            assertThat(loaded.getSummaryRow().getColumn("visits")).isEqualTo(9L);
        }
    }

    @Test
    void serializedTreeKeepsNonFiniteDoubles() {
        DataTable root = table(arena, row("a", "rate", Double.NaN, "growth", Double.POSITIVE_INFINITY));
        root.getRowFromLabel("a").setSubtable(table(arena, row("x", "rate", Double.NEGATIVE_INFINITY)));

        DataTable loaded = DataTable.fromSerializedTree(arena, root.getSerialized());

        Row row = loaded.getRowFromLabel("a");
        assertThat(row.getColumn("rate")).isEqualTo(Double.NaN);
        assertThat(row.getColumn("growth")).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(row.getSubtable().getRowFromLabel("x").getColumn("rate")).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    void serializationTruncatesSubtablesWhenFiltersAreRecursive() {
        DataTable subtable = table(arena, row("x", "visits", 1), row("y", "visits", 1), row("z", "visits", 1));
        DataTable root = table(arena, row("a", "visits", 3));
        root.getRowFromLabel("a").setSubtable(subtable);
        root.enableRecursiveFilters();

        Map<Integer, byte[]> serialized = root.getSerialized(2, null, null);

        DataTable loadedSubtable = DataTable.fromSerializedArray(arena, serialized.get(subtable.getId()));
        assertThat(loadedSubtable.getRowsWithoutSummaryRow()).extracting(Row::getLabel).containsExactly("x");
        assertThat(loadedSubtable.getSummaryRow().getColumn("visits")).isEqualTo(2L);
    }

    @Test
    void isEqualRecursiveDetectsSubtableDifference() {
        DataTable left = table(arena, row("a"));
        left.getRowFromLabel("a").setSubtable(table(arena, row("x", "visits", 1)));
        DataTable right = table(arena, row("a"));
        right.getRowFromLabel("a").setSubtable(table(arena, row("x", "visits", 2)));

        assertThat(DataTable.isEqual(left, right)).isTrue();
        assertThat(DataTable.isEqualRecursive(left, right)).isFalse();
    }

    @Test
    void serializationTruncatesBeforeEncoding() {
        DataTable table = table(arena,
                row("a", "visits", 1),
                row("b", "visits", 5),
                row("c", "visits", 3),
                row("d", "visits", 4),
                row("e", "visits", 2));

        Map<Integer, byte[]> serialized = table.getSerialized(3, null, "visits");

        DataTable loaded = DataTable.fromSerializedArray(arena, serialized.get(0));
        assertThat(loaded.getRowsCount()).isEqualTo(3);
        assertThat(loaded.getRowsWithoutSummaryRow()).extracting(Row::getLabel).containsExactly("b", "d");
        assertThat(loaded.getSummaryRow().getColumn("visits")).isEqualTo(6L);
    }

    @Test
    void cyclicSubtableReferenceFailsWithRecursionLimit() {
        try (var shallow = new TableArena(TableTreeConfiguration.builder().maximumDepth(3).build())) {
            DataTable table = new DataTable(shallow);
            Row row = row("loop", "visits", 1);
            row.setSubtable(table);
            table.addRow(row);

            assertThatThrownBy(table::getSerialized)
                    .isInstanceOf(RecursionLimitException.class)
                    .satisfies(e -> assertThat(((RecursionLimitException) e).getMaximumDepth()).isEqualTo(3));
            assertThatThrownBy(table::getRowsCountRecursive).isInstanceOf(RecursionLimitException.class);
        }
    }

    @Test
    void fromSerializedTreeFailsWithoutRoot() {
        assertThatThrownBy(() -> DataTable.fromSerializedTree(arena, Map.of(4, new byte[]{1})))
                .isInstanceOf(UnserializationException.class);
    }

    @Test
    void corruptBlobFailsToLoad() {
        DataTable table = new DataTable(arena);

        assertThatThrownBy(() -> table.addRowsFromSerializedArray("[1,2]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(UnserializationException.class);
    }

    @Test
    void addRowsFromArrayRoutesSummaryKey() {
        Map<Integer, Object> rows = new LinkedHashMap<>();
        rows.put(0, Map.of(Row.COLUMNS, Map.of("label", "a", "visits", 1)));
        rows.put(1, row("b", "visits", 2));
        rows.put(DataTable.ID_SUMMARY_ROW, Map.of(Row.COLUMNS, Map.of("label", -1, "visits", 7)));
        DataTable table = new DataTable(arena);

        table.addRowsFromArray(rows);

        assertThat(table.getRowsCountWithoutSummaryRow()).isEqualTo(2);
        assertThat(table.getSummaryRow().getColumn("visits")).isEqualTo(7);
        assertThat(table.getLastRow()).isSameAs(table.getSummaryRow());
    }

    @Test
    void deleteRowKeepsOtherIds() {
        DataTable table = table(arena, row("a"), row("b"), row("c"));
        table.addSummaryRow(row(DataTable.LABEL_SUMMARY_ROW));

        table.deleteRow(1);
        table.deleteRow(DataTable.ID_SUMMARY_ROW);

        assertThat(table.getRowsById()).containsOnlyKeys(0, 2);
        assertThat(table.getSummaryRow()).isNull();
    }

    @Test
    void deleteUnknownRowFails() {
        DataTable table = table(arena, row("a"));

        assertThatThrownBy(() -> table.deleteRow(5))
                .isInstanceOf(UnknownRowException.class)
                .hasMessage("Trying to delete unknown row with id 5");
    }

    @Test
    void deleteRowsOffsetRenumbersAndDropsSummaryWhenReachingEnd() {
        DataTable table = table(arena, row("a"), row("b"), row("c"), row("d"), row("e"));
        table.addSummaryRow(row(DataTable.LABEL_SUMMARY_ROW));

        assertThat(table.deleteRowsOffset(1, 2)).isEqualTo(2);
        assertThat(table.getRowsWithoutSummaryRow()).extracting(Row::getLabel).containsExactly("a", "d", "e");
        assertThat(table.getRowFromId(1).getLabel()).isEqualTo("d");
        assertThat(table.getSummaryRow()).isNotNull();

        assertThat(table.deleteRowsOffset(1, null)).isEqualTo(2);
        assertThat(table.getRowsCount()).isEqualTo(1);
        assertThat(table.getSummaryRow()).isNull();
    }

    @Test
    void deleteRowsOffsetRejectsNegativeLimit() {
        DataTable table = table(arena, row("a"));

        assertThatThrownBy(() -> table.deleteRowsOffset(0, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sortRenumbersRowsAndKeepsSummaryLast() {
        DataTable table = table(arena, row("b", "visits", 1), row("a", "visits", 3), row("c", "visits", 2));
        table.addSummaryRow(row(DataTable.LABEL_SUMMARY_ROW, "visits", 100));
        Comparator<Row> byVisitsDesc = Comparator.comparing((Row r) -> ((Number) r.getColumn("visits")).intValue()).reversed();

        table.sort(byVisitsDesc, "visits");

        assertThat(table.getRows()).extracting(Row::getLabel).containsExactly("a", "c", "b", DataTable.LABEL_SUMMARY_ROW);
        assertThat(table.getRowFromId(0).getLabel()).isEqualTo("a");
        assertThat(table.getRowIdFromLabel("b")).isEqualTo(2);
        assertThat(table.getSortedByColumnName()).isEqualTo("visits");
    }

    @Test
    void recursiveSortSortsSubtables() {
        DataTable subtable = table(arena, row("x", "visits", 1), row("y", "visits", 2));
        DataTable table = table(arena, row("a", "visits", 1));
        table.getRowFromLabel("a").setSubtable(subtable);
        table.enableRecursiveSort();

        table.sort(Comparator.comparing((Row r) -> ((Number) r.getColumn("visits")).intValue()).reversed(), "visits");

        assertThat(subtable.getRows()).extracting(Row::getLabel).containsExactly("y", "x");
    }

    @Test
    void columnAccessorsProjectAcrossRows() {
        DataTable table = table(arena, row("a", "nb_visits", 1, "nb_actions", 2), row("b", "nb_visits", 3));
        table.getRowFromLabel("a").setMetadata("url", "http://a");

        assertThat(table.getColumns()).containsExactly("label", "nb_visits", "nb_actions");
        assertThat(table.getColumn("nb_actions")).containsExactly(2, null);
        assertThat(table.getColumnsStartingWith("nb_")).containsExactly(1, 2, 3);
        assertThat(table.getRowsMetadata("url")).containsExactly("http://a", null);
    }

    @Test
    void deleteColumnsRecursesOnlyWhenAsked() {
        DataTable subtable = table(arena, row("x", "visits", 1));
        DataTable table = table(arena, row("a", "visits", 1));
        table.getRowFromLabel("a").setSubtable(subtable);

        table.deleteColumns(List.of("visits"), false);
        assertThat(table.getFirstRow().hasColumn("visits")).isFalse();
        assertThat(subtable.getFirstRow().hasColumn("visits")).isTrue();

        table.deleteColumns(List.of("visits"), true);
        assertThat(subtable.getFirstRow().hasColumn("visits")).isFalse();
    }

    @Test
    void renameColumnAppliesToSubtables() {
        DataTable subtable = table(arena, row("x", "nb_visits", 1));
        DataTable table = table(arena, row("a", "nb_visits", 1));
        table.getRowFromLabel("a").setSubtable(subtable);

        table.renameColumn("nb_visits", "visits");

        assertThat(table.getFirstRow().getColumn("visits")).isEqualTo(1);
        assertThat(subtable.getFirstRow().getColumn("visits")).isEqualTo(1);
    }

    @Test
    void rowsCountRecursiveIncludesSubtables() {
        DataTable subtable = table(arena, row("x"), row("y"), row("z"));
        subtable.addSummaryRow(row(DataTable.LABEL_SUMMARY_ROW));
        DataTable table = table(arena, row("a"), row("b"));
        table.getRowFromLabel("a").setSubtable(subtable);

        assertThat(table.getRowsCountRecursive()).isEqualTo(6);
    }

    @Test
    void lookupKeepsLargeNumericLabelsApart() {
        DataTable table = table(arena,
                row(1e20, "v", 1),
                row(1e21, "v", 2),
                row(Long.MAX_VALUE, "v", 3));

        assertThat(table.getRowFromLabel(1e20).getColumn("v")).isEqualTo(1);
        assertThat(table.getRowFromLabel(1e21).getColumn("v")).isEqualTo(2);
        assertThat(table.getRowFromLabel(Long.MAX_VALUE).getColumn("v")).isEqualTo(3);
        assertThat(table.getRowFromLabel(0x1p63)).isNull();
    }

    @Test
    void mergingPromotesOverflowingSumToDouble() {
        DataTable table = table(arena, row("a", "hits", Long.MAX_VALUE));

        table.addDataTable(table(arena, row("a", "hits", 1L)));

        assertThat(table.getRowFromLabel("a").getColumn("hits")).isEqualTo(0x1p63);
    }

    @Test
    void walkPathFindsLeafRowWithoutSubtable() {
        DataTable table = table(arena, row("a"));

        PathWalkResult result = table.walkPath(List.of("a"));

        assertThat(result.found()).isTrue();
        assertThat(result.row()).isSameAs(table.getRowFromLabel("a"));
        assertThat(result.row().getSubtable()).isNull();
    }

    @Test
    void walkPathOnEmptyPathReturnsTable() {
        DataTable table = table(arena, row("a"));

        PathWalkResult result = table.walkPath(List.of());

        assertThat(result).isEqualTo(new PathWalkResult(null, table, 0, true));
    }

    @Test
    void walkPathFailsAtFirstMissingSegment() {
        DataTable table = table(arena, row("a"));

        PathWalkResult missingFirst = table.walkPath(List.of("b"));
        PathWalkResult missingSubtable = table.walkPath(List.of("a", "x"));

        assertThat(missingFirst.found()).isFalse();
        assertThat(missingFirst.index()).isZero();
        assertThat(missingFirst.table()).isSameAs(table);
        assertThat(missingSubtable.found()).isFalse();
        assertThat(missingSubtable.isPartial()).isFalse();
    }

    @Test
    void walkPathCreatesMissingRowsAndSubtables() {
        DataTable table = new DataTable(arena);
        table.setColumnAggregationOperation("max_time", "max");

        PathWalkResult created = table.walkPath(List.of("a", "b"), Map.of("visits", 0), 10);

        assertThat(created.found()).isTrue();
        assertThat(created.index()).isEqualTo(2);
        assertThat(created.row().getColumns()).containsEntry("label", "b").containsEntry("visits", 0);
        assertThat(table.getRowFromLabel("a")).isInstanceOf(SummaryRow.class);
        DataTable subtable = table.getRowFromLabel("a").getSubtable();
        assertThat(created.table()).isSameAs(subtable);
        assertThat(subtable.getMaximumAllowedRows()).isEqualTo(10);
        assertThat(subtable.getColumnAggregationOperations()).containsEntry("max_time", "max");

        PathWalkResult found = table.walkPath(List.of("a", "b"));
        assertThat(found.row()).isSameAs(created.row());
    }

    @Test
    void walkPathStopsOnSummaryRowOfFullTable() {
        DataTable table = table(arena, row("x", "visits", 1));
        table.setMaximumAllowedRows(2);

        PathWalkResult result = table.walkPath(List.of("y", "z"), Map.of("visits", 4), 0);

        assertThat(result.found()).isFalse();
        assertThat(result.isPartial()).isTrue();
        assertThat(result.index()).isZero();
        assertThat(result.row()).isSameAs(table.getSummaryRow());
        assertThat(result.row().getColumn("visits")).isEqualTo(4);
    }

    @Test
    void mergeSubtablesFlattensWithParentLabels() {
        DataTable subA = table(arena, row("x", "visits", 1), row("y", "visits", 2));
        subA.addSummaryRow(row(DataTable.LABEL_SUMMARY_ROW, "visits", 5));
        DataTable subB = table(arena, row("x", "visits", 3));
        subB.addSummaryRow(row(DataTable.LABEL_SUMMARY_ROW, "visits", 7));
        DataTable table = table(arena, row("A"), row("B"), row("C"));
        table.getRowFromLabel("A").setSubtable(subA);
        table.getRowFromLabel("B").setSubtable(subB);

        DataTable prefixed = table.mergeSubtables(Row.LABEL, false);
        DataTable withMetadata = table.mergeSubtables("parent", true);

        assertThat(prefixed.getRowsWithoutSummaryRow()).extracting(Row::getLabel)
                .containsExactly("A - x", "A - y", "B - x");
        assertThat(prefixed.getSummaryRow().getColumn("visits")).isEqualTo(12L);
        assertThat(withMetadata.getRowsWithoutSummaryRow()).extracting(r -> r.getMetadata("parent"))
                .containsExactly("A", "A", "B");
        assertThat(subA.getFirstRow().getLabel()).isEqualTo("x");
    }

    @Test
    void makeFromSimpleArrayConvertsListOfRows() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("label", "a");
        first.put("visits", 1);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("label", "b");
        second.put("visits", 2);

        DataTable table = DataTable.makeFromSimpleArray(arena, List.of(first, second));

        assertThat(table.getRowsCount()).isEqualTo(2);
        assertThat(table.getRowFromLabel("b").getColumn("visits")).isEqualTo(2);
    }

    @Test
    void makeFromSimpleArrayConvertsScalars() {
        DataTable list = DataTable.makeFromSimpleArray(arena, List.of(4, 5, 6));
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("visits", 3);
        map.put("actions", 1);
        DataTable single = DataTable.makeFromSimpleArray(arena, map);

        assertThat(list.getColumn("0")).containsExactly(4, 5, 6);
        assertThat(single.getRowsCount()).isEqualTo(1);
        assertThat(single.getFirstRow().getColumns()).containsEntry("visits", 3).containsEntry("actions", 1);
    }

    @Test
    void simpleArrayWithNestedMapUnderNamedKeyFailsAfterLoadingEarlierRows() {
        Map<Object, Object> array = new LinkedHashMap<>();
        array.put(0, Map.of("visits", 1));
        array.put("named", Map.of("visits", 2));
        DataTable table = new DataTable(arena);

        assertThatThrownBy(() -> table.addRowsFromSimpleArray(array))
                .isInstanceOf(ConversionException.class);
        assertThat(table.getRowsCount()).isEqualTo(1);
    }

    @Test
    void makeFromIndexedArrayPutsLabelFirst() {
        Map<String, Object> array = new LinkedHashMap<>();
        array.put("Google", Map.of("visits", 3));
        array.put("Bing", 2);
        DataTable keywords = table(arena, row("shoes"));

        DataTable table = DataTable.makeFromIndexedArray(arena, array, Map.of("Google", keywords));

        assertThat(table.getColumns()).containsExactly("label", "visits");
        assertThat(table.getRowFromLabel("Bing").getColumn("value")).isEqualTo(2);
        assertThat(table.getRowFromLabel("Google").getSubtable()).isSameAs(keywords);
    }

    @Test
    void emptyCloneKeepsMetadataAndOptionallyFilters() {
        DataTable table = table(arena, row("a"));
        table.setMetadata(DataTable.ARCHIVED_DATE_METADATA_NAME, "2024-01-01");
        table.queueFilter("Limit", 0, 1);

        DataTable withFilters = table.getEmptyClone(true);
        DataTable withoutFilters = table.getEmptyClone(false);

        assertThat(withFilters.getRowsCount()).isZero();
        assertThat(withFilters.getQueuedFiltersCount()).isEqualTo(1);
        assertThat(withoutFilters.getQueuedFiltersCount()).isZero();
        assertThat(withoutFilters.getMetadata(DataTable.ARCHIVED_DATE_METADATA_NAME)).isEqualTo("2024-01-01");
    }

    @Test
    void unknownAggregationOperationIsRejected() {
        DataTable table = new DataTable(arena);

        assertThatThrownBy(() -> table.setColumnAggregationOperation("visits", "avg"))
                .isInstanceOf(TableTreeException.class)
                .hasMessage("Unknown operation 'avg'.");
    }

    @Test
    void closeReleasesRowsAndDeregisters() {
        DataTable table = table(arena, row("a"));

        table.close();

        assertThat(table.isClosed()).isTrue();
        assertThat(table.getRowsCount()).isZero();
        assertThat(arena.isDeleted(table.getId())).isTrue();
    }
}
