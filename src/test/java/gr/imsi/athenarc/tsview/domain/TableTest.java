package gr.imsi.athenarc.tsview.domain;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TableTest {

    private static Table sample() {
        return new Table(Arrays.asList(
                TemporalColumn.of("ts", 0, 1000, 2000, 3000, 4000),
                NumericColumn.of("a", 1, 2, 3, 4, 5),
                TextColumn.of("tag", "p", "q", "r", "s", "t")), "ts");
    }

    @Test
    public void testSliceSelectsRowRange() {
        Table slice = sample().slice(1, 3);
        assertEquals(3, slice.getRowCount());
        assertEquals(NumericColumn.of("a", 2, 3, 4), slice.getColumn("a"));
        assertEquals("ts", slice.getTimestampColumn());
    }

    @Test
    public void testSliceIsClampedToTheTable() {
        Table table = sample();
        assertEquals(2, table.slice(3, 100).getRowCount());
        Table past = table.slice(10, 5);
        assertTrue(past.isEmpty());
        assertEquals(table.getColumnNames(), past.getColumnNames());
        assertTrue(table.slice(2, 0).isEmpty());
    }

    @Test
    public void testSliceRejectsNegativeArguments() {
        assertThrows(IllegalArgumentException.class, () -> sample().slice(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> sample().slice(0, -2));
    }

    @Test
    public void testSortIsStableAndPutsNullsFirst() {
        Table table = new Table(Arrays.asList(
                TemporalColumn.of("ts", 2000, 1000, TemporalColumn.NULL, 1000),
                TextColumn.of("tag", "late", "first", "none", "second")), "ts");

        Table sorted = table.sortBy("ts");

        assertEquals(TextColumn.of("tag", "none", "first", "second", "late"), sorted.getColumn("tag"));
        assertEquals(TemporalColumn.of("ts", TemporalColumn.NULL, 1000, 1000, 2000), sorted.getColumn("ts"));
    }

    @Test
    public void testSortOfSortedTableIsANoOp() {
        Table table = sample();
        assertSame(table, table.sortBy("ts"));
    }

    @Test
    public void testSelectKeepsRequestedOrder() {
        Table projected = sample().select(Arrays.asList("a", "ts"));
        assertEquals(Arrays.asList("a", "ts"), projected.getColumnNames());
        assertEquals("ts", projected.getTimestampColumn());

        Table withoutTimestamp = sample().select(Collections.singletonList("tag"));
        assertNull(withoutTimestamp.getTimestampColumn());
    }

    @Test
    public void testUnknownColumnIsRejected() {
        assertFalse(sample().hasColumn("b"));
        assertThrows(IllegalArgumentException.class, () -> sample().getColumn("b"));
        assertThrows(IllegalArgumentException.class, () -> sample().getTemporalColumn("a"));
    }

    @Test
    public void testConstructorValidatesColumns() {
        assertThrows(IllegalArgumentException.class, () -> new Table(Arrays.asList(
                NumericColumn.of("a", 1, 2), NumericColumn.of("b", 1))));
        assertThrows(IllegalArgumentException.class, () -> new Table(Arrays.asList(
                NumericColumn.of("a", 1), NumericColumn.of("a", 2))));
        assertThrows(IllegalArgumentException.class, () -> new Table(Arrays.asList(
                NumericColumn.of("a", 1)), "a"));
    }

    @Test
    public void testNullMarkers() {
        assertTrue(NumericColumn.of("a", Double.NaN).isNull(0));
        assertTrue(TemporalColumn.of("t", TemporalColumn.NULL).isNull(0));
        assertTrue(TextColumn.of("s", (String) null).isNull(0));
        assertNull(TextColumn.of("s", (String) null).getObject(0));
    }
}
