package gr.imsi.athenarc.tsview.cache;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.tsview.domain.NumericColumn;
import gr.imsi.athenarc.tsview.domain.RowRange;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.domain.TemporalColumn;
import gr.imsi.athenarc.tsview.domain.TextColumn;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TableCodecTest {

    private final TableCodec codec = new TableCodec();

    private static Table sample() {
        return new Table(Arrays.asList(
                TemporalColumn.of("ts", 1_609_459_200_123L, TemporalColumn.NULL, 1_609_459_260_456L),
                NumericColumn.of("value", 1.25, Double.NaN, -3e10),
                TextColumn.of("note", "ünïcödé", null, "")), "ts");
    }

    @Test
    public void testEntryKeepsItsRangeAndNulls() throws IOException {
        CacheEntry decoded = codec.decode(codec.encode(CacheEntry.of(RowRange.of(40, 3), sample())));

        assertEquals(RowRange.of(40, 3), decoded.getRange());
        Table table = decoded.getTable();
        assertEquals(sample(), table);
        assertEquals("ts", table.getTimestampColumn());
        assertTrue(table.getColumn("ts").isNull(1));
        assertTrue(table.getColumn("value").isNull(1));
        assertNull(table.getColumn("note").getObject(1));
        assertEquals("", table.getColumn("note").getObject(2));
    }

    @Test
    public void testDatasetEntryHasNoRange() throws IOException {
        assertNull(codec.decode(codec.encode(sample())).getRange());
    }

    @Test
    public void testEmptyTableWithoutTimestampColumn() throws IOException {
        Table empty = new Table(Arrays.asList(NumericColumn.of("a"), TextColumn.of("b")));
        Table decoded = codec.decode(codec.encode(empty)).getTable();
        assertEquals(empty, decoded);
        assertNull(decoded.getTimestampColumn());
    }

    @Test
    public void testTableFileStream() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.writeTable(sample(), out);
        assertEquals(sample(), codec.readTable(new ByteArrayInputStream(out.toByteArray())));
    }

    @Test
    public void testGarbageIsRejected() {
        assertThrows(IOException.class, () -> codec.decode("not a table".getBytes(StandardCharsets.UTF_8)));
    }
}
