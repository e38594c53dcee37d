package gr.imsi.athenarc.tsview.datasource;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.tsview.domain.ColumnType;
import gr.imsi.athenarc.tsview.domain.NumericColumn;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.domain.TemporalColumn;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CsvTableReaderTest {

    private final CsvTableReader reader = new CsvTableReader();

    @Test
    public void testColumnsAreTypedFromTheirValues() {
        String csv = "date,load,station,,received\n"
                + "2021-01-01 00:00:00,1.5,north,7,2021-01-02\n"
                + "2021-01-01 01:00:00,,south,8,\n"
                + "2021-01-01 02:00:00,3,3,9,2021-01-04\n";

        Table table = reader.read(new StringReader(csv));

        assertEquals(3, table.getRowCount());
        assertEquals(Arrays.asList("date", "load", "station", "column_3", "received"), table.getColumnNames());
        assertEquals(ColumnType.TEMPORAL, table.getColumn("date").getType());
        assertEquals(ColumnType.NUMERIC, table.getColumn("load").getType());
        assertEquals(ColumnType.OTHER, table.getColumn("station").getType());
        assertEquals(ColumnType.NUMERIC, table.getColumn("column_3").getType());
        assertEquals(ColumnType.TEMPORAL, table.getColumn("received").getType());
        assertEquals("date", table.getTimestampColumn());

        assertTrue(table.getColumn("load").isNull(1));
        assertTrue(table.getColumn("received").isNull(1));
        assertEquals(1_609_462_800_000L, table.getTemporalColumn("date").getMillis(1));
    }

    @Test
    public void testHeaderOnlyFileGivesEmptyTable() {
        Table table = reader.read(new StringReader("ts,value\n"));
        assertTrue(table.isEmpty());
        assertEquals(Arrays.asList("ts", "value"), table.getColumnNames());
    }

    @Test
    public void testWrittenTableReadsBackTheSame() {
        Table table = new Table(Arrays.asList(
                TemporalColumn.of("ts", 1_609_459_200_000L, 1_609_459_201_500L),
                NumericColumn.of("value", 1.5, Double.NaN),
                NumericColumn.of("count", 2, 3)), "ts");
        StringWriter out = new StringWriter();

        new CsvTableWriter().write(table, out);

        assertEquals(table, reader.read(new StringReader(out.toString())));
    }
}
