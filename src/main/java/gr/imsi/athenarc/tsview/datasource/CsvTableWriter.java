package gr.imsi.athenarc.tsview.datasource;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.tsview.domain.Column;
import gr.imsi.athenarc.tsview.domain.DateTimeUtil;
import gr.imsi.athenarc.tsview.domain.NumericColumn;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.domain.TemporalColumn;

import java.io.Writer;
import java.util.List;

/**
 * Writes a {@link Table} as CSV with a header row. Timestamps are written in UTC as
 * {@code yyyy-MM-dd HH:mm:ss.SSS}, nulls as empty cells.
 */
public class CsvTableWriter {

    public void write(Table table, Writer writer) {
        CsvWriterSettings csvWriterSettings = new CsvWriterSettings();
        CsvWriter csvWriter = new CsvWriter(writer, csvWriterSettings);
        List<Column> columns = table.getColumns();
        csvWriter.writeHeaders(table.getColumnNames());
        Object[] row = new Object[columns.size()];
        for (int r = 0; r < table.getRowCount(); r++) {
            for (int c = 0; c < columns.size(); c++) {
                row[c] = cell(columns.get(c), r);
            }
            csvWriter.writeRow(row);
        }
        csvWriter.flush();
    }

    private static Object cell(Column column, int row) {
        if (column.isNull(row)) {
            return null;
        }
        if (column instanceof TemporalColumn) {
            return DateTimeUtil.format(((TemporalColumn) column).getMillis(row));
        }
        if (column instanceof NumericColumn) {
            return ((NumericColumn) column).getDouble(row);
        }
        return column.getObject(row);
    }
}
