package gr.imsi.athenarc.tsview.datasource;

import com.univocity.parsers.common.processor.RowListProcessor;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.domain.Column;
import gr.imsi.athenarc.tsview.domain.DateTimeUtil;
import gr.imsi.athenarc.tsview.domain.NumericColumn;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.domain.TemporalColumn;
import gr.imsi.athenarc.tsview.domain.TextColumn;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a CSV file with a header row into a typed {@link Table}. Each column is typed by looking at
 * all of its non-blank values: numeric if every value is a number, temporal if every value is a date
 * or date-time, text otherwise. Blank cells are nulls.
 */
public class CsvTableReader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvTableReader.class);

    public Table read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Table table = read(reader);
            LOG.debug("Read {} rows and {} columns from {}", table.getRowCount(), table.getColumns().size(), file);
            return table;
        }
    }

    /**
     * Parses CSV content. The first temporal column, if any, becomes the designated timestamp column.
     */
    public Table read(Reader reader) {
        RowListProcessor processor = new RowListProcessor();
        CsvParserSettings settings = new CsvParserSettings();
        settings.setHeaderExtractionEnabled(true);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setMaxCharsPerColumn(-1);
        settings.setProcessor(processor);
        new CsvParser(settings).parse(reader);

        String[] headers = processor.getHeaders();
        List<String[]> rows = processor.getRows();
        if (headers == null) {
            return new Table(new ArrayList<>());
        }

        List<Column> columns = new ArrayList<>(headers.length);
        String timestampColumn = null;
        for (int c = 0; c < headers.length; c++) {
            String name = headers[c] == null || headers[c].trim().isEmpty() ? "column_" + c : headers[c].trim();
            String[] cells = new String[rows.size()];
            for (int r = 0; r < rows.size(); r++) {
                String[] row = rows.get(r);
                String cell = c < row.length ? row[c] : null;
                cells[r] = cell == null || cell.trim().isEmpty() ? null : cell.trim();
            }
            Column column = typeColumn(name, cells);
            if (timestampColumn == null && column instanceof TemporalColumn) {
                timestampColumn = name;
            }
            columns.add(column);
        }
        return new Table(columns, timestampColumn);
    }

    static Column typeColumn(String name, String[] cells) {
        double[] numbers = asNumbers(cells);
        if (numbers != null) {
            return new NumericColumn(name, numbers);
        }
        long[] timestamps = asTimestamps(cells);
        if (timestamps != null) {
            return new TemporalColumn(name, timestamps);
        }
        return new TextColumn(name, cells);
    }

    private static double[] asNumbers(String[] cells) {
        double[] values = new double[cells.length];
        boolean any = false;
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == null) {
                values[i] = Double.NaN;
                continue;
            }
            try {
                values[i] = Double.parseDouble(cells[i]);
                any = true;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return any ? values : null;
    }

    private static long[] asTimestamps(String[] cells) {
        long[] values = new long[cells.length];
        boolean any = false;
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == null) {
                values[i] = TemporalColumn.NULL;
                continue;
            }
            Long millis = DateTimeUtil.tryParse(cells[i]);
            if (millis == null) {
                return null;
            }
            values[i] = millis;
            any = true;
        }
        return any ? values : null;
    }
}
