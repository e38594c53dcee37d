package gr.imsi.athenarc.tsview.aggregation;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.domain.Column;
import gr.imsi.athenarc.tsview.domain.ColumnType;
import gr.imsi.athenarc.tsview.domain.FrequencyEstimate;
import gr.imsi.athenarc.tsview.domain.NumericColumn;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.domain.TemporalColumn;
import gr.imsi.athenarc.tsview.domain.TextColumn;
import gr.imsi.athenarc.tsview.exception.AggregationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Downsamples a table into at most a given number of rows by averaging rows that fall into
 * regular, left-closed time windows. The window width is derived from the inferred sampling
 * frequency, or from the time span when no frequency can be inferred.
 */
public class RangeAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(RangeAggregator.class);

    private static final long MILLIS_PER_SECOND = 1000L;

    private final FrequencyInferencer frequencyInferencer;

    public RangeAggregator() {
        this(new FrequencyInferencer());
    }

    public RangeAggregator(FrequencyInferencer frequencyInferencer) {
        this.frequencyInferencer = frequencyInferencer;
    }

    /**
     * Aggregates a table so that it holds at most {@code maxPoints} rows, sorted by the timestamp column.
     * Tables that already fit are returned as they are.
     *
     * @param table the table to downsample
     * @param timestampColumn the temporal column defining the windows
     * @param maxPoints the point budget
     * @return the input table if it fits, otherwise one row per non-empty window
     * @throws AggregationException if the table is empty, the column is not temporal or
     *                              the window width collapses to zero
     */
    public Table aggregate(Table table, String timestampColumn, int maxPoints) {
        Preconditions.checkArgument(maxPoints > 0, "Point budget must be positive, got %s", maxPoints);
        if (table.isEmpty()) {
            throw new AggregationException("Cannot aggregate an empty table");
        }
        if (!table.hasColumn(timestampColumn)
                || table.getColumn(timestampColumn).getType() != ColumnType.TEMPORAL) {
            throw new AggregationException("Column " + timestampColumn + " is not a timestamp column");
        }
        if (table.getRowCount() <= maxPoints) {
            return table;
        }

        Table sorted = table.sortBy(timestampColumn);
        long[] timestamps = sorted.getTemporalColumn(timestampColumn).nonNullValues();
        if (timestamps.length == 0) {
            throw new AggregationException("Column " + timestampColumn + " holds no timestamps");
        }
        long bucketWidth = bucketWidthMillis(sorted.getRowCount(), timestamps, maxPoints);
        Table aggregated = bucket(sorted, timestampColumn, bucketWidth);
        LOG.debug("Aggregated {} rows into {} windows of {}s", table.getRowCount(),
                aggregated.getRowCount(), bucketWidth / MILLIS_PER_SECOND);
        return aggregated;
    }

    /**
     * Computes the window width in whole seconds (as milliseconds).
     *
     * @param rowCount number of rows being aggregated
     * @param timestamps sorted, non-null timestamps
     * @param maxPoints the point budget
     * @return the width in milliseconds, a positive multiple of one second
     */
    long bucketWidthMillis(int rowCount, long[] timestamps, int maxPoints) {
        long first = timestamps[0];
        long span = timestamps[timestamps.length - 1] - first;

        Duration width;
        FrequencyEstimate estimate = frequencyInferencer.estimate(timestamps);
        if (estimate.isDetermined()) {
            long pointsPerBucket = ((long) rowCount + maxPoints - 1) / maxPoints;
            width = estimate.getFrequency().get().multipliedBy(pointsPerBucket);
        } else {
            LOG.debug("Frequency undetermined ({} distinct deltas), splitting the span evenly",
                    estimate.getDistinctDeltas());
            width = Duration.ofMillis(span).dividedBy(maxPoints);
        }
        long widthMillis = width.getSeconds() * MILLIS_PER_SECOND;
        if (widthMillis <= 0) {
            throw new AggregationException("Bucket width of " + width + " truncates to zero seconds");
        }

        // Window count is span / width + 1; widen to the smallest whole-second width that fits
        if (span / widthMillis + 1 > maxPoints) {
            long widened = (span / (maxPoints * MILLIS_PER_SECOND) + 1) * MILLIS_PER_SECOND;
            LOG.debug("Widening bucket from {}ms to {}ms to stay within {} points", widthMillis, widened, maxPoints);
            widthMillis = widened;
        }
        return widthMillis;
    }

    private Table bucket(Table sorted, String timestampColumn, long bucketWidth) {
        TemporalColumn index = sorted.getTemporalColumn(timestampColumn);
        int rows = sorted.getRowCount();

        // Rows are sorted, so window ids only ever grow; map each row to its output position
        int[] outputRow = new int[rows];
        List<Long> windowStarts = new ArrayList<>();
        long origin = Long.MIN_VALUE;
        long currentWindow = -1;
        for (int row = 0; row < rows; row++) {
            if (index.isNull(row)) {
                outputRow[row] = -1;
                continue;
            }
            long t = index.getMillis(row);
            if (origin == Long.MIN_VALUE) {
                origin = t;
            }
            long window = (t - origin) / bucketWidth;
            if (window != currentWindow) {
                currentWindow = window;
                windowStarts.add(origin + window * bucketWidth);
            }
            outputRow[row] = windowStarts.size() - 1;
        }

        int windows = windowStarts.size();
        List<Column> columns = new ArrayList<>();
        for (Column column : sorted.getColumns()) {
            if (column.getName().equals(timestampColumn)) {
                long[] starts = new long[windows];
                for (int w = 0; w < windows; w++) {
                    starts[w] = windowStarts.get(w);
                }
                columns.add(new TemporalColumn(timestampColumn, starts));
            } else if (column instanceof NumericColumn) {
                columns.add(mean((NumericColumn) column, outputRow, windows));
            } else if (column instanceof TemporalColumn) {
                columns.add(firstTemporal((TemporalColumn) column, outputRow, windows));
            } else {
                columns.add(firstText((TextColumn) column, outputRow, windows));
            }
        }
        return new Table(columns, timestampColumn);
    }

    private static NumericColumn mean(NumericColumn column, int[] outputRow, int windows) {
        double[] sums = new double[windows];
        int[] counts = new int[windows];
        for (int row = 0; row < outputRow.length; row++) {
            if (outputRow[row] < 0 || column.isNull(row)) {
                continue;
            }
            sums[outputRow[row]] += column.getDouble(row);
            counts[outputRow[row]]++;
        }
        double[] means = new double[windows];
        for (int w = 0; w < windows; w++) {
            means[w] = counts[w] == 0 ? Double.NaN : sums[w] / counts[w];
        }
        return new NumericColumn(column.getName(), means);
    }

    private static TemporalColumn firstTemporal(TemporalColumn column, int[] outputRow, int windows) {
        long[] firsts = new long[windows];
        Arrays.fill(firsts, TemporalColumn.NULL);
        for (int row = 0; row < outputRow.length; row++) {
            int w = outputRow[row];
            if (w >= 0 && firsts[w] == TemporalColumn.NULL && !column.isNull(row)) {
                firsts[w] = column.getMillis(row);
            }
        }
        return new TemporalColumn(column.getName(), firsts);
    }

    private static TextColumn firstText(TextColumn column, int[] outputRow, int windows) {
        String[] firsts = new String[windows];
        for (int row = 0; row < outputRow.length; row++) {
            int w = outputRow[row];
            if (w >= 0 && firsts[w] == null && !column.isNull(row)) {
                firsts[w] = column.getString(row);
            }
        }
        return new TextColumn(column.getName(), firsts);
    }
}
