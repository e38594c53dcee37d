package gr.imsi.athenarc.tsview.domain;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable, ordered, columnar table with an optional designated timestamp column.
 * Tables are value-like: every derived table (slice, sort, projection) is a new instance and
 * columns are never mutated, so a table can be shared freely between cache entries.
 */
public final class Table {

    private final Map<String, Column> columns;
    private final int rowCount;
    private final String timestampColumn;

    public Table(List<? extends Column> columns, String timestampColumn) {
        Preconditions.checkNotNull(columns, "columns");
        this.columns = new LinkedHashMap<>();
        int rows = -1;
        for (Column column : columns) {
            Preconditions.checkArgument(!this.columns.containsKey(column.getName()),
                    "Duplicate column %s", column.getName());
            if (rows < 0) {
                rows = column.size();
            }
            Preconditions.checkArgument(column.size() == rows,
                    "Column %s has %s rows, expected %s", column.getName(), column.size(), rows);
            this.columns.put(column.getName(), column);
        }
        this.rowCount = Math.max(rows, 0);
        if (timestampColumn != null) {
            Column ts = this.columns.get(timestampColumn);
            Preconditions.checkArgument(ts != null, "Unknown timestamp column %s", timestampColumn);
            Preconditions.checkArgument(ts.getType() == ColumnType.TEMPORAL,
                    "Timestamp column %s is %s", timestampColumn, ts.getType());
        }
        this.timestampColumn = timestampColumn;
    }

    public Table(List<? extends Column> columns) {
        this(columns, null);
    }

    public int getRowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public List<Column> getColumns() {
        return Collections.unmodifiableList(new ArrayList<>(columns.values()));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Column getColumn(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Unknown column " + name);
        }
        return column;
    }

    public TemporalColumn getTemporalColumn(String name) {
        Column column = getColumn(name);
        if (!(column instanceof TemporalColumn)) {
            throw new IllegalArgumentException("Column " + name + " is not temporal but " + column.getType());
        }
        return (TemporalColumn) column;
    }

    /**
     * @return the designated timestamp column name, or {@code null} if none was designated
     */
    public String getTimestampColumn() {
        return timestampColumn;
    }

    public Table withTimestampColumn(String name) {
        return new Table(new ArrayList<>(columns.values()), name);
    }

    /**
     * Returns rows {@code [offset, offset + limit)}. Like a dataframe slice the range is clamped:
     * an offset past the last row gives an empty table and a limit running past the end is cut.
     *
     * @param offset first row, must be non negative
     * @param limit maximum number of rows, must be non negative
     * @return a new table owning copies of the selected rows
     */
    public Table slice(int offset, int limit) {
        Preconditions.checkArgument(offset >= 0, "Negative offset %s", offset);
        Preconditions.checkArgument(limit >= 0, "Negative limit %s", limit);
        int start = Math.min(offset, rowCount);
        int end = (int) Math.min((long) offset + limit, rowCount);
        List<Column> sliced = new ArrayList<>(columns.size());
        for (Column column : columns.values()) {
            sliced.add(column.slice(start, end - start));
        }
        return new Table(sliced, timestampColumn);
    }

    /**
     * Stable ascending sort on a temporal column; missing values sort first.
     * Returns {@code this} when the table is already in order.
     */
    public Table sortBy(String temporalColumn) {
        TemporalColumn key = getTemporalColumn(temporalColumn);
        if (key.isSorted()) {
            return this;
        }
        Integer[] order = new Integer[rowCount];
        for (int i = 0; i < rowCount; i++) {
            order[i] = i;
        }
        // Arrays.sort on objects is a stable merge sort
        Arrays.sort(order, Comparator.comparingLong(key::getMillis));
        int[] rows = new int[rowCount];
        for (int i = 0; i < rowCount; i++) {
            rows[i] = order[i];
        }
        List<Column> sorted = new ArrayList<>(columns.size());
        for (Column column : columns.values()) {
            sorted.add(column.take(rows));
        }
        return new Table(sorted, timestampColumn);
    }

    /**
     * Projects the table onto the given columns, in the given order. The timestamp column
     * designation survives only if it is part of the projection.
     */
    public Table select(Collection<String> names) {
        List<Column> selected = new ArrayList<>(names.size());
        for (String name : names) {
            Column column = getColumn(name);
            if (!selected.contains(column)) {
                selected.add(column);
            }
        }
        String ts = timestampColumn != null && names.contains(timestampColumn) ? timestampColumn : null;
        return new Table(selected, ts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table)) {
            return false;
        }
        Table other = (Table) o;
        return rowCount == other.rowCount
                && Objects.equals(timestampColumn, other.timestampColumn)
                && new ArrayList<>(columns.values()).equals(new ArrayList<>(other.columns.values()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowCount, timestampColumn, new ArrayList<>(columns.values()));
    }

    @Override
    public String toString() {
        return "Table{" + rowCount + " rows, columns=" + columns.keySet()
                + ", timestamp=" + timestampColumn + '}';
    }
}
