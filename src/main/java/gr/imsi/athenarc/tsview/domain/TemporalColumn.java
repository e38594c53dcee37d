package gr.imsi.athenarc.tsview.domain;

import java.time.Instant;
import java.util.Arrays;

/**
 * Temporal column holding epoch milliseconds (UTC). {@link #NULL} marks a missing value.
 */
public final class TemporalColumn extends Column {

    public static final long NULL = Long.MIN_VALUE;

    private final long[] values;

    public TemporalColumn(String name, long[] values) {
        super(name);
        this.values = values.clone();
    }

    public static TemporalColumn of(String name, long... epochMillis) {
        return new TemporalColumn(name, epochMillis);
    }

    @Override
    public ColumnType getType() {
        return ColumnType.TEMPORAL;
    }

    @Override
    public int size() {
        return values.length;
    }

    public long getMillis(int row) {
        return values[row];
    }

    @Override
    public boolean isNull(int row) {
        return values[row] == NULL;
    }

    @Override
    public Object getObject(int row) {
        return isNull(row) ? null : Instant.ofEpochMilli(values[row]);
    }

    /**
     * Returns the non-null values, in column order.
     */
    public long[] nonNullValues() {
        return Arrays.stream(values).filter(v -> v != NULL).toArray();
    }

    public boolean isSorted() {
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[i - 1]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public TemporalColumn slice(int offset, int length) {
        return new TemporalColumn(getName(), Arrays.copyOfRange(values, offset, offset + length));
    }

    @Override
    public TemporalColumn take(int[] rows) {
        long[] taken = new long[rows.length];
        for (int i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new TemporalColumn(getName(), taken);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TemporalColumn)) {
            return false;
        }
        TemporalColumn other = (TemporalColumn) o;
        return getName().equals(other.getName()) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * getName().hashCode() + Arrays.hashCode(values);
    }
}
