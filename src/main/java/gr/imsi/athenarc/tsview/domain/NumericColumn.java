package gr.imsi.athenarc.tsview.domain;

import java.util.Arrays;

public final class NumericColumn extends Column {

    private final double[] values;

    public NumericColumn(String name, double[] values) {
        super(name);
        this.values = values.clone();
    }

    public static NumericColumn of(String name, double... values) {
        return new NumericColumn(name, values);
    }

    @Override
    public ColumnType getType() {
        return ColumnType.NUMERIC;
    }

    @Override
    public int size() {
        return values.length;
    }

    public double getDouble(int row) {
        return values[row];
    }

    @Override
    public boolean isNull(int row) {
        return Double.isNaN(values[row]);
    }

    @Override
    public Object getObject(int row) {
        return isNull(row) ? null : values[row];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public NumericColumn slice(int offset, int length) {
        return new NumericColumn(getName(), Arrays.copyOfRange(values, offset, offset + length));
    }

    @Override
    public NumericColumn take(int[] rows) {
        double[] taken = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new NumericColumn(getName(), taken);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NumericColumn)) {
            return false;
        }
        NumericColumn other = (NumericColumn) o;
        return getName().equals(other.getName()) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * getName().hashCode() + Arrays.hashCode(values);
    }
}
