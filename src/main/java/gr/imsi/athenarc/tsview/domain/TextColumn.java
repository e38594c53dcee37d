package gr.imsi.athenarc.tsview.domain;

import java.util.Arrays;

/** Column of opaque values (strings, categories, anything that is neither numeric nor temporal). */
public final class TextColumn extends Column {

    private final String[] values;

    public TextColumn(String name, String[] values) {
        super(name);
        this.values = values.clone();
    }

    public static TextColumn of(String name, String... values) {
        return new TextColumn(name, values);
    }

    @Override
    public ColumnType getType() {
        return ColumnType.OTHER;
    }

    @Override
    public int size() {
        return values.length;
    }

    public String getString(int row) {
        return values[row];
    }

    @Override
    public boolean isNull(int row) {
        return values[row] == null;
    }

    @Override
    public Object getObject(int row) {
        return values[row];
    }

    @Override
    public TextColumn slice(int offset, int length) {
        return new TextColumn(getName(), Arrays.copyOfRange(values, offset, offset + length));
    }

    @Override
    public TextColumn take(int[] rows) {
        String[] taken = new String[rows.length];
        for (int i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new TextColumn(getName(), taken);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TextColumn)) {
            return false;
        }
        TextColumn other = (TextColumn) o;
        return getName().equals(other.getName()) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * getName().hashCode() + Arrays.hashCode(values);
    }
}
