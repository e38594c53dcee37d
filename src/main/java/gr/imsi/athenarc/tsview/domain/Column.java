package gr.imsi.athenarc.tsview.domain;

/**
 * A named, homogeneously typed and immutable column of a {@link Table}.
 * Derived columns (slices, reorderings) always own fresh arrays.
 */
public abstract class Column {

    private final String name;

    protected Column(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Column name must not be null");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public abstract ColumnType getType();

    public abstract int size();

    public abstract boolean isNull(int row);

    /**
     * Returns the boxed value at {@code row}: a {@code Double} for numeric columns,
     * an {@link java.time.Instant} for temporal ones and a {@code String} otherwise.
     * Missing values are returned as {@code null}.
     */
    public abstract Object getObject(int row);

    /**
     * Copies {@code length} values starting at {@code offset}.
     */
    public abstract Column slice(int offset, int length);

    /**
     * Gathers the values at the given row positions, in the order given.
     */
    public abstract Column take(int[] rows);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + ", " + size() + " rows}";
    }
}
