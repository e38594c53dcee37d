package gr.imsi.athenarc.tsview.domain;

import java.util.Objects;

/**
 * A raw row range {@code [offset, offset + limit)} of a dataset.
 */
public final class RowRange {

    private final int offset;
    private final int limit;

    private RowRange(int offset, int limit) {
        this.offset = offset;
        this.limit = limit;
    }

    public static RowRange of(int offset, int limit) {
        return new RowRange(offset, limit);
    }

    public int getOffset() {
        return offset;
    }

    public int getLimit() {
        return limit;
    }

    public long getEnd() {
        return (long) offset + limit;
    }

    public boolean contains(RowRange other) {
        return offset <= other.offset && other.getEnd() <= getEnd();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RowRange)) {
            return false;
        }
        RowRange other = (RowRange) o;
        return offset == other.offset && limit == other.limit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, limit);
    }

    @Override
    public String toString() {
        return "RowRange{" + offset + ", " + limit + '}';
    }
}
