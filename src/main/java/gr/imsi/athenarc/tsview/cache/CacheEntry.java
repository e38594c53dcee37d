package gr.imsi.athenarc.tsview.cache;

import gr.imsi.athenarc.tsview.domain.RowRange;
import gr.imsi.athenarc.tsview.domain.Table;

/**
 * A cached table. Entries keyed by an operation set also record the raw row range they were
 * sliced from; an entry only ever answers for exactly that range.
 */
public final class CacheEntry {

    private final RowRange range;
    private final Table table;

    private CacheEntry(RowRange range, Table table) {
        this.range = range;
        this.table = table;
    }

    public static CacheEntry of(Table table) {
        return new CacheEntry(null, table);
    }

    public static CacheEntry of(RowRange range, Table table) {
        return new CacheEntry(range, table);
    }

    /**
     * @return the source row range, or {@code null} for full dataset entries
     */
    public RowRange getRange() {
        return range;
    }

    public Table getTable() {
        return table;
    }
}
