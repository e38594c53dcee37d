package gr.imsi.athenarc.tsview.domain;

/** Type tag carried by every {@link Column}, fixed when the column is built. */
public enum ColumnType {
    NUMERIC,   // double values, NaN marks a missing value
    TEMPORAL,  // epoch milliseconds in UTC
    OTHER      // opaque strings
}
