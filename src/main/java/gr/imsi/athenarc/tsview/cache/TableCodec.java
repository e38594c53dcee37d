package gr.imsi.athenarc.tsview.cache;

import gr.imsi.athenarc.tsview.domain.Column;
import gr.imsi.athenarc.tsview.domain.ColumnType;
import gr.imsi.athenarc.tsview.domain.NumericColumn;
import gr.imsi.athenarc.tsview.domain.RowRange;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.domain.TemporalColumn;
import gr.imsi.athenarc.tsview.domain.TextColumn;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Self-describing columnar binary encoding of a {@link CacheEntry}.
 *
 * <pre>
 * magic "TSVC" | version | has range, offset, limit | row count | timestamp column (nullable)
 * column count | per column: name, type tag, values
 * </pre>
 *
 * Numeric values are IEEE doubles, temporal values epoch milliseconds and text values length-prefixed
 * UTF-8 (length -1 for null). The whole blob is GZIP compressed.
 */
public class TableCodec {

    private static final int MAGIC = 0x54535643;
    private static final byte VERSION = 1;

    public byte[] encode(CacheEntry entry) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(new GZIPOutputStream(bytes))) {
            write(entry, out);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode table", e);
        }
        return bytes.toByteArray();
    }

    public byte[] encode(Table table) {
        return encode(CacheEntry.of(table));
    }

    public CacheEntry decode(byte[] blob) throws IOException {
        try (DataInputStream in = new DataInputStream(new GZIPInputStream(new ByteArrayInputStream(blob)))) {
            return read(in);
        }
    }

    /**
     * Writes a table in the same encoding, without a range, as a durable table file.
     */
    public void writeTable(Table table, OutputStream stream) throws IOException {
        GZIPOutputStream gzip = new GZIPOutputStream(stream);
        DataOutputStream out = new DataOutputStream(gzip);
        write(CacheEntry.of(table), out);
        out.flush();
        gzip.finish();
    }

    public Table readTable(InputStream stream) throws IOException {
        DataInputStream in = new DataInputStream(new GZIPInputStream(stream));
        return read(in).getTable();
    }

    private void write(CacheEntry entry, DataOutputStream out) throws IOException {
        Table table = entry.getTable();
        out.writeInt(MAGIC);
        out.writeByte(VERSION);
        RowRange range = entry.getRange();
        out.writeBoolean(range != null);
        if (range != null) {
            out.writeInt(range.getOffset());
            out.writeInt(range.getLimit());
        }
        out.writeInt(table.getRowCount());
        writeString(out, table.getTimestampColumn());
        out.writeInt(table.getColumns().size());
        for (Column column : table.getColumns()) {
            writeString(out, column.getName());
            out.writeByte(column.getType().ordinal());
            switch (column.getType()) {
                case NUMERIC:
                    NumericColumn numeric = (NumericColumn) column;
                    for (int i = 0; i < numeric.size(); i++) {
                        out.writeDouble(numeric.getDouble(i));
                    }
                    break;
                case TEMPORAL:
                    TemporalColumn temporal = (TemporalColumn) column;
                    for (int i = 0; i < temporal.size(); i++) {
                        out.writeLong(temporal.getMillis(i));
                    }
                    break;
                default:
                    TextColumn text = (TextColumn) column;
                    for (int i = 0; i < text.size(); i++) {
                        writeString(out, text.getString(i));
                    }
            }
        }
    }

    private CacheEntry read(DataInputStream in) throws IOException {
        if (in.readInt() != MAGIC) {
            throw new IOException("Not an encoded table");
        }
        byte version = in.readByte();
        if (version != VERSION) {
            throw new IOException("Unsupported table encoding version " + version);
        }
        RowRange range = null;
        if (in.readBoolean()) {
            range = RowRange.of(in.readInt(), in.readInt());
        }
        int rows = in.readInt();
        String timestampColumn = readString(in);
        int columnCount = in.readInt();
        List<Column> columns = new ArrayList<>(columnCount);
        for (int c = 0; c < columnCount; c++) {
            String name = readString(in);
            int tag = in.readByte();
            if (tag < 0 || tag >= ColumnType.values().length) {
                throw new IOException("Unknown column type tag " + tag + " for " + name);
            }
            switch (ColumnType.values()[tag]) {
                case NUMERIC:
                    double[] doubles = new double[rows];
                    for (int i = 0; i < rows; i++) {
                        doubles[i] = in.readDouble();
                    }
                    columns.add(new NumericColumn(name, doubles));
                    break;
                case TEMPORAL:
                    long[] longs = new long[rows];
                    for (int i = 0; i < rows; i++) {
                        longs[i] = in.readLong();
                    }
                    columns.add(new TemporalColumn(name, longs));
                    break;
                default:
                    String[] strings = new String[rows];
                    for (int i = 0; i < rows; i++) {
                        strings[i] = readString(in);
                    }
                    columns.add(new TextColumn(name, strings));
            }
        }
        Table table = new Table(columns, timestampColumn);
        return range == null ? CacheEntry.of(table) : CacheEntry.of(range, table);
    }

    private static void writeString(DataOutputStream out, String value) throws IOException {
        if (value == null) {
            out.writeInt(-1);
            return;
        }
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(utf8.length);
        out.write(utf8);
    }

    private static String readString(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            return null;
        }
        byte[] utf8 = new byte[length];
        in.readFully(utf8);
        return new String(utf8, StandardCharsets.UTF_8);
    }
}
