package gr.imsi.athenarc.tsview.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import gr.imsi.athenarc.tsview.exception.NoTimestampColumnException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persisted description of an ingested table: its identity, where its raw data lives and how
 * its columns were classified.
 */
public class Dataset {

    private String id;
    private String name;
    private String description = "";
    private int numSeries;
    private int maxLength;
    private List<String> seriesCols = new ArrayList<>();
    private List<String> timestampCols = new ArrayList<>();
    private List<String> otherCols = new ArrayList<>();
    private String fileName;
    private List<Condition> conditions = new ArrayList<>();

    public Dataset() {}

    /**
     * Classifies the columns of a table: numeric columns become series, temporal columns
     * timestamps and everything else "other".
     *
     * @param table the ingested table
     * @param name the dataset name
     * @param fileName the durable file holding the raw data, relative to the data directory
     * @return an unsaved dataset (no id yet)
     * @throws NoTimestampColumnException if the table has no temporal column
     */
    public static Dataset fromTable(Table table, String name, String fileName) {
        List<String> series = new ArrayList<>();
        List<String> times = new ArrayList<>();
        List<String> others = new ArrayList<>();
        for (Column column : table.getColumns()) {
            switch (column.getType()) {
                case NUMERIC:
                    series.add(column.getName());
                    break;
                case TEMPORAL:
                    times.add(column.getName());
                    break;
                default:
                    others.add(column.getName());
            }
        }
        if (times.isEmpty()) {
            throw new NoTimestampColumnException("No timestamp columns found in " + name);
        }
        Dataset dataset = new Dataset();
        dataset.setName(name);
        dataset.setNumSeries(series.size());
        dataset.setMaxLength(table.getRowCount());
        dataset.setSeriesCols(series);
        dataset.setTimestampCols(times);
        dataset.setOtherCols(others);
        dataset.setFileName(fileName);
        return dataset;
    }

    /**
     * @return the timestamp column views are indexed by (the first temporal column)
     */
    @JsonIgnore
    public String getTimestampColumn() {
        if (timestampCols == null || timestampCols.isEmpty()) {
            throw new NoTimestampColumnException("Dataset " + id + " has no timestamp column");
        }
        return timestampCols.get(0);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getNumSeries() {
        return numSeries;
    }

    public void setNumSeries(int numSeries) {
        this.numSeries = numSeries;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(int maxLength) {
        this.maxLength = maxLength;
    }

    public List<String> getSeriesCols() {
        return seriesCols;
    }

    public void setSeriesCols(List<String> seriesCols) {
        this.seriesCols = seriesCols;
    }

    public List<String> getTimestampCols() {
        return timestampCols;
    }

    public void setTimestampCols(List<String> timestampCols) {
        this.timestampCols = timestampCols;
    }

    public List<String> getOtherCols() {
        return otherCols;
    }

    public void setOtherCols(List<String> otherCols) {
        this.otherCols = otherCols;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dataset)) {
            return false;
        }
        return id != null && id.equals(((Dataset) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Dataset{id=" + id + ", name=" + name + ", file=" + fileName
                + ", series=" + seriesCols + ", timestamps=" + timestampCols + '}';
    }
}
