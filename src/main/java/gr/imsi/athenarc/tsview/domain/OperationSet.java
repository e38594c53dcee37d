package gr.imsi.athenarc.tsview.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A persisted query descriptor: which series of which dataset, over which raw row range.
 * The id stays the same when a client moves the range.
 */
public class OperationSet {

    public static final int DEFAULT_LIMIT = 1000;

    private String id;
    private String datasetId;
    private List<String> seriesIds = new ArrayList<>();
    private int offset = 0;
    private int limit = DEFAULT_LIMIT;
    private String dependent;

    public OperationSet() {}

    public OperationSet(String id, String datasetId, List<String> seriesIds, int offset, int limit) {
        this.id = id;
        this.datasetId = datasetId;
        this.seriesIds = new ArrayList<>(seriesIds);
        this.offset = offset;
        this.limit = limit;
    }

    /**
     * Returns a copy of this operation set with a new row range; identity is kept.
     */
    public OperationSet withRange(int newOffset, int newLimit) {
        OperationSet copy = new OperationSet(id, datasetId, seriesIds, newOffset, newLimit);
        copy.setDependent(dependent);
        return copy;
    }

    @JsonIgnore
    public RowRange getRange() {
        return RowRange.of(offset, limit);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public void setDatasetId(String datasetId) {
        this.datasetId = datasetId;
    }

    public List<String> getSeriesIds() {
        return seriesIds;
    }

    public void setSeriesIds(List<String> seriesIds) {
        this.seriesIds = seriesIds;
    }

    public int getOffset() {
        return offset;
    }

    public void setOffset(int offset) {
        this.offset = offset;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    /**
     * @return the id of the operation set this one derives from, or {@code null}
     */
    public String getDependent() {
        return dependent;
    }

    public void setDependent(String dependent) {
        this.dependent = dependent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OperationSet)) {
            return false;
        }
        OperationSet other = (OperationSet) o;
        return offset == other.offset && limit == other.limit
                && Objects.equals(id, other.id)
                && Objects.equals(datasetId, other.datasetId)
                && Objects.equals(seriesIds, other.seriesIds)
                && Objects.equals(dependent, other.dependent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, datasetId, seriesIds, offset, limit, dependent);
    }

    @Override
    public String toString() {
        return "OperationSet{id=" + id + ", dataset=" + datasetId + ", series=" + seriesIds
                + ", offset=" + offset + ", limit=" + limit + '}';
    }
}
