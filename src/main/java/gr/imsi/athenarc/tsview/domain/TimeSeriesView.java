package gr.imsi.athenarc.tsview.domain;

import java.util.Collections;
import java.util.List;

/**
 * The downsampled view of an operation set returned to the API layer.
 */
public class TimeSeriesView {

    private final String id;
    private final String name;
    private final List<TimeRecord> data;

    public TimeSeriesView(String id, String name, List<TimeRecord> data) {
        this.id = id;
        this.name = name;
        this.data = Collections.unmodifiableList(data);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<TimeRecord> getData() {
        return data;
    }

    public int size() {
        return data.size();
    }
}
