package gr.imsi.athenarc.tsview.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of a view: a timestamp and the values of the requested series at that time.
 */
public class TimeRecord {

    private final long timestamp;
    private final Map<String, Object> data;

    public TimeRecord(long timestamp, Map<String, Object> data) {
        this.timestamp = timestamp;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public String toString() {
        return "TimeRecord{" + DateTimeUtil.format(timestamp) + ", " + data + '}';
    }
}
