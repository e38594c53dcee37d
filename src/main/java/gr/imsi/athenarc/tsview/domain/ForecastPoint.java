package gr.imsi.athenarc.tsview.domain;

/**
 * A single projected value with its prediction interval.
 */
public class ForecastPoint {

    private final long timestamp;
    private final double point;
    private final double lower;
    private final double upper;

    public ForecastPoint(long timestamp, double point, double lower, double upper) {
        this.timestamp = timestamp;
        this.point = point;
        this.lower = lower;
        this.upper = upper;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getPoint() {
        return point;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public String toString() {
        return "ForecastPoint{" + DateTimeUtil.format(timestamp) + ", " + point
                + " [" + lower + ", " + upper + "]}";
    }
}
