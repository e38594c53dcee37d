package gr.imsi.athenarc.tsview.forecast;

import com.google.common.base.Preconditions;

/**
 * Per-step point forecasts with lower and upper interval bounds.
 */
public class Prediction {

    private final double[] point;
    private final double[] lower;
    private final double[] upper;

    public Prediction(double[] point, double[] lower, double[] upper) {
        Preconditions.checkArgument(point.length == lower.length && point.length == upper.length,
                "Prediction arrays differ in length");
        this.point = point.clone();
        this.lower = lower.clone();
        this.upper = upper.clone();
    }

    public int size() {
        return point.length;
    }

    public double getPoint(int step) {
        return point[step];
    }

    public double getLower(int step) {
        return lower[step];
    }

    public double getUpper(int step) {
        return upper[step];
    }
}
