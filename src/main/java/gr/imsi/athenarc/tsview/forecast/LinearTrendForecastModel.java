package gr.imsi.athenarc.tsview.forecast;

import com.google.common.base.Preconditions;

import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import gr.imsi.athenarc.tsview.exception.TsApiDataException;

/**
 * Ordinary least squares trend on the observation index, with a two-sided prediction interval
 * from the Student t distribution.
 */
public class LinearTrendForecastModel implements ForecastModel {

    public static final String NAME = "linear-trend";
    public static final String VERSION = "1";

    private static final int MIN_OBSERVATIONS = 3;

    private final double confidence;

    public LinearTrendForecastModel() {
        this(0.95);
    }

    public LinearTrendForecastModel(double confidence) {
        Preconditions.checkArgument(confidence > 0 && confidence < 1, "Confidence must be in (0, 1), got %s", confidence);
        this.confidence = confidence;
    }

    @Override
    public Prediction predict(double[] values, int horizon) {
        Preconditions.checkArgument(horizon > 0, "Horizon must be positive, got %s", horizon);
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                regression.addData(i, values[i]);
            }
        }
        long n = regression.getN();
        if (n < MIN_OBSERVATIONS) {
            throw new TsApiDataException("At least " + MIN_OBSERVATIONS + " observations are needed to forecast, got " + n);
        }

        double meanX = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                meanX += i;
            }
        }
        meanX /= n;

        double t = new TDistribution(n - 2).inverseCumulativeProbability(1 - (1 - confidence) / 2);
        double mse = regression.getMeanSquareError();
        double sxx = regression.getXSumSquares();

        double[] point = new double[horizon];
        double[] lower = new double[horizon];
        double[] upper = new double[horizon];
        for (int step = 0; step < horizon; step++) {
            double x = values.length + step;
            point[step] = regression.predict(x);
            double se = Math.sqrt(mse * (1 + 1.0 / n + (x - meanX) * (x - meanX) / sxx));
            lower[step] = point[step] - t * se;
            upper[step] = point[step] + t * se;
        }
        return new Prediction(point, lower, upper);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }
}
