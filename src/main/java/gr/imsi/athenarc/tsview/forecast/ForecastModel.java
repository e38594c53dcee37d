package gr.imsi.athenarc.tsview.forecast;

/**
 * A univariate model that projects a regularly spaced series forward.
 */
public interface ForecastModel {

    /**
     * @param values the observed series, oldest first; NaN marks a missing observation
     * @param horizon number of future steps to predict
     * @return the point forecast and interval bounds for steps {@code 1..horizon}
     */
    Prediction predict(double[] values, int horizon);

    String getName();

    String getVersion();
}
