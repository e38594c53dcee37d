package gr.imsi.athenarc.tsview.forecast;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.aggregation.FrequencyInferencer;
import gr.imsi.athenarc.tsview.domain.DateTimeUtil;
import gr.imsi.athenarc.tsview.domain.ForecastPoint;
import gr.imsi.athenarc.tsview.domain.ForecastResponse;
import gr.imsi.athenarc.tsview.exception.FrequencyIndeterminateException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forecasts a series and stamps each predicted step with
 * {@code last observed timestamp + step * inferred frequency}.
 */
public class ForecastService {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastService.class);

    private final ForecastModel model;
    private final FrequencyInferencer frequencyInferencer;

    public ForecastService(ForecastModel model, FrequencyInferencer frequencyInferencer) {
        this.model = model;
        this.frequencyInferencer = frequencyInferencer;
    }

    /**
     * @param values observed values, aligned with {@code timestamps}
     * @param timestamps ascending epoch milliseconds
     * @param horizon number of steps to forecast
     * @return the forecast with model identification and the inferred frequency as metadata
     * @throws FrequencyIndeterminateException if the spacing of the timestamps cannot be inferred
     */
    public ForecastResponse forecast(double[] values, long[] timestamps, int horizon) {
        Preconditions.checkArgument(values.length == timestamps.length,
                "%s values but %s timestamps", values.length, timestamps.length);
        Preconditions.checkArgument(horizon > 0, "Horizon must be positive, got %s", horizon);
        Duration frequency = frequencyInferencer.inferFrequency(timestamps);
        if (frequency.isZero()) {
            throw new FrequencyIndeterminateException("All " + timestamps.length + " timestamps are equal", 1);
        }
        long last = Arrays.stream(timestamps).max().getAsLong();

        Prediction prediction = model.predict(values, horizon);
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int step = 0; step < prediction.size(); step++) {
            long timestamp = last + (step + 1) * frequency.toMillis();
            points.add(new ForecastPoint(timestamp, prediction.getPoint(step),
                    prediction.getLower(step), prediction.getUpper(step)));
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("frequency", frequency.toString());
        metadata.put("observations", String.valueOf(values.length));
        metadata.put("lastObserved", DateTimeUtil.format(last));
        LOG.debug("Forecast {} steps of {} with {} v{}", horizon, frequency, model.getName(), model.getVersion());
        return new ForecastResponse(points, metadata, model.getName(), model.getVersion());
    }
}
