package gr.imsi.athenarc.tsview.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class ForecastResponse {

    private final List<ForecastPoint> forecast;
    private final Map<String, String> metadata;
    private final String model;
    private final String modelVersion;

    public ForecastResponse(List<ForecastPoint> forecast, Map<String, String> metadata,
                            String model, String modelVersion) {
        this.forecast = Collections.unmodifiableList(forecast);
        this.metadata = Collections.unmodifiableMap(metadata);
        this.model = model;
        this.modelVersion = modelVersion;
    }

    public List<ForecastPoint> getForecast() {
        return forecast;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public String getModel() {
        return model;
    }

    public String getModelVersion() {
        return modelVersion;
    }
}
