package gr.imsi.athenarc.tsview.manager;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.aggregation.FrequencyInferencer;
import gr.imsi.athenarc.tsview.aggregation.RangeAggregator;
import gr.imsi.athenarc.tsview.cache.ReconcileOutcome;
import gr.imsi.athenarc.tsview.cache.ViewCache;
import gr.imsi.athenarc.tsview.datasource.DatasetLoader;
import gr.imsi.athenarc.tsview.datasource.DatasetStorage;
import gr.imsi.athenarc.tsview.domain.Column;
import gr.imsi.athenarc.tsview.domain.Condition;
import gr.imsi.athenarc.tsview.domain.Dataset;
import gr.imsi.athenarc.tsview.domain.ForecastResponse;
import gr.imsi.athenarc.tsview.domain.NumericColumn;
import gr.imsi.athenarc.tsview.domain.OperationSet;
import gr.imsi.athenarc.tsview.domain.OperationSetUpdate;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.domain.TemporalColumn;
import gr.imsi.athenarc.tsview.domain.TimeRecord;
import gr.imsi.athenarc.tsview.domain.TimeSeriesView;
import gr.imsi.athenarc.tsview.exception.TsApiDataException;
import gr.imsi.athenarc.tsview.forecast.ForecastService;
import gr.imsi.athenarc.tsview.metadata.MetadataStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Serves operation sets: looks up their metadata, resolves the raw slice through the
 * {@link ViewCache}, downsamples it and shapes the response. Also owns the write paths that
 * have to keep metadata and cache consistent.
 */
public class QueryOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(QueryOrchestrator.class);

    private final MetadataStore metadataStore;
    private final ViewCache viewCache;
    private final DatasetLoader datasetLoader;
    private final DatasetStorage datasetStorage;
    private final RangeAggregator aggregator;
    private final FrequencyInferencer frequencyInferencer;
    private final ForecastService forecastService;
    private final int maxPoints;

    // Private constructor used by builder
    private QueryOrchestrator(Builder builder) {
        this.metadataStore = builder.metadataStore;
        this.viewCache = builder.viewCache;
        this.datasetLoader = builder.datasetLoader;
        this.datasetStorage = builder.datasetStorage;
        this.aggregator = builder.aggregator;
        this.frequencyInferencer = builder.frequencyInferencer;
        this.forecastService = builder.forecastService;
        this.maxPoints = builder.maxPoints;
    }

    /**
     * Returns the downsampled view of an operation set.
     *
     * @param operationSetId the operation set to serve
     * @return at most {@code maxPoints} records holding the requested series
     * @throws TsApiDataException if a requested series is not a numeric column of the dataset
     */
    public TimeSeriesView getView(@NotNull String operationSetId) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        OperationSet operationSet = metadataStore.getOperationSet(operationSetId);
        Dataset dataset = metadataStore.getDataset(operationSet.getDatasetId());
        String timestampColumn = dataset.getTimestampColumn();
        List<String> series = requestedSeries(operationSet, dataset);

        Table slice = viewCache.resolve(operationSet, datasetLoader);
        checkSeries(slice, series);
        if (slice.isEmpty()) {
            LOG.info("View {} is empty at offset {}", operationSetId, operationSet.getOffset());
            return new TimeSeriesView(operationSetId, dataset.getName(), Collections.emptyList());
        }

        List<String> projection = new ArrayList<>(series);
        projection.add(0, timestampColumn);
        Table aggregated = aggregator.aggregate(slice.select(projection), timestampColumn, maxPoints)
                .sortBy(timestampColumn);
        List<TimeRecord> records = toRecords(aggregated, timestampColumn, series);
        LOG.info("Served view {} ({} of {} rows) in {} ms", operationSetId, records.size(), slice.getRowCount(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return new TimeSeriesView(operationSetId, dataset.getName(), records);
    }

    /**
     * Moves the row range of an operation set. The new range is persisted first and the cache
     * reconciled second, so a crash in between leaves an entry whose recorded range no longer
     * matches, which the next read discards.
     *
     * @return the updated operation set
     */
    public OperationSet updateView(@NotNull String operationSetId, int offset, int limit) {
        Preconditions.checkArgument(offset >= 0, "Negative offset %s", offset);
        Preconditions.checkArgument(limit > 0, "Limit must be positive, got %s", limit);
        OperationSet current = metadataStore.getOperationSet(operationSetId);
        OperationSetUpdate update = metadataStore.updateOperationSet(operationSetId, current.withRange(offset, limit));
        ReconcileOutcome outcome = viewCache.reconcile(update.getCurrent(), update.getPrevious());
        LOG.info("Updated view {} from {} to {}: cache {}", operationSetId,
                update.getPrevious().getRange(), update.getCurrent().getRange(), outcome);
        return update.getCurrent();
    }

    /**
     * Classifies an ingested table, diagnoses its timestamp column and records it as a dataset.
     *
     * @param name the dataset name
     * @param fileName the durable file holding the table
     * @param table the ingested table
     * @return the stored dataset
     */
    public Dataset registerDataset(@NotNull String name, @NotNull String fileName, @NotNull Table table) {
        Dataset dataset = Dataset.fromTable(table, name, fileName);
        EnumSet<Condition> conditions = frequencyInferencer.classifyIrregularities(
                table.getTemporalColumn(dataset.getTimestampColumn()));
        dataset.setConditions(new ArrayList<>(conditions));
        if (!conditions.isEmpty()) {
            LOG.warn("Dataset {} has irregular timestamps: {}", name, conditions);
        }
        return metadataStore.insertDataset(dataset);
    }

    public OperationSet createOperationSet(@NotNull OperationSet operationSet) {
        Preconditions.checkArgument(operationSet.getOffset() >= 0, "Negative offset %s", operationSet.getOffset());
        Preconditions.checkArgument(operationSet.getLimit() > 0, "Limit must be positive, got %s",
                operationSet.getLimit());
        Dataset dataset = metadataStore.getDataset(operationSet.getDatasetId());
        for (String seriesId : operationSet.getSeriesIds()) {
            if (!dataset.getSeriesCols().contains(seriesId)) {
                throw new TsApiDataException("Dataset " + dataset.getName() + " has no series " + seriesId);
            }
        }
        return metadataStore.insertOperationSet(operationSet);
    }

    public List<Dataset> listDatasets() {
        return metadataStore.getDatasets();
    }

    /**
     * Removes a dataset, its operation sets, everything cached for them and, when a
     * {@link DatasetStorage} is configured, its data file.
     *
     * @return the removed dataset
     */
    public Dataset deleteDataset(@NotNull String datasetId) {
        Dataset dataset = metadataStore.getDataset(datasetId);
        List<String> operationSetIds = metadataStore.getOperationSetsForDataset(datasetId).stream()
                .map(OperationSet::getId)
                .collect(Collectors.toList());
        viewCache.evictDataset(datasetId, operationSetIds);
        metadataStore.deleteDataset(datasetId);
        if (datasetStorage != null && dataset.getFileName() != null) {
            datasetStorage.delete(dataset.getFileName());
        }
        LOG.info("Deleted dataset {} ({})", datasetId, dataset.getName());
        return dataset;
    }

    public Dataset deleteDatasetByName(@NotNull String name) {
        return deleteDataset(metadataStore.getDatasetByName(name).getId());
    }

    /**
     * Forecasts one series of an operation set from its raw (not downsampled) slice.
     *
     * @param operationSetId the operation set whose range is used as history
     * @param seriesId the series to forecast
     * @param horizon number of future steps
     * @return the forecast records
     */
    public ForecastResponse forecast(@NotNull String operationSetId, @NotNull String seriesId, int horizon) {
        Preconditions.checkState(forecastService != null, "No forecast service configured");
        OperationSet operationSet = metadataStore.getOperationSet(operationSetId);
        Dataset dataset = metadataStore.getDataset(operationSet.getDatasetId());
        String timestampColumn = dataset.getTimestampColumn();

        Table slice = viewCache.resolve(operationSet, datasetLoader);
        checkSeries(slice, Collections.singletonList(seriesId));
        Table sorted = slice.isEmpty() ? slice : slice.sortBy(timestampColumn);
        TemporalColumn index = sorted.getTemporalColumn(timestampColumn);
        NumericColumn values = (NumericColumn) sorted.getColumn(seriesId);

        int observed = 0;
        long[] timestamps = new long[sorted.getRowCount()];
        double[] ys = new double[sorted.getRowCount()];
        for (int row = 0; row < sorted.getRowCount(); row++) {
            if (index.isNull(row)) {
                continue;
            }
            timestamps[observed] = index.getMillis(row);
            ys[observed] = values.getDouble(row);
            observed++;
        }
        return forecastService.forecast(Arrays.copyOf(ys, observed), Arrays.copyOf(timestamps, observed), horizon);
    }

    private static List<String> requestedSeries(OperationSet operationSet, Dataset dataset) {
        if (operationSet.getSeriesIds() == null || operationSet.getSeriesIds().isEmpty()) {
            return new ArrayList<>(dataset.getSeriesCols());
        }
        return operationSet.getSeriesIds();
    }

    private static void checkSeries(Table table, List<String> series) {
        for (String seriesId : series) {
            if (!table.hasColumn(seriesId) || !(table.getColumn(seriesId) instanceof NumericColumn)) {
                throw new TsApiDataException("Unknown series " + seriesId);
            }
        }
    }

    private static List<TimeRecord> toRecords(Table table, String timestampColumn, List<String> series) {
        TemporalColumn index = table.getTemporalColumn(timestampColumn);
        List<Column> columns = new ArrayList<>(series.size());
        for (String seriesId : series) {
            columns.add(table.getColumn(seriesId));
        }
        List<TimeRecord> records = new ArrayList<>(table.getRowCount());
        for (int row = 0; row < table.getRowCount(); row++) {
            if (index.isNull(row)) {
                continue;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            for (Column column : columns) {
                data.put(column.getName(), column.isNull(row) ? null : column.getObject(row));
            }
            records.add(new TimeRecord(index.getMillis(row), data));
        }
        return records;
    }

    public static Builder builder(MetadataStore metadataStore, ViewCache viewCache, DatasetLoader datasetLoader) {
        return new Builder(metadataStore, viewCache, datasetLoader);
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    /**
     * Builder class for QueryOrchestrator that allows configuring specific components
     */
    public static class Builder {
        public static final int DEFAULT_MAX_POINTS = 10_000;

        private final MetadataStore metadataStore;
        private final ViewCache viewCache;
        private final DatasetLoader datasetLoader;
        private DatasetStorage datasetStorage;
        private FrequencyInferencer frequencyInferencer = new FrequencyInferencer();
        private RangeAggregator aggregator;
        private ForecastService forecastService;
        private int maxPoints = DEFAULT_MAX_POINTS;

        public Builder(MetadataStore metadataStore, ViewCache viewCache, DatasetLoader datasetLoader) {
            this.metadataStore = Preconditions.checkNotNull(metadataStore, "metadataStore");
            this.viewCache = Preconditions.checkNotNull(viewCache, "viewCache");
            this.datasetLoader = Preconditions.checkNotNull(datasetLoader, "datasetLoader");
        }

        public Builder withFrequencyInferencer(FrequencyInferencer frequencyInferencer) {
            this.frequencyInferencer = frequencyInferencer;
            return this;
        }

        public Builder withDatasetStorage(DatasetStorage datasetStorage) {
            this.datasetStorage = datasetStorage;
            return this;
        }

        public Builder withAggregator(RangeAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder withForecastService(ForecastService forecastService) {
            this.forecastService = forecastService;
            return this;
        }

        public Builder withMaxPoints(int maxPoints) {
            Preconditions.checkArgument(maxPoints > 0, "Point budget must be positive, got %s", maxPoints);
            this.maxPoints = maxPoints;
            return this;
        }

        public QueryOrchestrator build() {
            if (aggregator == null) {
                aggregator = new RangeAggregator(frequencyInferencer);
            }
            return new QueryOrchestrator(this);
        }
    }
}
