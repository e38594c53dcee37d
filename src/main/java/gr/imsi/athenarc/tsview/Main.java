package gr.imsi.athenarc.tsview;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.aggregation.FrequencyInferencer;
import gr.imsi.athenarc.tsview.aggregation.RangeAggregator;
import gr.imsi.athenarc.tsview.cache.ViewCache;
import gr.imsi.athenarc.tsview.cache.store.DeadlineKeyValueStore;
import gr.imsi.athenarc.tsview.cache.store.InMemoryKeyValueStore;
import gr.imsi.athenarc.tsview.cache.store.KeyValueStore;
import gr.imsi.athenarc.tsview.config.ServiceConfiguration;
import gr.imsi.athenarc.tsview.datasource.CsvTableReader;
import gr.imsi.athenarc.tsview.datasource.CsvTableWriter;
import gr.imsi.athenarc.tsview.datasource.DeadlineDatasetLoader;
import gr.imsi.athenarc.tsview.datasource.FileDatasetLoader;
import gr.imsi.athenarc.tsview.domain.Dataset;
import gr.imsi.athenarc.tsview.domain.DateTimeUtil;
import gr.imsi.athenarc.tsview.domain.ForecastPoint;
import gr.imsi.athenarc.tsview.domain.ForecastResponse;
import gr.imsi.athenarc.tsview.domain.FrequencyEstimate;
import gr.imsi.athenarc.tsview.domain.OperationSet;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.domain.TimeRecord;
import gr.imsi.athenarc.tsview.domain.TimeSeriesView;
import gr.imsi.athenarc.tsview.forecast.ForecastService;
import gr.imsi.athenarc.tsview.forecast.LinearTrendForecastModel;
import gr.imsi.athenarc.tsview.manager.QueryOrchestrator;
import gr.imsi.athenarc.tsview.metadata.JsonFileMetadataStore;
import gr.imsi.athenarc.tsview.metadata.MetadataStore;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point.
 * <ul>
 *     <li>{@code inspect}: column classification, sampling frequency and timestamp irregularities of a CSV file</li>
 *     <li>{@code aggregate}: downsample a CSV file into another CSV file</li>
 *     <li>{@code register}: store a CSV file as a dataset</li>
 *     <li>{@code view}: create an operation set on a dataset and print its view</li>
 *     <li>{@code forecast}: create an operation set on a dataset and forecast one of its series</li>
 *     <li>{@code list}: print the registered datasets</li>
 *     <li>{@code delete}: remove a dataset, by id or by name, with its views and data file</li>
 * </ul>
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final int STORE_CALL_THREADS = 4;

    @Parameter(names = "-mode", description = "Mode: inspect, aggregate, register, view, forecast, list or delete")
    private String mode = "inspect";

    @Parameter(names = "-input", description = "Input CSV file (inspect, aggregate, register)")
    private String input;

    @Parameter(names = "-out", description = "Output CSV file; standard output when absent")
    private String out;

    @Parameter(names = "-timeCol", description = "Timestamp column; the first temporal column when absent")
    private String timeCol;

    @Parameter(names = "-maxPoints", description = "Point budget; the configured one when absent")
    private Integer maxPoints;

    @Parameter(names = "-name", description = "Dataset name (register, delete)")
    private String name;

    @Parameter(names = "-dataset", description = "Dataset id (view, forecast, delete)")
    private String dataset;

    @Parameter(names = "-series", variableArity = true, description = "Series to include (view, forecast)")
    private List<String> series = new ArrayList<>();

    @Parameter(names = "-offset", description = "First raw row of the view")
    private int offset = 0;

    @Parameter(names = "-limit", description = "Number of raw rows in the view")
    private int limit = OperationSet.DEFAULT_LIMIT;

    @Parameter(names = "-horizon", description = "Forecast horizon in steps")
    private int horizon = 10;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args) throws IOException {
        Main main = new Main();
        JCommander jCommander = new JCommander(main);
        jCommander.parse(args);
        if (main.help) {
            jCommander.usage();
        } else {
            main.run(ServiceConfiguration.load());
        }
    }

    void run(ServiceConfiguration configuration) throws IOException {
        LOG.debug("Running {} with {}", mode, configuration);
        switch (mode.toLowerCase(Locale.ROOT)) {
            case "inspect":
                inspect();
                break;
            case "aggregate":
                aggregate(configuration);
                break;
            case "register":
            case "view":
            case "forecast":
            case "list":
            case "delete":
                runService(configuration);
                break;
            default:
                throw new IllegalArgumentException("Unknown mode " + mode);
        }
    }

    private void inspect() throws IOException {
        Table table = readInput();
        String timestampColumn = timestampColumn(table);
        FrequencyInferencer inferencer = new FrequencyInferencer();
        Dataset description = Dataset.fromTable(table, Paths.get(input).getFileName().toString(), input);
        FrequencyEstimate estimate = inferencer.estimate(table.getTemporalColumn(timestampColumn).nonNullValues());

        try (Writer writer = output()) {
            CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
            csvWriter.writeHeaders("property", "value");
            csvWriter.writeRow("rows", table.getRowCount());
            csvWriter.writeRow("series", String.join(" ", description.getSeriesCols()));
            csvWriter.writeRow("timestamps", String.join(" ", description.getTimestampCols()));
            csvWriter.writeRow("other", String.join(" ", description.getOtherCols()));
            csvWriter.writeRow("frequency", estimate.getFrequency().map(Object::toString).orElse("undetermined"));
            csvWriter.writeRow("distinct deltas", estimate.getDistinctDeltas());
            csvWriter.writeRow("conditions", inferencer.classifyIrregularities(table.getTemporalColumn(timestampColumn)));
            csvWriter.flush();
        }
    }

    private void aggregate(ServiceConfiguration configuration) throws IOException {
        Table table = readInput();
        String timestampColumn = timestampColumn(table);
        int budget = maxPoints != null ? maxPoints : configuration.getMaxPoints();
        Stopwatch stopwatch = Stopwatch.createStarted();
        Table aggregated = new RangeAggregator().aggregate(table, timestampColumn, budget);
        LOG.info("Aggregated {} rows into {} in {} ms", table.getRowCount(), aggregated.getRowCount(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        try (Writer writer = output()) {
            new CsvTableWriter().write(aggregated, writer);
        }
    }

    private void runService(ServiceConfiguration configuration) throws IOException {
        MetadataStore metadataStore = new JsonFileMetadataStore(configuration.getMetadataDir());
        FileDatasetLoader fileLoader = new FileDatasetLoader(metadataStore, configuration.getDataDir());
        ExecutorService loadExecutor = Executors.newSingleThreadExecutor();
        ExecutorService storeExecutor = Executors.newFixedThreadPool(STORE_CALL_THREADS);
        KeyValueStore store = new DeadlineKeyValueStore(
                new InMemoryKeyValueStore(configuration.getCacheMaxEntries(), configuration.getCacheTtl()),
                storeExecutor, configuration.getStoreTimeout());
        try {
            FrequencyInferencer inferencer = new FrequencyInferencer();
            QueryOrchestrator orchestrator = QueryOrchestrator.builder(metadataStore,
                            new ViewCache(store, configuration.getCacheTtl()),
                            new DeadlineDatasetLoader(fileLoader, loadExecutor, configuration.getLoadTimeout()))
                    .withFrequencyInferencer(inferencer)
                    .withForecastService(new ForecastService(new LinearTrendForecastModel(), inferencer))
                    .withDatasetStorage(fileLoader)
                    .withMaxPoints(maxPoints != null ? maxPoints : configuration.getMaxPoints())
                    .build();

            switch (mode.toLowerCase(Locale.ROOT)) {
                case "register":
                    register(orchestrator, fileLoader);
                    break;
                case "view":
                    view(orchestrator);
                    break;
                case "forecast":
                    forecast(orchestrator);
                    break;
                case "list":
                    list(orchestrator);
                    break;
                default:
                    delete(orchestrator);
            }
        } finally {
            store.close();
            storeExecutor.shutdownNow();
            loadExecutor.shutdownNow();
        }
    }

    private void register(QueryOrchestrator orchestrator, FileDatasetLoader fileLoader) throws IOException {
        Table table = readInput();
        String datasetName = name != null ? name : Paths.get(input).getFileName().toString();
        String fileName = fileLoader.save(table, datasetName.replaceAll("[^A-Za-z0-9_.-]", "_"));
        Dataset registered = orchestrator.registerDataset(datasetName, fileName, table);
        System.out.println(registered.getId());
    }

    private void view(QueryOrchestrator orchestrator) throws IOException {
        OperationSet operationSet = orchestrator.createOperationSet(
                new OperationSet(null, Preconditions.checkNotNull(dataset, "-dataset is required"), series, offset, limit));
        TimeSeriesView view = orchestrator.getView(operationSet.getId());
        try (Writer writer = output()) {
            CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
            List<String> headers = new ArrayList<>();
            headers.add("timestamp");
            if (!view.getData().isEmpty()) {
                headers.addAll(view.getData().get(0).getData().keySet());
            }
            csvWriter.writeHeaders(headers);
            for (TimeRecord record : view.getData()) {
                List<Object> row = new ArrayList<>();
                row.add(DateTimeUtil.format(record.getTimestamp()));
                row.addAll(record.getData().values());
                csvWriter.writeRow(row);
            }
            csvWriter.flush();
        }
    }

    private void forecast(QueryOrchestrator orchestrator) throws IOException {
        Preconditions.checkArgument(series.size() == 1, "Exactly one -series is required to forecast");
        OperationSet operationSet = orchestrator.createOperationSet(
                new OperationSet(null, Preconditions.checkNotNull(dataset, "-dataset is required"), series, offset, limit));
        ForecastResponse response = orchestrator.forecast(operationSet.getId(), series.get(0), horizon);
        try (Writer writer = output()) {
            CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
            csvWriter.writeHeaders("timestamp", "point", "lower", "upper");
            for (ForecastPoint point : response.getForecast()) {
                csvWriter.writeRow(DateTimeUtil.format(point.getTimestamp()), point.getPoint(),
                        point.getLower(), point.getUpper());
            }
            csvWriter.flush();
        }
        LOG.info("Forecast with {} v{}: {}", response.getModel(), response.getModelVersion(), response.getMetadata());
    }

    private void list(QueryOrchestrator orchestrator) throws IOException {
        try (Writer writer = output()) {
            CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
            csvWriter.writeHeaders("id", "name", "file", "rows", "series", "conditions");
            for (Dataset registered : orchestrator.listDatasets()) {
                csvWriter.writeRow(registered.getId(), registered.getName(), registered.getFileName(),
                        registered.getMaxLength(), String.join(" ", registered.getSeriesCols()),
                        registered.getConditions());
            }
            csvWriter.flush();
        }
    }

    private void delete(QueryOrchestrator orchestrator) {
        Preconditions.checkArgument(dataset != null ^ name != null, "Exactly one of -dataset or -name is required");
        Dataset deleted = dataset != null ? orchestrator.deleteDataset(dataset) : orchestrator.deleteDatasetByName(name);
        System.out.println(deleted.getId());
    }

    private Table readInput() throws IOException {
        Preconditions.checkNotNull(input, "-input is required in %s mode", mode);
        return new CsvTableReader().read(Paths.get(input));
    }

    private String timestampColumn(Table table) {
        String column = timeCol != null ? timeCol : table.getTimestampColumn();
        Preconditions.checkArgument(column != null, "No timestamp column found in %s", input);
        return column;
    }

    private Writer output() throws IOException {
        if (out == null) {
            // keep System.out open after the writer is closed
            return new OutputStreamWriter(System.out, StandardCharsets.UTF_8) {
                @Override
                public void close() throws IOException {
                    flush();
                }
            };
        }
        Path path = Paths.get(out);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }
}
