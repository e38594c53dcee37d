package gr.imsi.athenarc.tsview.metadata;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.domain.Dataset;
import gr.imsi.athenarc.tsview.domain.OperationSet;
import gr.imsi.athenarc.tsview.domain.OperationSetUpdate;
import gr.imsi.athenarc.tsview.exception.MetadataStoreException;
import gr.imsi.athenarc.tsview.exception.UnknownEntityException;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Keeps one indented JSON document per record under a base directory:
 * {@code datasets/<id>.json} and {@code opsets/<id>.json}. All access goes through this instance's
 * monitor, so a single process may share one store between request threads.
 */
public class JsonFileMetadataStore implements MetadataStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileMetadataStore.class);

    private static final String DATASETS = "datasets";
    private static final String OPERATION_SETS = "opsets";
    private static final String EXTENSION = ".json";

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path datasetDir;
    private final Path operationSetDir;

    public JsonFileMetadataStore(Path baseDir) {
        this.datasetDir = baseDir.resolve(DATASETS);
        this.operationSetDir = baseDir.resolve(OPERATION_SETS);
        try {
            Files.createDirectories(datasetDir);
            Files.createDirectories(operationSetDir);
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to create metadata directories under " + baseDir, e);
        }
    }

    @Override
    public synchronized Dataset insertDataset(Dataset dataset) {
        if (dataset.getId() == null) {
            dataset.setId(UUID.randomUUID().toString());
        }
        write(file(datasetDir, dataset.getId()), dataset);
        LOG.info("Stored dataset {} ({})", dataset.getId(), dataset.getName());
        return dataset;
    }

    @Override
    public synchronized List<Dataset> getDatasets() {
        List<Dataset> datasets = new ArrayList<>();
        for (Path path : list(datasetDir)) {
            datasets.add(read(path, Dataset.class));
        }
        datasets.sort(Comparator.comparing(Dataset::getName, Comparator.nullsLast(Comparator.naturalOrder())));
        return datasets;
    }

    @Override
    public synchronized Dataset getDataset(String datasetId) {
        Path path = file(datasetDir, datasetId);
        if (!Files.exists(path)) {
            throw new UnknownEntityException("dataset", datasetId);
        }
        return read(path, Dataset.class);
    }

    @Override
    public synchronized Dataset getDatasetByName(String name) {
        for (Dataset dataset : getDatasets()) {
            if (name.equals(dataset.getName())) {
                return dataset;
            }
        }
        throw new UnknownEntityException("dataset named", name);
    }

    @Override
    public synchronized void deleteDataset(String datasetId) {
        Path path = file(datasetDir, datasetId);
        if (!Files.exists(path)) {
            throw new UnknownEntityException("dataset", datasetId);
        }
        List<OperationSet> operationSets = getOperationSetsForDataset(datasetId);
        try {
            for (OperationSet operationSet : operationSets) {
                Files.deleteIfExists(file(operationSetDir, operationSet.getId()));
            }
            Files.delete(path);
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to delete dataset " + datasetId, e);
        }
        LOG.info("Deleted dataset {} and {} operation sets", datasetId, operationSets.size());
    }

    @Override
    public synchronized OperationSet insertOperationSet(OperationSet operationSet) {
        if (!Files.exists(file(datasetDir, operationSet.getDatasetId()))) {
            throw new UnknownEntityException("dataset", operationSet.getDatasetId());
        }
        if (operationSet.getId() == null) {
            operationSet.setId(UUID.randomUUID().toString());
        }
        write(file(operationSetDir, operationSet.getId()), operationSet);
        LOG.debug("Stored operation set {}", operationSet);
        return operationSet;
    }

    @Override
    public synchronized OperationSet getOperationSet(String operationSetId) {
        Path path = file(operationSetDir, operationSetId);
        if (!Files.exists(path)) {
            throw new UnknownEntityException("operation set", operationSetId);
        }
        return read(path, OperationSet.class);
    }

    @Override
    public synchronized List<OperationSet> getOperationSetsForDataset(String datasetId) {
        List<OperationSet> operationSets = new ArrayList<>();
        for (Path path : list(operationSetDir)) {
            OperationSet operationSet = read(path, OperationSet.class);
            if (datasetId.equals(operationSet.getDatasetId())) {
                operationSets.add(operationSet);
            }
        }
        return operationSets;
    }

    @Override
    public synchronized OperationSetUpdate updateOperationSet(String operationSetId, OperationSet operationSet) {
        OperationSet previous = getOperationSet(operationSetId);
        operationSet.setId(operationSetId);
        write(file(operationSetDir, operationSetId), operationSet);
        LOG.debug("Updated operation set {} from {} to {}", operationSetId, previous.getRange(), operationSet.getRange());
        return new OperationSetUpdate(previous, operationSet);
    }

    private static Path file(Path dir, String id) {
        if (id == null || id.isEmpty() || id.contains("/") || id.contains("\\") || id.startsWith(".")) {
            throw new UnknownEntityException("record", id);
        }
        return dir.resolve(id + EXTENSION);
    }

    private static List<Path> list(Path dir) {
        List<Path> paths = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + EXTENSION)) {
            for (Path path : stream) {
                paths.add(path);
            }
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to list " + dir, e);
        }
        return paths;
    }

    private static void write(Path path, Object value) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), value);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to write " + path, e);
        }
    }

    private static <T> T read(Path path, Class<T> type) {
        try {
            return mapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to read " + path, e);
        }
    }
}
