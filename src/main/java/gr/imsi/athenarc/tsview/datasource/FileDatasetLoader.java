package gr.imsi.athenarc.tsview.datasource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.cache.TableCodec;
import gr.imsi.athenarc.tsview.domain.Dataset;
import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.exception.DurableDeleteFailedException;
import gr.imsi.athenarc.tsview.exception.DurableLoadFailedException;
import gr.imsi.athenarc.tsview.metadata.MetadataStore;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads the raw table of a dataset from the data directory, using the file name recorded with the
 * dataset. Two layouts are understood: {@code .csv} text files and {@code .tsv.bin} columnar files
 * written by {@link #save(Table, String)}. Also removes those files when their dataset is deleted.
 */
public class FileDatasetLoader implements DatasetLoader, DatasetStorage {

    private static final Logger LOG = LoggerFactory.getLogger(FileDatasetLoader.class);

    public static final String CSV_EXTENSION = ".csv";
    public static final String COLUMNAR_EXTENSION = ".tsv.bin";

    private final MetadataStore metadataStore;
    private final Path dataDir;
    private final CsvTableReader csvReader = new CsvTableReader();
    private final TableCodec codec = new TableCodec();

    public FileDatasetLoader(MetadataStore metadataStore, Path dataDir) {
        this.metadataStore = metadataStore;
        this.dataDir = dataDir;
    }

    @Override
    public Table load(String datasetId) {
        Dataset dataset = metadataStore.getDataset(datasetId);
        Path file = resolve(dataset.getFileName());
        if (!Files.isRegularFile(file)) {
            throw new DurableLoadFailedException("Data file " + file + " of dataset " + datasetId + " does not exist");
        }
        try {
            Table table = read(file);
            LOG.debug("Loaded dataset {} from {}", datasetId, file);
            return table.withTimestampColumn(dataset.getTimestampColumn());
        } catch (IOException | IllegalArgumentException e) {
            throw new DurableLoadFailedException("Failed to load dataset " + datasetId + " from " + file, e);
        }
    }

    /**
     * Reads a data file in either supported layout.
     */
    public Table read(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(COLUMNAR_EXTENSION)) {
            try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
                return codec.readTable(in);
            }
        }
        if (name.endsWith(CSV_EXTENSION)) {
            return csvReader.read(file);
        }
        throw new IOException("Unsupported data file " + file);
    }

    /**
     * Writes a table in the columnar layout under the data directory.
     *
     * @return the file name to record with the dataset
     */
    public String save(Table table, String baseName) throws IOException {
        String fileName = baseName.endsWith(COLUMNAR_EXTENSION) ? baseName : baseName + COLUMNAR_EXTENSION;
        Path file = resolve(fileName);
        Files.createDirectories(file.getParent());
        try (OutputStream out = Files.newOutputStream(file)) {
            codec.writeTable(table, out);
        }
        LOG.info("Wrote {} rows to {}", table.getRowCount(), file);
        return fileName;
    }

    @Override
    public boolean delete(String fileName) {
        Path file = locate(fileName);
        if (file == null) {
            throw new DurableDeleteFailedException("Data file " + fileName + " lies outside " + dataDir);
        }
        try {
            if (!Files.deleteIfExists(file)) {
                LOG.info("Data file {} was already gone", file);
                return false;
            }
        } catch (IOException e) {
            throw new DurableDeleteFailedException("Failed to delete data file " + file, e);
        }
        LOG.info("Deleted data file {}", file);
        return true;
    }

    private Path resolve(String fileName) {
        Path file = locate(fileName);
        if (file == null) {
            throw new DurableLoadFailedException("Data file " + fileName + " lies outside " + dataDir);
        }
        return file;
    }

    /**
     * @return the file under the data directory, or null if the name escapes it
     */
    private Path locate(String fileName) {
        Path file = dataDir.resolve(fileName).normalize();
        return file.startsWith(dataDir.normalize()) ? file : null;
    }
}
