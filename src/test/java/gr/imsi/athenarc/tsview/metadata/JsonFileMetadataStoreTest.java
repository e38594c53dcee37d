package gr.imsi.athenarc.tsview.metadata;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import gr.imsi.athenarc.tsview.domain.Condition;
import gr.imsi.athenarc.tsview.domain.Dataset;
import gr.imsi.athenarc.tsview.domain.OperationSet;
import gr.imsi.athenarc.tsview.domain.OperationSetUpdate;
import gr.imsi.athenarc.tsview.exception.UnknownEntityException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonFileMetadataStoreTest {

    @TempDir
    Path baseDir;

    private JsonFileMetadataStore store;

    @BeforeEach
    public void setUp() {
        store = new JsonFileMetadataStore(baseDir);
    }

    private Dataset dataset(String name) {
        Dataset dataset = new Dataset();
        dataset.setName(name);
        dataset.setFileName(name + ".csv");
        dataset.setSeriesCols(Arrays.asList("a", "b"));
        dataset.setTimestampCols(Collections.singletonList("ts"));
        dataset.setNumSeries(2);
        dataset.setMaxLength(1000);
        dataset.setConditions(Arrays.asList(Condition.UNEVEN, Condition.GAPS));
        return store.insertDataset(dataset);
    }

    @Test
    public void testDatasetIsPersistedAsJson() throws Exception {
        Dataset stored = dataset("energy");

        assertNotNull(stored.getId());
        Path file = baseDir.resolve("datasets").resolve(stored.getId() + ".json");
        assertTrue(Files.exists(file));
        assertTrue(new String(Files.readAllBytes(file), "UTF-8").contains("\"Uneven\""));

        Dataset reread = new JsonFileMetadataStore(baseDir).getDataset(stored.getId());
        assertEquals("energy", reread.getName());
        assertEquals(Arrays.asList("a", "b"), reread.getSeriesCols());
        assertEquals("ts", reread.getTimestampColumn());
        assertEquals(Arrays.asList(Condition.UNEVEN, Condition.GAPS), reread.getConditions());
        assertEquals(1000, reread.getMaxLength());
    }

    @Test
    public void testDatasetsAreListedByName() {
        dataset("zeta");
        dataset("alpha");
        List<Dataset> datasets = store.getDatasets();
        assertEquals(2, datasets.size());
        assertEquals("alpha", datasets.get(0).getName());
    }

    @Test
    public void testDatasetIsFoundByName() {
        dataset("zeta");
        Dataset alpha = dataset("alpha");

        assertEquals(alpha.getId(), store.getDatasetByName("alpha").getId());
        assertThrows(UnknownEntityException.class, () -> store.getDatasetByName("omega"));
    }

    @Test
    public void testUnknownIdsAreRejected() {
        assertThrows(UnknownEntityException.class, () -> store.getDataset("missing"));
        assertThrows(UnknownEntityException.class, () -> store.getOperationSet("missing"));
        assertThrows(UnknownEntityException.class, () -> store.deleteDataset("missing"));
        assertThrows(UnknownEntityException.class, () -> store.getDataset("../outside"));
        assertThrows(UnknownEntityException.class,
                () -> store.updateOperationSet("missing", new OperationSet()));
    }

    @Test
    public void testOperationSetNeedsAnExistingDataset() {
        OperationSet operationSet = new OperationSet(null, "missing", Collections.singletonList("a"), 0, 10);
        assertThrows(UnknownEntityException.class, () -> store.insertOperationSet(operationSet));
    }

    @Test
    public void testOperationSetRoundTripsWithDefaults() {
        Dataset dataset = dataset("energy");
        OperationSet operationSet = new OperationSet();
        operationSet.setDatasetId(dataset.getId());
        operationSet.setSeriesIds(Collections.singletonList("a"));
        operationSet.setDependent("parent-view");

        OperationSet stored = store.insertOperationSet(operationSet);
        OperationSet reread = store.getOperationSet(stored.getId());

        assertEquals(stored, reread);
        assertEquals(0, reread.getOffset());
        assertEquals(OperationSet.DEFAULT_LIMIT, reread.getLimit());
        assertEquals("parent-view", reread.getDependent());
    }

    @Test
    public void testUpdateReturnsPreviousAndCurrent() {
        Dataset dataset = dataset("energy");
        OperationSet stored = store.insertOperationSet(
                new OperationSet(null, dataset.getId(), Collections.singletonList("a"), 0, 100));

        OperationSetUpdate update = store.updateOperationSet(stored.getId(), stored.withRange(10, 20));

        assertEquals(0, update.getPrevious().getOffset());
        assertEquals(100, update.getPrevious().getLimit());
        assertEquals(10, update.getCurrent().getOffset());
        assertEquals(stored.getId(), update.getCurrent().getId());
        assertEquals(update.getCurrent(), store.getOperationSet(stored.getId()));
    }

    @Test
    public void testDeletingDatasetDeletesItsOperationSets() {
        Dataset kept = dataset("kept");
        Dataset dropped = dataset("dropped");
        OperationSet keptView = store.insertOperationSet(
                new OperationSet(null, kept.getId(), Collections.singletonList("a"), 0, 10));
        OperationSet droppedView = store.insertOperationSet(
                new OperationSet(null, dropped.getId(), Collections.singletonList("a"), 0, 10));

        store.deleteDataset(dropped.getId());

        assertThrows(UnknownEntityException.class, () -> store.getDataset(dropped.getId()));
        assertThrows(UnknownEntityException.class, () -> store.getOperationSet(droppedView.getId()));
        assertEquals(Collections.singletonList(keptView), store.getOperationSetsForDataset(kept.getId()));
    }
}
