package gr.imsi.athenarc.tsview.metadata;

import gr.imsi.athenarc.tsview.domain.Dataset;
import gr.imsi.athenarc.tsview.domain.OperationSet;
import gr.imsi.athenarc.tsview.domain.OperationSetUpdate;

import java.util.List;

/**
 * Durable record of datasets and operation sets. Lookups of unknown ids throw
 * {@link gr.imsi.athenarc.tsview.exception.UnknownEntityException}.
 */
public interface MetadataStore {

    /**
     * Persists a new dataset, assigning an id when it has none.
     *
     * @return the stored dataset
     */
    Dataset insertDataset(Dataset dataset);

    List<Dataset> getDatasets();

    Dataset getDataset(String datasetId);

    /**
     * @return the first dataset, in {@link #getDatasets()} order, with the given name
     */
    Dataset getDatasetByName(String name);

    /**
     * Removes a dataset together with every operation set defined on it.
     */
    void deleteDataset(String datasetId);

    /**
     * Persists a new operation set, assigning an id when it has none. The dataset must exist.
     */
    OperationSet insertOperationSet(OperationSet operationSet);

    OperationSet getOperationSet(String operationSetId);

    List<OperationSet> getOperationSetsForDataset(String datasetId);

    /**
     * Replaces a stored operation set, keeping its id.
     *
     * @param operationSetId the operation set to update
     * @param operationSet the new contents
     * @return the stored record before and after the update
     */
    OperationSetUpdate updateOperationSet(String operationSetId, OperationSet operationSet);
}
