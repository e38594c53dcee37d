package gr.imsi.athenarc.tsview.datasource;

import gr.imsi.athenarc.tsview.domain.Table;
import gr.imsi.athenarc.tsview.exception.DurableLoadFailedException;

/**
 * Reads the raw table of a dataset from durable storage.
 */
@FunctionalInterface
public interface DatasetLoader {

    /**
     * @param datasetId the dataset to read
     * @return the full raw table
     * @throws DurableLoadFailedException if the data cannot be read
     */
    Table load(String datasetId) throws DurableLoadFailedException;
}
