package gr.imsi.athenarc.tsview.datasource;

import gr.imsi.athenarc.tsview.exception.DurableDeleteFailedException;

/**
 * Removes the durable data of a dataset.
 */
public interface DatasetStorage {

    /**
     * @param fileName the data file recorded with the dataset
     * @return false if there was no such file
     * @throws DurableDeleteFailedException if the file exists but cannot be removed
     */
    boolean delete(String fileName) throws DurableDeleteFailedException;
}
