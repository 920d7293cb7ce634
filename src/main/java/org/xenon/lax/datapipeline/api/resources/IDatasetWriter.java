package org.xenon.lax.datapipeline.api.resources;

import java.nio.file.Path;

import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.WriteException;

/**
 * Sink persisting the final dataset to a columnar file.
 */
public interface IDatasetWriter {

    /**
     * @return the file extension this writer produces, including the dot
     */
    String fileExtension();

    /**
     * Persists {@code dataset} at {@code target}. Either the complete file appears at
     * {@code target} or nothing does.
     *
     * @param dataset   the dataset to write
     * @param target    destination file
     * @param tableName logical table name
     * @throws WriteException if the destination cannot be written
     */
    void write(Dataset dataset, Path target, String tableName);
}
