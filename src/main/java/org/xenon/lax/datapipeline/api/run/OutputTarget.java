package org.xenon.lax.datapipeline.api.run;

import java.nio.file.Path;

/**
 * Where and under which logical table name the final dataset is persisted.
 * <p>
 * File stem convention: {@code <base>_SR<n>}; the table is {@code tree}, or
 * {@code treemc} for simulated data.
 *
 * @param baseName   output base ({@code <identifier>_lax} unless overridden)
 * @param scienceRun the science run, appended to the file stem
 * @param tableName  logical table name
 */
public record OutputTarget(String baseName, ScienceRun scienceRun, String tableName) {

    public static final String TABLE_NAME = "tree";
    public static final String SIMULATION_SUFFIX = "mc";

    /**
     * @return {@code <base>_SR<n>}
     */
    public String fileStem() {
        return baseName + "_SR" + scienceRun.getNumber();
    }

    /**
     * @param directory output directory
     * @param extension file extension including the dot (e.g. ".parquet")
     * @return {@code <directory>/<base>_SR<n><extension>}
     */
    public Path resolve(Path directory, String extension) {
        return directory.resolve(fileStem() + extension);
    }
}
