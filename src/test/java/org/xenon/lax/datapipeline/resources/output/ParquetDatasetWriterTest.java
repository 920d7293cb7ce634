package org.xenon.lax.datapipeline.resources.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.xenon.lax.datapipeline.api.dataset.Column;
import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.WriteException;
import org.xenon.lax.datapipeline.resources.DuckDbSupport;

/**
 * Integration tests for {@link ParquetDatasetWriter}, reading the output back with DuckDB.
 */
@Tag("integration")
class ParquetDatasetWriterTest {

    @TempDir
    Path dir;

    private static Dataset dataset() {
        return Dataset.of(3, List.of(
                Column.ofLongs("event_number", new long[] {1, 2, 3}),
                Column.ofDoubles("s1", new double[] {1.5, Double.NaN, 3.5})))
            .withCutColumn("CutS1", new boolean[] {true, false, true}, "CutS1@v0:ENERGY");
    }

    @Test
    void write_ProducesReadableParquet() throws Exception {
        Path target = dir.resolve("6731_lax_SR0.parquet");

        new ParquetDatasetWriter("ZSTD", 2).write(dataset(), target, "tree");

        assertThat(target).exists();
        try (Connection conn = DriverManager.getConnection(DuckDbSupport.IN_MEMORY_URL);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT event_number, s1, \"CutS1\" FROM read_parquet("
                 + DuckDbSupport.pathLiteral(target) + ") ORDER BY event_number")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getLong(1)).isEqualTo(1);
            assertThat(rs.getDouble(2)).isEqualTo(1.5);
            assertThat(rs.getBoolean(3)).isTrue();
            assertThat(rs.next()).isTrue();
            assertThat(rs.getBoolean(3)).isFalse();
            assertThat(rs.next()).isTrue();
            assertThat(rs.next()).isFalse();
        }
    }

    @Test
    void write_LeavesOnlyTheTargetFile() throws Exception {
        Path target = dir.resolve("out").resolve("sim001_lax_SR1.parquet");

        new ParquetDatasetWriter("snappy", 100).write(dataset(), target, "treemc");

        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void write_StoresTableNameInMetadata() throws Exception {
        Path target = dir.resolve("sim001_lax_SR1.parquet");

        new ParquetDatasetWriter("ZSTD", 10).write(dataset(), target, "treemc");

        try (Connection conn = DriverManager.getConnection(DuckDbSupport.IN_MEMORY_URL);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT decode(key), decode(value) FROM parquet_kv_metadata("
                 + DuckDbSupport.pathLiteral(target) + ") WHERE decode(key) = '"
                 + ParquetDatasetWriter.TABLE_METADATA_KEY + "'")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getString(1)).isEqualTo("table");
            assertThat(rs.getString(2)).isEqualTo("treemc");
            assertThat(rs.next()).isFalse();
        }
    }

    @Test
    void write_Failure_LeavesNothingBehind() throws Exception {
        Path target = dir.resolve("empty_SR0.parquet");

        assertThatThrownBy(() -> new ParquetDatasetWriter("ZSTD", 10).write(Dataset.empty(0), target, "tree"))
            .isInstanceOf(WriteException.class)
            .satisfies(e -> assertThat(((WriteException) e).getSubject()).isEqualTo(target.toString()));

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void write_ReplacesExistingOutput() throws Exception {
        Path target = dir.resolve("6731_lax_SR0.parquet");
        Files.writeString(target, "stale");

        new ParquetDatasetWriter("ZSTD", 10).write(dataset(), target, "tree");

        assertThat(Files.size(target)).isGreaterThan(5);
    }

    @Test
    void constructor_RejectsUnknownCodec() {
        assertThatThrownBy(() -> new ParquetDatasetWriter("LZMA", 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ParquetDatasetWriter("ZSTD", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
