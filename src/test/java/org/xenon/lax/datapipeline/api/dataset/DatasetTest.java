package org.xenon.lax.datapipeline.api.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.xenon.lax.datapipeline.api.errors.ColumnCollisionException;

/**
 * Unit tests for {@link Dataset}.
 */
@Tag("unit")
class DatasetTest {

    private static Dataset raw() {
        return Dataset.of(3, List.of(
            Column.ofLongs("event_number", new long[] {10, 11, 12}),
            Column.ofDoubles("s1", new double[] {1.5, Double.NaN, 30.0})));
    }

    @Test
    @DisplayName("withCutColumn appends at the end and leaves the original untouched")
    void withCutColumn_AppendsNewColumn() {
        Dataset original = raw();

        Dataset extended = original.withCutColumn("CutA", new boolean[] {true, false, true}, "CutA@v0:ENERGY");

        assertThat(extended.columnNames()).containsExactly("event_number", "s1", "CutA");
        assertThat(original.columnNames()).containsExactly("event_number", "s1");
        assertThat(extended.column("CutA").countTrue()).isEqualTo(2);
        assertThat(extended.producerOf("CutA")).contains("CutA@v0:ENERGY");
        assertThat(extended.cutColumnNames()).containsExactly("CutA");
    }

    @Test
    @DisplayName("Re-adding a column from the same definition returns the same dataset")
    void withCutColumn_SameDefinition_IsReused() {
        Dataset once = raw().withCutColumn("CutA", new boolean[] {true, false, true}, "key");

        Dataset twice = once.withCutColumn("CutA", new boolean[] {false, false, false}, "key");

        assertThat(twice).isSameAs(once);
        assertThat(twice.column("CutA").countTrue()).isEqualTo(2);
    }

    @Test
    void withCutColumn_DifferentDefinition_Throws() {
        Dataset once = raw().withCutColumn("CutA", new boolean[3], "key-1");

        assertThatThrownBy(() -> once.withCutColumn("CutA", new boolean[3], "key-2"))
            .isInstanceOf(ColumnCollisionException.class)
            .hasMessageContaining("key-1");
    }

    @Test
    void withCutColumn_RawFieldName_Throws() {
        assertThatThrownBy(() -> raw().withCutColumn("s1", new boolean[3], "key"))
            .isInstanceOf(ColumnCollisionException.class)
            .hasMessageContaining("raw field");
    }

    @Test
    void of_MismatchedColumnLength_Throws() {
        assertThatThrownBy(() -> Dataset.of(2, List.of(Column.ofDoubles("x", new double[] {1.0}))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("x");
    }

    @Test
    void of_DuplicateNames_Throws() {
        assertThatThrownBy(() -> Dataset.of(1, List.of(
                Column.ofDoubles("x", new double[] {1.0}),
                Column.ofDoubles("x", new double[] {2.0}))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingFields_ReportsOnlyAbsentFieldsInOrder() {
        assertThat(raw().missingFields(List.of("z", "s1", "a")))
            .containsExactly("z", "a");
    }

    @Test
    void column_Absent_Throws() {
        assertThatThrownBy(() -> raw().column("nope")).isInstanceOf(IllegalArgumentException.class);
        assertThat(raw().findColumn("nope")).isEmpty();
    }

    @Test
    void columnReads_ConvertBetweenTypes() {
        Column doubles = Column.ofDoubles("d", new double[] {0.0, Double.NaN, -2.5});
        Column flags = Column.ofBooleans("b", new boolean[] {true, false, true});

        assertThat(doubles.getBoolean(0)).isFalse();
        assertThat(doubles.getBoolean(1)).isFalse();
        assertThat(doubles.getBoolean(2)).isTrue();
        assertThat(flags.getDouble(0)).isEqualTo(1.0);
        assertThat(flags.countTrue()).isEqualTo(2);
        assertThatThrownBy(() -> doubles.getLong(0)).isInstanceOf(IllegalStateException.class);
    }
}
