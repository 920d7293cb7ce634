package org.xenon.lax.datapipeline.api.cuts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.xenon.lax.datapipeline.api.dataset.Column;
import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.CutEvaluationException;

/**
 * Unit tests for predicate, range and composite cuts.
 */
@Tag("unit")
class CutTest {

    private static Dataset values(double... s2) {
        return Dataset.of(s2.length, List.of(Column.ofDoubles("s2", s2)));
    }

    @Test
    void of_EvaluatesPredicatePerRow() {
        Cut cut = Cut.of("S2Big", CutCategory.S2_QUALITY, 1, List.of("s2"), e -> e.get("s2") > 100);

        Dataset result = cut.evaluate(values(50, 150, Double.NaN));

        Column column = result.column("CutS2Big");
        assertThat(column.getBoolean(0)).isFalse();
        assertThat(column.getBoolean(1)).isTrue();
        assertThat(column.getBoolean(2)).isFalse();
    }

    @Test
    @DisplayName("Range bounds are exclusive on both ends")
    void range_BoundsAreExclusive() {
        Cut cut = Cut.range("Window", CutCategory.ENERGY, 0, "s2", 0, 200);

        Column column = cut.evaluate(values(0, 1, 199.9, 200)).column("CutWindow");

        assertThat(column.getBoolean(0)).isFalse();
        assertThat(column.getBoolean(1)).isTrue();
        assertThat(column.getBoolean(2)).isTrue();
        assertThat(column.getBoolean(3)).isFalse();
    }

    @Test
    void evaluate_ReadingUndeclaredField_Fails() {
        Dataset dataset = Dataset.of(1, List.of(
            Column.ofDoubles("s1", new double[] {1}),
            Column.ofDoubles("s2", new double[] {2})));
        Cut sneaky = Cut.of("Sneaky", CutCategory.S1_QUALITY, 0, List.of("s1"), e -> e.get("s2") > 0);

        assertThatThrownBy(() -> sneaky.evaluate(dataset))
            .isInstanceOf(CutEvaluationException.class)
            .hasMessageContaining("undeclared field 's2'")
            .satisfies(e -> assertThat(((CutEvaluationException) e).getSubject()).isEqualTo("CutSneaky"));
    }

    @Test
    void evaluate_PredicateThrows_WrapsInCutEvaluationException() {
        Cut broken = Cut.of("Broken", CutCategory.S2_QUALITY, 0, List.of("s2"), e -> {
            throw new ArithmeticException("boom");
        });

        assertThatThrownBy(() -> broken.evaluate(values(1)))
            .isInstanceOf(CutEvaluationException.class)
            .hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    void evaluate_MissingField_Fails() {
        Cut cut = Cut.of("NeedsZ", CutCategory.FIDUCIAL, 0, List.of("z"), e -> e.get("z") < 0);

        assertThatThrownBy(() -> cut.evaluate(values(1)))
            .isInstanceOf(CutEvaluationException.class)
            .hasMessageContaining("[z]");
    }

    @Test
    @DisplayName("Composite cut appends its parts before its own column")
    void allOf_AppendsPartsThenAggregate() {
        Cut low = Cut.of("Low", CutCategory.DAQ_VETO, 1, List.of("s2"), e -> e.get("s2") > 10);
        Cut high = Cut.of("High", CutCategory.DAQ_VETO, 1, List.of("s2"), e -> e.get("s2") < 100);
        Cut both = Cut.allOf("Both", CutCategory.DAQ_VETO, 1, List.of(low, high));

        Dataset result = both.evaluate(values(5, 50, 500));

        assertThat(result.columnNames()).containsExactly("s2", "CutLow", "CutHigh", "CutBoth");
        assertThat(both.outputColumns()).containsExactly("CutLow", "CutHigh", "CutBoth");
        assertThat(both.requiredFields()).containsExactly("s2");
        assertThat(both.getParts()).containsExactly(low, high);
        assertThat(result.column("CutBoth").countTrue()).isEqualTo(1);
        assertThat(result.column("CutBoth").getBoolean(1)).isTrue();
    }

    @Test
    void definitionKey_DependsOnVersionAndCategory() {
        Cut v1 = Cut.of("X", CutCategory.S2_QUALITY, 1, List.of("s2"), e -> true);
        Cut v2 = Cut.of("X", CutCategory.S2_QUALITY, 2, List.of("s2"), e -> true);
        Cut otherCategory = Cut.of("X", CutCategory.FLASH, 1, List.of("s2"), e -> true);

        assertThat(v1.sameDefinitionAs(v2)).isFalse();
        assertThat(v1.sameDefinitionAs(otherCategory)).isFalse();
        assertThat(v1.sameDefinitionAs(Cut.of("X", CutCategory.S2_QUALITY, 1, List.of("s2"), e -> false))).isTrue();
    }

    @Test
    void evaluate_ExistingColumnFromOtherVersion_Collides() {
        Cut v1 = Cut.of("X", CutCategory.S2_QUALITY, 1, List.of("s2"), e -> true);
        Cut v2 = Cut.of("X", CutCategory.S2_QUALITY, 2, List.of("s2"), e -> true);

        Dataset withV1 = v1.evaluate(values(1, 2));

        assertThatThrownBy(() -> v2.evaluate(withV1))
            .isInstanceOf(CutEvaluationException.class)
            .hasMessageContaining("CutX");
    }
}
