package org.xenon.lax.datapipeline.api.run;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RunValuesTest {

    @Test
    @DisplayName("Exact policy accepts only its version, loose accepts all")
    void dataVersionPolicy() {
        DataVersionPolicy exact = DataVersionPolicy.exact("6.8.0");

        assertThat(exact.accepts("6.8.0")).isTrue();
        assertThat(exact.accepts("6.10.1")).isFalse();
        assertThat(exact.describe()).isEqualTo("6.8.0");
        assertThat(DataVersionPolicy.loose().accepts("anything")).isTrue();
        assertThat(DataVersionPolicy.loose().describe()).isEqualTo("loose");
        assertThat(exact).isEqualTo(DataVersionPolicy.exact("6.8.0"));
    }

    @Test
    @DisplayName("Simulation drops the detector-monitoring minitree groups and keeps order")
    void minitreeGroups() {
        assertThat(MinitreeGroup.requiredFor(false)).hasSize(9).first().isEqualTo(MinitreeGroup.FUNDAMENTALS);
        assertThat(MinitreeGroup.requiredFor(true))
            .containsExactly(MinitreeGroup.FUNDAMENTALS, MinitreeGroup.BASICS, MinitreeGroup.EXTENDED,
                MinitreeGroup.CORRECTED_DOUBLE_S1_SCATTER, MinitreeGroup.LARGEST_PEAK_PROPERTIES,
                MinitreeGroup.POSITION_RECONSTRUCTION);
    }

    @Test
    @DisplayName("Output stem carries the science run")
    void outputTarget() {
        OutputTarget target = new OutputTarget("6386_lax", ScienceRun.SR1, "tree");

        assertThat(target.fileStem()).isEqualTo("6386_lax_SR1");
        assertThat(target.resolve(Path.of("out"), ".parquet")).isEqualTo(Path.of("out", "6386_lax_SR1.parquet"));
    }
}
