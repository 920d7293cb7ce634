package org.xenon.lax.datapipeline.api.run;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Minitree field groups a run may require, in loading order.
 * <p>
 * The first group defines the event order of the loaded dataset. Groups carrying
 * detector-monitoring information (DAQ proximity, flash identification, S2 tails)
 * do not exist for simulated data.
 */
public enum MinitreeGroup {
    FUNDAMENTALS("Fundamentals", true),
    BASICS("Basics", true),
    EXTENDED("Extended", true),
    CORRECTED_DOUBLE_S1_SCATTER("CorrectedDoubleS1Scatter", true),
    LARGEST_PEAK_PROPERTIES("LargestPeakProperties", true),
    POSITION_RECONSTRUCTION("PositionReconstruction", true),
    PROXIMITY("Proximity", false),
    FLASH_IDENTIFICATION("FlashIdentification", false),
    S2_TAILS("S2Tails", false);

    private final String treeName;
    private final boolean availableForSimulation;

    MinitreeGroup(String treeName, boolean availableForSimulation) {
        this.treeName = treeName;
        this.availableForSimulation = availableForSimulation;
    }

    /**
     * @return the minitree name used in file names (e.g. "Fundamentals")
     */
    public String getTreeName() {
        return treeName;
    }

    public boolean isAvailableForSimulation() {
        return availableForSimulation;
    }

    /**
     * @param simulation whether simulated data is processed
     * @return the groups to load, in loading order
     */
    public static List<MinitreeGroup> requiredFor(boolean simulation) {
        return Arrays.stream(values())
            .filter(group -> !simulation || group.availableForSimulation)
            .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return treeName;
    }
}
