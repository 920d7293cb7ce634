package org.xenon.lax.datapipeline.cuts;

import static org.xenon.lax.datapipeline.api.cuts.CutCategory.DAQ_VETO;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.ENERGY;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.FIDUCIAL;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.FLASH;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.INTERACTION;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.MUON_VETO;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.POSITION;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.S1_QUALITY;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.S2_QUALITY;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.S2_TAIL;
import static org.xenon.lax.datapipeline.api.cuts.CutCategory.SIGNAL_NOISE;

import java.util.List;

import org.xenon.lax.datapipeline.api.cuts.Cut;
import org.xenon.lax.datapipeline.api.cuts.CutGroup;

/**
 * Definitions of the event-quality cuts and the cut groups built from them.
 * <p>
 * Units follow the processor conventions: lengths in cm, times in ns, areas in PE.
 * Comparisons involving NaN are false, which is how undefined quantities (e.g. no second
 * S2 in the event) propagate into the selections below.
 */
public final class QualityCuts {

    private static final double US = 1e3;
    private static final double SECOND = 1e9;

    private QualityCuts() {
    }

    // ---------------------------------------------------------------------
    // Position and interaction
    // ---------------------------------------------------------------------

    /**
     * Z-optimized fiducial volume keeping the expected background rate roughly
     * uniform in z within each radial slice.
     */
    public static final Cut FIDUCIAL_Z_OPTIMIZED = Cut.of("FiducialZOptimized", FIDUCIAL, 4,
        List.of("z_3d_nn", "r_3d_nn"), e -> {
            double z = e.get("z_3d_nn");
            double r = e.get("r_3d_nn");
            return -94 < z && z < -8 && r < 42.8387
                && z < -2.63725 - 0.00946597 * r * r
                && z > -158.173 + 0.0456094 * r * r;
        });

    /** An S1 was paired with the main S2. */
    public static final Cut INTERACTION_EXISTS = Cut.of("InteractionExists", INTERACTION, 0,
        List.of("cs1"), e -> 0 < e.get("cs1"));

    /** The main S1 and S2 are the largest peaks of their kind. */
    public static final Cut INTERACTION_PEAKS_BIGGEST = Cut.of("InteractionPeaksBiggest", INTERACTION, 0,
        List.of("s1", "largest_other_s1", "s2", "largest_other_s2"),
        e -> e.get("s1") > e.get("largest_other_s1") && e.get("s2") > e.get("largest_other_s2"));

    /** Low-energy band: 0 < cS1 < 200 PE. */
    public static final Cut S1_LOW_ENERGY_RANGE = Cut.range("S1LowEnergyRange", ENERGY, 0, "cs1", 0, 200);

    /** Position difference between the NN and TPF reconstructions, to reject wall leakage. */
    public static final Cut POS_DIFF = Cut.of("PosDiff", POSITION, 4,
        List.of("x_observed_nn", "x_observed_tpf", "y_observed_nn", "y_observed_tpf", "s2"), e -> {
            double dx = e.get("x_observed_nn") - e.get("x_observed_tpf");
            double dy = e.get("y_observed_nn") - e.get("y_observed_tpf");
            return Math.sqrt(dx * dx + dy * dy) < 2429.322 * Math.exp(-Math.log10(e.get("s2")) / 0.362) + 1.587;
        });

    // ---------------------------------------------------------------------
    // S2 quality
    // ---------------------------------------------------------------------

    /** S2 size above which the trigger is fully efficient. */
    public static final Cut S2_THRESHOLD = Cut.of("S2Threshold", S2_QUALITY, 1,
        List.of("s2"), e -> 200 < e.get("s2"));

    /**
     * cS2 area fraction top, aimed at gas events. 99% acceptance,
     * valid for S2 below 10000 PE.
     */
    public static final Cut CS2_AREA_FRACTION_TOP = Cut.allOf("CS2AreaFractionTop", S2_QUALITY, 0, List.of(
        Cut.of("CS2AreaFractionTopUpper", S2_QUALITY, 0, List.of("cs2_top", "cs2", "s2"),
            e -> e.get("cs2_top") / e.get("cs2") < 0.63756073 + 1.42873942 / Math.sqrt(e.get("s2"))),
        Cut.of("CS2AreaFractionTopLower", S2_QUALITY, 0, List.of("cs2_top", "cs2", "s2"),
            e -> e.get("cs2_top") / e.get("cs2") > 0.62752992 - 1.79928264 / Math.sqrt(e.get("s2")))));

    /**
     * The largest other S2 must be small compared to the main S2, blending a low-energy
     * and a high-energy bound around S2 = 23300 PE.
     */
    public static final Cut S2_SINGLE_SCATTER = Cut.of("S2SingleScatter", S2_QUALITY, 4,
        List.of("largest_other_s2", "s2"), e -> {
            double other = e.get("largest_other_s2");
            return Double.isNaN(other) || other < otherS2Bound(e.get("s2"));
        });

    /** Low-energy limit of {@link #S2_SINGLE_SCATTER}, for S2 below 20000 PE. */
    public static final Cut S2_SINGLE_SCATTER_SIMPLE = Cut.of("S2SingleScatterSimple", S2_QUALITY, 2,
        List.of("largest_other_s2", "s2"), e -> {
            double other = e.get("largest_other_s2");
            return !(other > 0) || other < e.get("s2") * 0.00832 + 72.3;
        });

    public static final Cut S2_PATTERN_LIKELIHOOD = Cut.of("S2PatternLikelihood", S2_QUALITY, 1,
        List.of("s2_pattern_fit", "s2"), e -> {
            double s2 = e.get("s2");
            return e.get("s2_pattern_fit") < 0.0390 * s2 + 609 * Math.pow(s2, 0.0602) - 666;
        });

    /**
     * S2 width consistent with the diffusion expected at the event's depth.
     * Events within the gate drift time pass.
     */
    public static final Cut S2_WIDTH = Cut.of("S2Width", S2_QUALITY, 6,
        List.of("drift_time", "s2", "s2_range_50p_area"), e -> {
            double driftTime = e.get("drift_time");
            if (!(driftTime > S2WidthModel.DRIFT_TIME_FROM_GATE)) {
                return true;
            }
            return S2WidthModel.logLikelihood(e.get("s2"), e.get("s2_range_50p_area"), driftTime) > -14;
        });

    // ---------------------------------------------------------------------
    // S1 quality
    // ---------------------------------------------------------------------

    /**
     * No second valid interaction: if the alternative S1 would also make a width-consistent
     * interaction with the main S2, the S1 may be misidentified and the event is cut.
     */
    public static final Cut S1_SINGLE_SCATTER = Cut.of("S1SingleScatter", S1_QUALITY, 4,
        List.of("alt_s1_interaction_drift_time", "s2", "s2_range_50p_area"), e -> {
            double altDriftTime = e.get("alt_s1_interaction_drift_time");
            if (!(altDriftTime > S2WidthModel.DRIFT_TIME_FROM_GATE)) {
                return true;
            }
            boolean altInteractionPasses =
                S2WidthModel.logLikelihood(e.get("s2"), e.get("s2_range_50p_area"), altDriftTime) > -20;
            return !altInteractionPasses;
        });

    /** Removes Kr83m events whose 32 keV S1 was identified as an S2. */
    public static final Cut KRYPTON_MIS_ID_S1 = Cut.of("KryptonMisIdS1", S1_QUALITY, 0,
        List.of("largest_other_s2", "largest_other_s2_delay_main_s1"), e -> {
            double delay = e.get("largest_other_s2_delay_main_s1");
            return e.get("largest_other_s2") < 100 || delay < -3000 || delay > 0;
        });

    /** Accidental coincidences of lone S1 and lone S2, tested on both PMT arrays. */
    public static final Cut S1_PATTERN_LIKELIHOOD = Cut.allOf("S1PatternLikelihood", S1_QUALITY, 3, List.of(
        Cut.of("S1TopPatternLikelihood", S1_QUALITY, 3,
            List.of("s1", "s1_area_fraction_top", "s1_pattern_fit_hax", "s1_pattern_fit_bottom_hax"), e -> {
                double s1t = e.get("s1") * e.get("s1_area_fraction_top");
                return e.get("s1_pattern_fit_hax") - e.get("s1_pattern_fit_bottom_hax")
                    < 13.0 + 2.3 * Math.pow(s1t, 0.5) + 8.0 * s1t - 1.0 * Math.pow(s1t, 1.5)
                    + 0.04 * Math.pow(s1t, 2.0);
            }),
        Cut.of("S1BottomPatternLikelihood", S1_QUALITY, 3,
            List.of("s1", "s1_area_fraction_top", "s1_pattern_fit_bottom_hax"), e -> {
                double s1b = e.get("s1") * (1.0 - e.get("s1_area_fraction_top"));
                return e.get("s1_pattern_fit_bottom_hax")
                    < -10.5 + 21.9 * Math.pow(s1b, 0.5) + 1.44 * s1b - 0.21 * Math.pow(s1b, 1.5)
                    + 0.0064 * Math.pow(s1b, 2.0);
            })));

    /** 99% quantile of the largest single-PMT hit area. */
    public static final Cut S1_MAX_PMT = Cut.of("S1MaxPMT", S1_QUALITY, 0,
        List.of("s1_largest_hit_area", "s1"), e -> e.get("s1_largest_hit_area") < 0.052 * e.get("s1") + 4.15);

    public static final Cut S1_AREA_FRACTION_TOP = Cut.of("S1AreaFractionTop", S1_QUALITY, 4,
        List.of("s1_area_fraction_top_probability_hax"), e -> e.get("s1_area_fraction_top_probability_hax") > 0.001);

    public static final Cut S1_WIDTH = Cut.of("S1Width", S1_QUALITY, 1,
        List.of("s1_range_90p_area", "s1"), e -> {
            double s1 = e.get("s1");
            return e.get("s1_range_90p_area") < 251.528247 + 11.50 * Math.pow(s1, 1.171407) * Math.exp(-0.057395 * s1);
        });

    /** Light concentrated near the upper Rn220 injection point. */
    public static final Cut S1_AREA_UPPER_INJECTION_FRACTION = Cut.of("S1AreaUpperInjectionFraction", S1_QUALITY, 1,
        List.of("s1_area_upper_injection_fraction", "s1"),
        e -> e.get("s1_area_upper_injection_fraction") < 0.0865 + 1.205 / Math.pow(e.get("s1"), 0.83367));

    /** Light concentrated near the lower Rn220 injection point. */
    public static final Cut S1_AREA_LOWER_INJECTION_FRACTION = Cut.of("S1AreaLowerInjectionFraction", S1_QUALITY, 0,
        List.of("s1_area_lower_injection_fraction", "s1"),
        e -> e.get("s1_area_lower_injection_fraction") < 0.0550 + 1.56 / Math.pow(e.get("s1"), 0.87000));

    public static final Cut PRE_S2_JUNK = Cut.of("PreS2Junk", SIGNAL_NOISE, 1,
        List.of("area_before_main_s2", "s1"), e -> e.get("area_before_main_s2") - e.get("s1") < 300);

    // ---------------------------------------------------------------------
    // Detector conditions (not applicable to simulated data)
    // ---------------------------------------------------------------------

    /**
     * No DAQ busy or high-energy veto during the event, last busy state is "off",
     * and the event is not in the last 21 seconds of its run.
     */
    public static final Cut DAQ_VETO_CUT = Cut.allOf("DAQVeto", DAQ_VETO, 1, List.of(
        Cut.of("EndOfRunCheck", DAQ_VETO, 1, List.of("event_time", "run_end_time"),
            e -> e.get("event_time") < e.get("run_end_time") - 21 * SECOND),
        Cut.of("BusyTypeCheck", DAQ_VETO, 1, List.of("previous_busy_on", "previous_busy_off"),
            e -> !(e.get("previous_busy_on") < 60 * SECOND) || e.get("previous_busy_off") < e.get("previous_busy_on")),
        Cut.of("BusyCheck", DAQ_VETO, 1, List.of("nearest_busy", "event_duration"),
            e -> Math.abs(e.get("nearest_busy")) > e.get("event_duration") / 2),
        Cut.of("HEVCheck", DAQ_VETO, 1, List.of("nearest_hev", "event_duration"),
            e -> Math.abs(e.get("nearest_hev")) > e.get("event_duration") / 2)));

    /** Not in the tail of a previous large S2. */
    public static final Cut S2_TAILS = Cut.of("S2Tails", S2_TAIL, 0,
        List.of("s2_over_tdiff"), e -> {
            double s2OverTdiff = e.get("s2_over_tdiff");
            return !(s2OverTdiff >= 0) || s2OverTdiff < 0.04;
        });

    /** Outside a PMT flash and its extended window (-10 s before, 120 s after). */
    public static final Cut FLASH_CUT = Cut.of("Flash", FLASH, 0,
        List.of("inside_flash", "nearest_flash", "flashing_width"), e -> {
            double nearest = e.get("nearest_flash");
            return !e.is("inside_flash")
                && (Double.isNaN(nearest)
                    || nearest > 120 * SECOND
                    || nearest < -10 * SECOND - e.get("flashing_width") * SECOND);
        });

    /** Muon veto was running and did not trigger within [-2 ms, +3 ms] of the event. */
    public static final Cut MUON_VETO_CUT = Cut.allOf("MuonVeto", MUON_VETO, 3, List.of(
        Cut.of("MuonVetoOn", MUON_VETO, 3, List.of("nearest_muon_veto_trigger"), e -> {
            double nearest = e.get("nearest_muon_veto_trigger");
            return nearest > -2e10 && nearest < 2e10;
        }),
        Cut.of("MuonVetoCoincidence", MUON_VETO, 3, List.of("nearest_muon_veto_trigger"), e -> {
            double nearest = e.get("nearest_muon_veto_trigger");
            return nearest < -2e6 || nearest > 3e6;
        })));

    // ---------------------------------------------------------------------
    // Cut groups
    // ---------------------------------------------------------------------

    /**
     * Cuts applicable at low and high energy (gammas).
     */
    public static CutGroup allEnergy() {
        return CutGroup.builder("AllEnergy")
            .add(FIDUCIAL_Z_OPTIMIZED,
                INTERACTION_EXISTS,
                S2_THRESHOLD,
                INTERACTION_PEAKS_BIGGEST,
                CS2_AREA_FRACTION_TOP,
                S2_SINGLE_SCATTER,
                S2_WIDTH,
                DAQ_VETO_CUT,
                S1_SINGLE_SCATTER,
                S2_PATTERN_LIKELIHOOD,
                KRYPTON_MIS_ID_S1,
                FLASH_CUT,
                POS_DIFF)
            .build();
    }

    /**
     * Rn220 calibration in the low-energy region: the energy window replaces the
     * interaction check, the simple single-scatter cut replaces the full one, plus the
     * low-energy S1 cuts and the injection-position cuts.
     */
    public static CutGroup lowEnergyRn220() {
        return CutGroup.builder("LowEnergyRn220")
            .from(allEnergy())
            .replace("InteractionExists", S1_LOW_ENERGY_RANGE)
            .replace("S2SingleScatter", S2_SINGLE_SCATTER_SIMPLE)
            .add(S1_PATTERN_LIKELIHOOD, S1_MAX_PMT, S1_AREA_FRACTION_TOP, S1_WIDTH)
            .add(S1_AREA_UPPER_INJECTION_FRACTION, S1_AREA_LOWER_INJECTION_FRACTION)
            .build();
    }

    /**
     * AmBe calibration: the Rn220 list without the injection-related cuts.
     */
    public static CutGroup lowEnergyAmBe() {
        return withoutInjectionCuts("LowEnergyAmBe");
    }

    /**
     * Neutron-generator calibration; like AmBe, no injection-related cuts.
     */
    public static CutGroup lowEnergyNG() {
        return withoutInjectionCuts("LowEnergyNG");
    }

    /**
     * Dark-matter search selection: the Rn220 list plus pre-S2 junk, S2 tails and muon veto.
     */
    public static CutGroup lowEnergyBackground() {
        return CutGroup.builder("LowEnergyBackground")
            .from(lowEnergyRn220())
            .add(PRE_S2_JUNK, S2_TAILS, MUON_VETO_CUT)
            .build();
    }

    private static CutGroup withoutInjectionCuts(String name) {
        return CutGroup.builder(name)
            .from(lowEnergyRn220())
            .remove(cut -> cut == S1_AREA_UPPER_INJECTION_FRACTION || cut == S1_AREA_LOWER_INJECTION_FRACTION)
            .build();
    }

    private static double otherS2Bound(double s2) {
        double lowEnergyBound = s2 * 0.00832 + 72.3;
        double highEnergyBound = s2 * 0.03 - 109;
        double lowWeight = 1 / (Math.exp((s2 - 23300) * 5.91e-4) + 1);
        double highWeight = 1 / (Math.exp((23300 - s2) * 5.91e-4) + 1);
        return lowEnergyBound * lowWeight + highEnergyBound * highWeight;
    }

    /**
     * Diffusion model of the S2 width (arXiv:1102.2865), tuned on simulated waveforms.
     */
    static final class S2WidthModel {

        static final double DIFFUSION_CONSTANT = 25.26 / SECOND;    // cm^2/ns
        static final double DRIFT_VELOCITY = 1.440e-4;              // cm/ns
        static final double SECONDARY_SC_GAIN = 23.0;
        static final double SECONDARY_SC_WIDTH = 258.41;
        static final double SIGMA_TO_R50 = 1.349;
        static final double DRIFT_TIME_FROM_GATE = 1.6 * US;

        private S2WidthModel() {
        }

        static double expectedWidth(double driftTime) {
            return Math.sqrt(2 * DIFFUSION_CONSTANT * (driftTime - DRIFT_TIME_FROM_GATE)
                / (DRIFT_VELOCITY * DRIFT_VELOCITY));
        }

        /**
         * Chi-squared log density of the observed width relative to the model, with the
         * number of electrons as degrees of freedom.
         */
        static double logLikelihood(double s2, double s2Range50pArea, double driftTime) {
            double electrons = CutMath.clip(s2, 0, 5000) / SECONDARY_SC_GAIN;
            double observed = s2Range50pArea / SIGMA_TO_R50;
            double expected = expectedWidth(driftTime);
            double normWidth = (observed * observed - SECONDARY_SC_WIDTH * SECONDARY_SC_WIDTH) / (expected * expected);
            return CutMath.chiSquaredLogDensity(normWidth * (electrons - 1), electrons);
        }
    }
}
