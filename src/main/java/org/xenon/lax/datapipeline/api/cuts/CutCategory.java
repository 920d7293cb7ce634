package org.xenon.lax.datapipeline.api.cuts;

/**
 * Category tag carried by every {@link Cut}.
 * <p>
 * Applicability decisions (such as dropping detector-specific cuts for simulated
 * data) compare categories by equality, never cut names.
 */
public enum CutCategory {
    /** Fiducial-volume selection on reconstructed position. */
    FIDUCIAL,
    /** Energy-window selection. */
    ENERGY,
    /** S1/S2 pairing and main-peak sanity. */
    INTERACTION,
    /** S1 signal quality. */
    S1_QUALITY,
    /** S2 signal quality. */
    S2_QUALITY,
    /** Agreement between position reconstruction algorithms. */
    POSITION,
    /** Noise and junk before the main signal. */
    SIGNAL_NOISE,
    /** DAQ busy and high-energy veto. */
    DAQ_VETO,
    /** Late-signal tails of previous S2s. */
    S2_TAIL,
    /** PMT flash identification. */
    FLASH,
    /** Muon veto coincidence and uptime. */
    MUON_VETO
}
