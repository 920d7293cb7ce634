package org.xenon.lax.datapipeline.cuts;

/**
 * Numerical helpers shared by cut formulas.
 */
public final class CutMath {

    private static final double LN_2 = Math.log(2.0);
    private static final double HALF_LN_2PI = 0.5 * Math.log(2.0 * Math.PI);

    // Lanczos approximation, g = 7, n = 9
    private static final double[] LANCZOS = {
        0.99999999999980993,
        676.5203681218851,
        -1259.1392167224028,
        771.32342877765313,
        -176.61502916214059,
        12.507343278686905,
        -0.13857109526572012,
        9.9843695780195716e-6,
        1.5056327351493116e-7
    };

    private CutMath() {
    }

    /**
     * Natural logarithm of the gamma function for positive arguments.
     *
     * @param x argument
     * @return ln Γ(x); accurate to about 1e-13 relative
     */
    public static double logGamma(double x) {
        if (x < 0.5) {
            // reflection formula
            return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x))) - logGamma(1.0 - x);
        }
        double z = x - 1.0;
        double sum = LANCZOS[0];
        double t = z + 7.5;
        for (int i = 1; i < LANCZOS.length; i++) {
            sum += LANCZOS[i] / (z + i);
        }
        return HALF_LN_2PI + (z + 0.5) * Math.log(t) - t + Math.log(sum);
    }

    /**
     * Log of the chi-squared probability density with {@code k} degrees of freedom.
     * <p>
     * Follows the usual conventions: -∞ outside the support, NaN for non-positive
     * degrees of freedom or NaN input. Comparisons against NaN are false, so events with
     * undefined density fail a {@code logDensity > threshold} selection.
     *
     * @param x value
     * @param k degrees of freedom (need not be integer)
     * @return ln f(x; k)
     */
    public static double chiSquaredLogDensity(double x, double k) {
        if (Double.isNaN(x) || Double.isNaN(k) || k <= 0) {
            return Double.NaN;
        }
        if (x < 0 || Double.isInfinite(x)) {
            return Double.NEGATIVE_INFINITY;
        }
        double halfK = k / 2.0;
        if (x == 0) {
            if (k < 2) {
                return Double.POSITIVE_INFINITY;
            }
            return k == 2 ? -LN_2 : Double.NEGATIVE_INFINITY;
        }
        return (halfK - 1.0) * Math.log(x) - x / 2.0 - halfK * LN_2 - logGamma(halfK);
    }

    /**
     * @return {@code value} clipped to {@code [min, max]}; NaN stays NaN
     */
    public static double clip(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return value;
        }
        return Math.max(min, Math.min(max, value));
    }
}
