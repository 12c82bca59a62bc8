package com.commandertracker.common.weighting;

/**
 * Bracket-aware win weight: how much a single win counts, given how the winner's
 * tier compares to the average tier of the table it won at.
 *
 * <h3>Formula</h3>
 * <pre>
 *   ΔB = B_winner − B_avg
 *
 *   B_winner or B_avg undefined → w = 1
 *   ΔB = 0                      → w = 1
 *   ΔB &gt; 0  (easier win)        → w = 1 / (1 + α·ΔB)
 *   ΔB &lt; 0  (harder win)        → w = 1 + α·(−ΔB)
 * </pre>
 *
 * <p>Negative α is clamped to 0; α = 0 gives w = 1 for every win.
 * The weighted win-rate keeps its denominator in lockstep (a win of weight w also
 * counts w games), which is what bounds it to [0, 1].
 *
 * <p>Pure static utility. No state, no Spring dependency.
 */
public final class WinWeightCalculator {

    /** Upper bound applied to configured coefficients. */
    public static final double MAX_ALPHA = 5.0;

    public static final double NEUTRAL_WEIGHT = 1.0;

    private WinWeightCalculator() {}

    /**
     * Weight for a known delta.
     *
     * @param delta winner tier minus table average
     * @param alpha weighting coefficient; negative values are treated as 0
     * @return w &gt; 0
     */
    public static double weight(double delta, double alpha) {
        double a = clampAlpha(alpha);
        if (delta > 0) return 1.0 / (1.0 + a * delta);
        if (delta < 0) return 1.0 + a * (-delta);
        return NEUTRAL_WEIGHT;
    }

    /**
     * Weight for possibly undefined inputs.
     *
     * @param winnerTier   the winner's tier, or null when absent
     * @param tableAverage mean tier of the table, or null when no entry has a tier
     * @param alpha        weighting coefficient
     * @return {@value #NEUTRAL_WEIGHT} when either input is undefined
     */
    public static double weight(Integer winnerTier, Double tableAverage, double alpha) {
        if (winnerTier == null || tableAverage == null) return NEUTRAL_WEIGHT;
        return weight(winnerTier - tableAverage, alpha);
    }

    /** Negative and NaN coefficients become 0. No upper bound is applied here. */
    public static double clampAlpha(double alpha) {
        return alpha > 0.0 ? alpha : 0.0;
    }

    /** Clamp used for configured coefficients: [0, {@value #MAX_ALPHA}]. */
    public static double sanitizeConfigured(double alpha) {
        return Math.min(MAX_ALPHA, clampAlpha(alpha));
    }
}
