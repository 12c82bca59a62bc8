package com.commandertracker.common.report;

import com.commandertracker.common.pressure.PressureLabelTable;
import com.commandertracker.common.weighting.WinWeightCalculator;

/**
 * Tunables of one report run.
 *
 * <ul>
 *   <li>{@code alpha}            – win-weighting coefficient, [0, 5].</li>
 *   <li>{@code topTriples}       – triple rows kept, [10, 500].</li>
 *   <li>{@code maxUniqueTriples} – distinct-triple rows kept, [10, 5000].</li>
 *   <li>{@code recentGames}      – recent games listed, [1, 500].</li>
 *   <li>{@code labels}           – pressure label step function.</li>
 * </ul>
 *
 * Out-of-range values are clamped by {@link #sanitized()}, never rejected.
 */
public record StatsOptions(
    double             alpha,
    int                topTriples,
    int                maxUniqueTriples,
    int                recentGames,
    PressureLabelTable labels
) {

    public static final double DEFAULT_ALPHA              = 0.5;
    public static final int    DEFAULT_TOP_TRIPLES        = 50;
    public static final int    DEFAULT_MAX_UNIQUE_TRIPLES = 200;
    public static final int    DEFAULT_RECENT_GAMES       = 30;

    static final int MIN_TOP_TRIPLES = 10,  MAX_TOP_TRIPLES = 500;
    static final int MIN_UNIQUE      = 10,  MAX_UNIQUE      = 5000;
    static final int MIN_RECENT      = 1,   MAX_RECENT      = 500;

    public static final StatsOptions DEFAULT = new StatsOptions(
        DEFAULT_ALPHA, DEFAULT_TOP_TRIPLES, DEFAULT_MAX_UNIQUE_TRIPLES, DEFAULT_RECENT_GAMES,
        PressureLabelTable.DEFAULT);

    /** Copy with every numeric value clamped to its range and a non-null label table. */
    public StatsOptions sanitized() {
        return new StatsOptions(
            WinWeightCalculator.sanitizeConfigured(alpha),
            clamp(topTriples, MIN_TOP_TRIPLES, MAX_TOP_TRIPLES),
            clamp(maxUniqueTriples, MIN_UNIQUE, MAX_UNIQUE),
            clamp(recentGames, MIN_RECENT, MAX_RECENT),
            labels != null ? labels : PressureLabelTable.DEFAULT);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
