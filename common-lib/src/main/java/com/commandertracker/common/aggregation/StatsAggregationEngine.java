package com.commandertracker.common.aggregation;

import com.commandertracker.common.model.Game;

import java.util.List;

/**
 * Single-pass aggregation of a game snapshot into grouped count and weighted-count tables.
 *
 * <h3>Per game</h3>
 * <ol>
 *   <li>Normalize every entry's tier; invalid values become absent and raise an
 *       {@code INVALID_TIER} warning.</li>
 *   <li>Compute the table average over the entries with a defined tier.</li>
 *   <li>Resolve the winner once: unique match, no match or ambiguous match. Only a
 *       unique match contributes a win; the other two raise a warning.</li>
 *   <li>Every entry counts one game for its player, pair, loadout, tier and triple buckets.</li>
 *   <li>The winning entry counts one win for the same buckets, weighted through
 *       {@link com.commandertracker.common.weighting.WinWeightCalculator}; its triple bucket
 *       also records ΔB and the table average when both are defined.</li>
 *   <li>The distinct-triple existence table counts every entry regardless of outcome.</li>
 * </ol>
 *
 * <p>Pure function of (games, α): all state lives in a per-run {@link AggregationContext}.
 * No I/O, no logging, never throws on anomalous data.
 */
public final class StatsAggregationEngine {

    private StatsAggregationEngine() {}

    /**
     * Aggregates {@code games} in their given order.
     *
     * @param games snapshot of games; null elements are skipped
     * @param alpha weighting coefficient; negative values are treated as 0
     * @return the grouped tables; never null
     */
    public static AggregationResult aggregate(List<Game> games, double alpha) {
        AggregationContext context = new AggregationContext(alpha);
        if (games != null) {
            for (Game game : games) {
                context.accept(game);
            }
        }
        return context.toResult();
    }
}
