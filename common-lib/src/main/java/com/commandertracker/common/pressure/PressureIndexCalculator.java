package com.commandertracker.common.pressure;

import com.commandertracker.common.aggregation.TripleAggregate;

import java.util.List;

/**
 * Derives the pressure index of a triple group: whether its wins tend to come from
 * above (positive) or below (negative) the table's average tier.
 *
 * <pre>
 *   pressure_index = mean(ΔB over qualifying wins)   if qualifying ≥ {@value #MIN_QUALIFYING_WINS}
 *                  = null                             otherwise
 *   win_coverage   = qualifying / wins                (null when wins = 0)
 *   avg_table_tier = mean(B_avg over qualifying wins) (null when qualifying = 0)
 * </pre>
 *
 * <p>Pure static utility. No state, no Spring dependency.
 */
public final class PressureIndexCalculator {

    /** Minimum qualifying wins for a meaningful index. */
    public static final int MIN_QUALIFYING_WINS = 2;

    private PressureIndexCalculator() {}

    public static PressureSummary compute(TripleAggregate aggregate, PressureLabelTable labels) {
        return compute(aggregate.deltas(), aggregate.tableAverages(), aggregate.wins(), labels);
    }

    /**
     * @param deltas        ΔB of each qualifying win
     * @param tableAverages table average of each qualifying win
     * @param wins          all wins of the group, qualifying or not
     * @param labels        label step function
     * @return the summary; never null
     */
    public static PressureSummary compute(List<Double> deltas,
                                          List<Double> tableAverages,
                                          int wins,
                                          PressureLabelTable labels) {
        int qualifying = deltas == null ? 0 : deltas.size();

        Double index = qualifying >= MIN_QUALIFYING_WINS ? mean(deltas) : null;
        Double coverage = wins > 0 ? Math.min(1.0, (double) qualifying / wins) : null;
        Double avgTable = tableAverages == null || tableAverages.isEmpty() ? null : mean(tableAverages);

        return new PressureSummary(index, labels.label(index), coverage, avgTable, qualifying);
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
