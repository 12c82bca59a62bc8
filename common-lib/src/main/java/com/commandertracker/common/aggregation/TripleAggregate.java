package com.commandertracker.common.aggregation;

import java.util.List;

/**
 * Raw weighted counters of one {@code (player, loadout, tier)} group, handed to the
 * pressure index calculator.
 *
 * <p>{@code deltas} and {@code tableAverages} are parallel lists with one element per
 * qualifying win (winner tier and table average both defined).
 */
public record TripleAggregate(
    TripleKey    key,
    int          games,
    int          wins,
    double       winrate,
    double       weightedWins,
    double       weightedGames,
    double       weightedWinrate,
    List<Double> deltas,
    List<Double> tableAverages
) {

    public TripleAggregate {
        deltas = List.copyOf(deltas);
        tableAverages = List.copyOf(tableAverages);
    }

    public int qualifyingWins() {
        return deltas.size();
    }
}
