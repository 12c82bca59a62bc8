package com.commandertracker.common.report;

import com.commandertracker.common.aggregation.TripleAggregate;
import com.commandertracker.common.pressure.PressureSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Per-triple report row: counts, weighted counts and pressure metrics. */
public record TripleRow(
    @JsonProperty("player")            String player,
    @JsonProperty("loadout")           String loadout,
    @JsonProperty("tier")              String tier,
    @JsonProperty("games")             int    games,
    @JsonProperty("wins")              int    wins,
    @JsonProperty("winrate")           double winrate,
    @JsonProperty("weighted_wins")     double weightedWins,
    @JsonProperty("weighted_games")    double weightedGames,
    @JsonProperty("weighted_winrate")  double weightedWinrate,
    @JsonProperty("pressure_index")    Double pressureIndex,
    @JsonProperty("pressure_label")    String pressureLabel,
    @JsonProperty("win_coverage")      Double winCoverage,
    @JsonProperty("avg_table_tier")    Double avgTableTier
) {

    static TripleRow of(TripleAggregate a, PressureSummary p) {
        return new TripleRow(
            a.key().player(), a.key().loadout(), a.key().tier().key(),
            a.games(), a.wins(), a.winrate(),
            a.weightedWins(), a.weightedGames(), a.weightedWinrate(),
            p.index(), p.label(), p.winCoverage(), p.avgTableTier());
    }
}
