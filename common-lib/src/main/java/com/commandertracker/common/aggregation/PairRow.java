package com.commandertracker.common.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Per {@code (player, loadout)} aggregate. */
public record PairRow(
    @JsonProperty("player")            String player,
    @JsonProperty("loadout")           String loadout,
    @JsonProperty("games")             int    games,
    @JsonProperty("wins")              int    wins,
    @JsonProperty("winrate")           double winrate,
    @JsonProperty("weighted_winrate")  double weightedWinrate
) {}
