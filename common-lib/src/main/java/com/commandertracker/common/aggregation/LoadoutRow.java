package com.commandertracker.common.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Per-loadout aggregate across every player who played it. */
public record LoadoutRow(
    @JsonProperty("loadout")  String loadout,
    @JsonProperty("games")    int    games,
    @JsonProperty("wins")     int    wins,
    @JsonProperty("winrate")  double winrate
) {}
