package com.commandertracker.common.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Per-tier aggregate; {@code tier} is the display key ("1".."5" or "n/a"). */
public record TierRow(
    @JsonProperty("tier")     String tier,
    @JsonProperty("games")    int    games,
    @JsonProperty("wins")     int    wins,
    @JsonProperty("winrate")  double winrate
) {}
