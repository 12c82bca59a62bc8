package com.commandertracker.common.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of the distinct-triple existence table, independent of outcomes. */
public record DistinctTripleRow(
    @JsonProperty("loadout")  String loadout,
    @JsonProperty("player")   String player,
    @JsonProperty("tier")     String tier,
    @JsonProperty("entries")  int    entries
) {}
