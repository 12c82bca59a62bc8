package com.commandertracker.common.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One participant of a recent game as shown in its lineup. */
public record LineupEntry(
    @JsonProperty("player")   String player,
    @JsonProperty("loadout")  String loadout,
    @JsonProperty("tier")     String tier
) {}
