package com.commandertracker.common.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cumulative win-rate of one player after one more game.
 * {@code date} is {@code yyyy-MM-dd} (UTC) or {@code "game <id>"} when the game has no timestamp.
 */
public record TrendPoint(
    @JsonProperty("date")     String date,
    @JsonProperty("games")    int    games,
    @JsonProperty("wins")     int    wins,
    @JsonProperty("winrate")  double winrate
) {}
