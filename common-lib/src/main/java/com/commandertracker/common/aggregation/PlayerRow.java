package com.commandertracker.common.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-player aggregate.
 *
 * <ul>
 *   <li>{@code winrate}          – {@code wins / games} in [0.0, 1.0].</li>
 *   <li>{@code weightedWinrate}  – bracket-weighted win-rate in [0.0, 1.0].</li>
 *   <li>{@code topLoadout}       – most-played loadout; ties go to the first in key order.</li>
 * </ul>
 */
public record PlayerRow(
    @JsonProperty("player")             String player,
    @JsonProperty("games")              int    games,
    @JsonProperty("wins")               int    wins,
    @JsonProperty("winrate")            double winrate,
    @JsonProperty("weighted_winrate")   double weightedWinrate,
    @JsonProperty("unique_loadouts")    int    uniqueLoadouts,
    @JsonProperty("top_loadout")        String topLoadout,
    @JsonProperty("top_loadout_games")  int    topLoadoutGames
) {}
