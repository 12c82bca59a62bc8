package com.commandertracker.common.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A recent game with its full lineup.
 * {@code lineup} is sorted by player, then loadout.
 */
public record RecentGame(
    @JsonProperty("id")             Long              id,
    @JsonProperty("played_at_utc")  Instant           playedAtUtc,
    @JsonProperty("winner")         String            winner,
    @JsonProperty("notes")          String            notes,
    @JsonProperty("participants")   int               participants,
    @JsonProperty("lineup")         List<LineupEntry> lineup
) {}
