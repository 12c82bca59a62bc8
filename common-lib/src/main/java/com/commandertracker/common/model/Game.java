package com.commandertracker.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One recorded session as supplied by the game store.
 *
 * <ul>
 *   <li>{@code id}         – store identifier (nullable for not-yet-persisted games).</li>
 *   <li>{@code playedAt}   – session timestamp in UTC (nullable for legacy rows).</li>
 *   <li>{@code winnerName} – free-text player name expected to match exactly one entry.</li>
 *   <li>{@code notes}      – optional free text.</li>
 *   <li>{@code entries}    – ordered participant rows; never shared across games.</li>
 * </ul>
 *
 * No logic beyond the derived table size; pure model.
 */
public record Game(
    @JsonProperty("id")          Long id,
    @JsonProperty("playedAt")    Instant playedAt,
    @JsonProperty("winnerName")  String winnerName,
    @JsonProperty("notes")       String notes,
    @JsonProperty("entries")     List<GameEntry> entries
) {

    public Game {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /** Number of participants at the table. */
    @JsonIgnore
    public int tableSize() {
        return entries.size();
    }
}
