package com.commandertracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A recoverable anomaly found while aggregating one game or entry.
 * Recorded, reported, never fatal.
 */
public record DataQualityWarning(
    @JsonProperty("kind")     Kind   kind,
    @JsonProperty("game_id")  Long   gameId,
    @JsonProperty("detail")   String detail
) {

    public enum Kind {
        /** Winner missing, or not found among the entries. */
        NO_WINNER_MATCH,
        /** Winner name carried by more than one entry. */
        AMBIGUOUS_WINNER,
        /** Tier value out of range or non-numeric; treated as absent. */
        INVALID_TIER
    }
}
