package com.commandertracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One participant row within a {@link Game}.
 *
 * <p>{@code tier} is carried exactly as stored: it may be {@code null}, blank,
 * {@code "n/a"}, out of range or non-numeric. The aggregation engine normalizes it
 * through {@link Tier#parse(String)} and never trusts it directly.
 */
public record GameEntry(
    @JsonProperty("player")   String player,
    @JsonProperty("loadout")  String loadout,
    @JsonProperty("tier")     String tier
) {

    /** Convenience for callers holding a numeric tier. */
    public static GameEntry of(String player, String loadout, Integer tier) {
        return new GameEntry(player, loadout, tier == null ? null : String.valueOf(tier));
    }
}
