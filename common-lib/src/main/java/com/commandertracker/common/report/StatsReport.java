package com.commandertracker.common.report;

import com.commandertracker.common.aggregation.DistinctTripleRow;
import com.commandertracker.common.aggregation.LoadoutRow;
import com.commandertracker.common.aggregation.PairRow;
import com.commandertracker.common.aggregation.PlayerRow;
import com.commandertracker.common.aggregation.TierRow;
import com.commandertracker.common.model.DataQualityWarning;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The versioned statistics document, schema {@value #SCHEMA_VERSION}.
 *
 * <p>Every table is ordered by its grouping key. Over an unchanged snapshot and unchanged
 * options, two documents differ only in {@code generated_utc}.
 */
@JsonPropertyOrder({
    "schema", "generated_utc", "counts", "params", "filters",
    "by_player", "by_player_loadout", "by_loadout", "by_tier",
    "tier_entry_counts", "tier_winner_counts",
    "pod_sizes", "player_by_pod_size", "pair_by_pod_size",
    "triples", "distinct_triples", "recent_games", "player_trends", "warnings"
})
public record StatsReport(
    @JsonProperty("schema")              String                         schema,
    @JsonProperty("generated_utc")       Instant                        generatedUtc,
    @JsonProperty("counts")              Counts                         counts,
    @JsonProperty("params")              Params                         params,
    @JsonProperty("filters")             Filters                        filters,
    @JsonProperty("by_player")           List<PlayerRow>                byPlayer,
    @JsonProperty("by_player_loadout")   List<PairRow>                  byPlayerLoadout,
    @JsonProperty("by_loadout")          List<LoadoutRow>               byLoadout,
    @JsonProperty("by_tier")             List<TierRow>                  byTier,
    @JsonProperty("tier_entry_counts")   Map<String, Integer>           tierEntryCounts,
    @JsonProperty("tier_winner_counts")  Map<String, Integer>           tierWinnerCounts,
    @JsonProperty("pod_sizes")           List<Integer>                  podSizes,
    @JsonProperty("player_by_pod_size")  Map<String, List<PlayerRow>>   playerByPodSize,
    @JsonProperty("pair_by_pod_size")    Map<String, List<PairRow>>     pairByPodSize,
    @JsonProperty("triples")             List<TripleRow>                triples,
    @JsonProperty("distinct_triples")    List<DistinctTripleRow>        distinctTriples,
    @JsonProperty("recent_games")        List<RecentGame>               recentGames,
    @JsonProperty("player_trends")       Map<String, List<TrendPoint>>  playerTrends,
    @JsonProperty("warnings")            List<DataQualityWarning>       warnings
) {

    public static final String SCHEMA_VERSION = "stats.v1";

    public record Counts(
        @JsonProperty("games")    int games,
        @JsonProperty("entries")  int entries
    ) {}

    public record Params(
        @JsonProperty("alpha")               double alpha,
        @JsonProperty("top_triples")         int    topTriples,
        @JsonProperty("max_unique_triples")  int    maxUniqueTriples,
        @JsonProperty("recent_games")        int    recentGames
    ) {}

    /** Distinct values for populating downstream filters. */
    public record Filters(
        @JsonProperty("players")   List<String> players,
        @JsonProperty("loadouts")  List<String> loadouts,
        @JsonProperty("tiers")     List<String> tiers
    ) {}
}
