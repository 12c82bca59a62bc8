package com.commandertracker.common.aggregation;

import com.commandertracker.common.model.DataQualityWarning;

import java.util.List;
import java.util.Map;

/**
 * Immutable output of one {@link StatsAggregationEngine} pass.
 *
 * <p>Every list is ordered ascending by its grouping key; the two tier count maps
 * iterate in tier order with {@code "n/a"} last. No row has zero participation.
 */
public record AggregationResult(
    int                      gameCount,
    int                      entryCount,
    List<PlayerRow>          players,
    List<PairRow>            pairs,
    List<LoadoutRow>         loadouts,
    List<TierRow>            tiers,
    List<TripleAggregate>    triples,
    List<DistinctTripleRow>  distinctTriples,
    Map<String, Integer>     tierEntryCounts,
    Map<String, Integer>     tierWinnerCounts,
    List<String>             playerNames,
    List<String>             loadoutNames,
    List<String>             tierValues,
    List<DataQualityWarning> warnings
) {}
