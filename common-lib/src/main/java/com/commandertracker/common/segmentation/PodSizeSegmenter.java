package com.commandertracker.common.segmentation;

import com.commandertracker.common.aggregation.AggregationResult;
import com.commandertracker.common.aggregation.PairRow;
import com.commandertracker.common.aggregation.PlayerRow;
import com.commandertracker.common.aggregation.StatsAggregationEngine;
import com.commandertracker.common.model.Game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Re-runs the player and pair aggregation once per observed table size.
 *
 * <p>Each game lands in exactly one bucket, keyed by its entry count. Games with no
 * entries are left out. Within a bucket the rules are those of
 * {@link StatsAggregationEngine}, including the weighting coefficient.
 */
public final class PodSizeSegmenter {

    private PodSizeSegmenter() {}

    public static PodSizeSegments segment(List<Game> games, double alpha) {
        if (games == null || games.isEmpty()) return PodSizeSegments.EMPTY;

        Map<Integer, List<Game>> bySize = new TreeMap<>();
        for (Game game : games) {
            if (game == null || game.tableSize() == 0) continue;
            bySize.computeIfAbsent(game.tableSize(), k -> new ArrayList<>()).add(game);
        }

        Map<Integer, List<PlayerRow>> players = new LinkedHashMap<>();
        Map<Integer, List<PairRow>> pairs = new LinkedHashMap<>();
        for (Map.Entry<Integer, List<Game>> e : bySize.entrySet()) {
            AggregationResult result = StatsAggregationEngine.aggregate(e.getValue(), alpha);
            players.put(e.getKey(), result.players());
            pairs.put(e.getKey(), result.pairs());
        }

        return new PodSizeSegments(
            List.copyOf(bySize.keySet()),
            Collections.unmodifiableMap(players),
            Collections.unmodifiableMap(pairs));
    }
}
