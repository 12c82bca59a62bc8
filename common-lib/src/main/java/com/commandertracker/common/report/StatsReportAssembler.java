package com.commandertracker.common.report;

import com.commandertracker.common.aggregation.AggregationResult;
import com.commandertracker.common.aggregation.DistinctTripleRow;
import com.commandertracker.common.aggregation.StatsAggregationEngine;
import com.commandertracker.common.aggregation.TripleAggregate;
import com.commandertracker.common.model.Game;
import com.commandertracker.common.pressure.PressureIndexCalculator;
import com.commandertracker.common.segmentation.PodSizeSegmenter;
import com.commandertracker.common.segmentation.PodSizeSegments;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link StatsReport} from a game snapshot.
 *
 * <h3>Pipeline</h3>
 * <pre>
 *   snapshot ─▶ StatsAggregationEngine ─▶ PressureIndexCalculator (per triple)
 *            ─▶ PodSizeSegmenter
 *            ─▶ RecentGamesSelector, PlayerTrendCalculator
 *            ─▶ StatsReport
 * </pre>
 *
 * <h3>Caps</h3>
 * <ul>
 *   <li>Triples: the {@code topTriples} rows ranked by games, weighted win-rate, then
 *       win-rate (all descending) are kept, then emitted in key order.</li>
 *   <li>Distinct triples: the first {@code maxUniqueTriples} rows in key order.</li>
 * </ul>
 *
 * <p>The clock is the only source of non-determinism.
 */
public final class StatsReportAssembler {

    private static final Comparator<TripleRow> RANK =
        Comparator.comparingInt(TripleRow::games).reversed()
            .thenComparing(Comparator.comparingDouble(TripleRow::weightedWinrate).reversed())
            .thenComparing(Comparator.comparingDouble(TripleRow::winrate).reversed());

    private final Clock clock;

    public StatsReportAssembler(Clock clock) {
        this.clock = clock;
    }

    public StatsReport assemble(List<Game> games, StatsOptions options) {
        StatsOptions opts = (options != null ? options : StatsOptions.DEFAULT).sanitized();
        List<Game> snapshot = games != null ? games : List.of();

        AggregationResult result = StatsAggregationEngine.aggregate(snapshot, opts.alpha());
        PodSizeSegments segments = PodSizeSegmenter.segment(snapshot, opts.alpha());

        return new StatsReport(
            StatsReport.SCHEMA_VERSION,
            clock.instant(),
            new StatsReport.Counts(result.gameCount(), result.entryCount()),
            new StatsReport.Params(opts.alpha(), opts.topTriples(), opts.maxUniqueTriples(), opts.recentGames()),
            new StatsReport.Filters(result.playerNames(), result.loadoutNames(), result.tierValues()),
            result.players(),
            result.pairs(),
            result.loadouts(),
            result.tiers(),
            result.tierEntryCounts(),
            result.tierWinnerCounts(),
            segments.sizes(),
            bySizeKey(segments.playersBySize()),
            bySizeKey(segments.pairsBySize()),
            tripleRows(result.triples(), opts),
            capDistinct(result.distinctTriples(), opts.maxUniqueTriples()),
            RecentGamesSelector.select(snapshot, opts.recentGames()),
            PlayerTrendCalculator.compute(snapshot),
            result.warnings());
    }

    // ── triples ──────────────────────────────────────────────────────────────

    static List<TripleRow> tripleRows(List<TripleAggregate> aggregates, StatsOptions opts) {
        // aggregates arrive in key order; ranking works on indices so that order can be restored
        List<TripleRow> all = new ArrayList<>(aggregates.size());
        for (TripleAggregate a : aggregates) {
            all.add(TripleRow.of(a, PressureIndexCalculator.compute(a, opts.labels())));
        }
        if (all.size() <= opts.topTriples()) return List.copyOf(all);

        List<Integer> idx = new ArrayList<>(all.size());
        for (int i = 0; i < all.size(); i++) idx.add(i);
        idx.sort(Comparator.comparing((Integer i) -> all.get(i), RANK).thenComparingInt(i -> i));

        List<Integer> kept = new ArrayList<>(idx.subList(0, opts.topTriples()));
        Collections.sort(kept);

        List<TripleRow> out = new ArrayList<>(kept.size());
        for (int i : kept) out.add(all.get(i));
        return List.copyOf(out);
    }

    private static List<DistinctTripleRow> capDistinct(List<DistinctTripleRow> rows, int cap) {
        return rows.size() <= cap ? rows : List.copyOf(rows.subList(0, cap));
    }

    // ── pod sizes ────────────────────────────────────────────────────────────

    private static <V> Map<String, V> bySizeKey(Map<Integer, V> bySize) {
        Map<String, V> out = new LinkedHashMap<>();
        bySize.forEach((size, rows) -> out.put(String.valueOf(size), rows));
        return Collections.unmodifiableMap(out);
    }
}
