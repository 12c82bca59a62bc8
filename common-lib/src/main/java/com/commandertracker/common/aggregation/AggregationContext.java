package com.commandertracker.common.aggregation;

import com.commandertracker.common.model.DataQualityWarning;
import com.commandertracker.common.model.Game;
import com.commandertracker.common.model.GameEntry;
import com.commandertracker.common.model.Tier;
import com.commandertracker.common.model.WinnerMatch;
import com.commandertracker.common.weighting.WinWeightCalculator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All mutable state of one aggregation run. Created by
 * {@link StatsAggregationEngine#aggregate}, fed every game once, turned into an
 * {@link AggregationResult} and discarded. Never shared between runs.
 */
final class AggregationContext {

    private final double alpha;

    private int gameCount;
    private int entryCount;

    private final Map<String, GroupTally>  players  = new TreeMap<>(KeyOrder.TEXT);
    private final Map<PairKey, GroupTally> pairs    = new TreeMap<>();
    private final Map<String, GroupTally>  loadouts = new TreeMap<>(KeyOrder.TEXT);
    private final Map<Tier, GroupTally>    tiers    = new TreeMap<>();
    private final Map<TripleKey, GroupTally> triples = new TreeMap<>();

    private final Map<TripleKey, Integer> distinctTriples = new TreeMap<>(TripleKey.LOADOUT_FIRST);
    private final Map<Tier, Integer>      tierWinners     = new TreeMap<>();

    private final List<DataQualityWarning> warnings = new ArrayList<>();

    AggregationContext(double alpha) {
        this.alpha = WinWeightCalculator.clampAlpha(alpha);
    }

    // ── per-game pass ────────────────────────────────────────────────────────

    void accept(Game game) {
        if (game == null) return;
        gameCount++;

        List<TripleKey> entries = normalize(game);
        Double tableAverage = tableAverage(entries);

        List<String> names = new ArrayList<>(entries.size());
        for (TripleKey e : entries) {
            names.add(e.player());
        }
        WinnerMatch match = WinnerMatch.resolve(game.winnerName(), names);
        recordResolutionWarning(game, match);

        // participation
        for (TripleKey e : entries) {
            entryCount++;
            tally(players, e.player()).recordEntry();
            tally(pairs, e.pair()).recordEntry();
            tally(loadouts, e.loadout()).recordEntry();
            tally(tiers, e.tier()).recordEntry();
            tally(triples, e).recordEntry();
            distinctTriples.merge(e, 1, Integer::sum);
        }

        if (!match.isUnique()) return;

        // outcome
        TripleKey winner = entries.get(match.entryIndex());
        Integer winnerTier = winner.tier().isPresent() ? winner.tier().value() : null;
        double weight = WinWeightCalculator.weight(winnerTier, tableAverage, alpha);

        tally(players, winner.player()).recordWin(weight);
        tally(pairs, winner.pair()).recordWin(weight);
        tally(loadouts, winner.loadout()).recordWin(weight);
        tally(tiers, winner.tier()).recordWin(weight);

        GroupTally triple = tally(triples, winner);
        triple.recordWin(weight);
        if (winnerTier != null && tableAverage != null) {
            triple.recordQualifyingWin(winnerTier - tableAverage, tableAverage);
        }

        tierWinners.merge(winner.tier(), 1, Integer::sum);
    }

    private List<TripleKey> normalize(Game game) {
        List<TripleKey> out = new ArrayList<>(game.entries().size());
        for (GameEntry entry : game.entries()) {
            if (entry == null) continue;
            String player  = entry.player()  == null ? "" : entry.player();
            String loadout = entry.loadout() == null ? "" : entry.loadout();
            Tier tier = Tier.parse(entry.tier());
            if (!tier.isPresent() && !Tier.isAbsentToken(entry.tier())) {
                warnings.add(new DataQualityWarning(DataQualityWarning.Kind.INVALID_TIER, game.id(),
                    "player=" + player + " loadout=" + loadout + " tier='" + entry.tier() + "' treated as "
                        + Tier.ABSENT_KEY));
            }
            out.add(new TripleKey(player, loadout, tier));
        }
        return out;
    }

    /** Mean of the defined tiers at the table, or null when none is defined. */
    static Double tableAverage(List<TripleKey> entries) {
        int n = 0;
        double sum = 0.0;
        for (TripleKey e : entries) {
            if (e.tier().isPresent()) {
                sum += e.tier().value();
                n++;
            }
        }
        return n > 0 ? sum / n : null;
    }

    private void recordResolutionWarning(Game game, WinnerMatch match) {
        switch (match.resolution()) {
            case NO_MATCH -> warnings.add(new DataQualityWarning(DataQualityWarning.Kind.NO_WINNER_MATCH, game.id(),
                game.winnerName() == null || game.winnerName().isBlank()
                    ? "no winner recorded"
                    : "winner '" + game.winnerName() + "' not among the entries"));
            case AMBIGUOUS_MATCH -> warnings.add(new DataQualityWarning(DataQualityWarning.Kind.AMBIGUOUS_WINNER,
                game.id(), "winner '" + game.winnerName() + "' matches more than one entry"));
            default -> { }
        }
    }

    private static <K> GroupTally tally(Map<K, GroupTally> table, K key) {
        return table.computeIfAbsent(key, k -> new GroupTally());
    }

    // ── result materialization ───────────────────────────────────────────────

    AggregationResult toResult() {
        return new AggregationResult(
            gameCount,
            entryCount,
            playerRows(),
            pairRows(),
            loadoutRows(),
            tierRows(),
            tripleAggregates(),
            distinctTripleRows(),
            tierCounts(tierEntryCounts()),
            tierCounts(tierWinners),
            List.copyOf(players.keySet()),
            List.copyOf(loadouts.keySet()),
            tiers.keySet().stream().filter(Tier::isPresent).map(Tier::key).toList(),
            List.copyOf(warnings));
    }

    private List<PlayerRow> playerRows() {
        Map<String, Integer> uniqueLoadouts = new TreeMap<>(KeyOrder.TEXT);
        Map<String, PairKey> topLoadout = new TreeMap<>(KeyOrder.TEXT);
        for (Map.Entry<PairKey, GroupTally> e : pairs.entrySet()) {
            String player = e.getKey().player();
            uniqueLoadouts.merge(player, 1, Integer::sum);
            PairKey best = topLoadout.get(player);
            if (best == null || e.getValue().games() > pairs.get(best).games()) {
                topLoadout.put(player, e.getKey());
            }
        }

        List<PlayerRow> rows = new ArrayList<>(players.size());
        for (Map.Entry<String, GroupTally> e : players.entrySet()) {
            GroupTally t = e.getValue();
            PairKey best = topLoadout.get(e.getKey());
            rows.add(new PlayerRow(e.getKey(), t.games(), t.wins(), t.winrate(), t.weightedWinrate(),
                uniqueLoadouts.getOrDefault(e.getKey(), 0),
                best != null ? best.loadout() : null,
                best != null ? pairs.get(best).games() : 0));
        }
        return List.copyOf(rows);
    }

    private List<PairRow> pairRows() {
        List<PairRow> rows = new ArrayList<>(pairs.size());
        for (Map.Entry<PairKey, GroupTally> e : pairs.entrySet()) {
            GroupTally t = e.getValue();
            rows.add(new PairRow(e.getKey().player(), e.getKey().loadout(),
                t.games(), t.wins(), t.winrate(), t.weightedWinrate()));
        }
        return List.copyOf(rows);
    }

    private List<LoadoutRow> loadoutRows() {
        List<LoadoutRow> rows = new ArrayList<>(loadouts.size());
        for (Map.Entry<String, GroupTally> e : loadouts.entrySet()) {
            GroupTally t = e.getValue();
            rows.add(new LoadoutRow(e.getKey(), t.games(), t.wins(), t.winrate()));
        }
        return List.copyOf(rows);
    }

    private List<TierRow> tierRows() {
        List<TierRow> rows = new ArrayList<>(tiers.size());
        for (Map.Entry<Tier, GroupTally> e : tiers.entrySet()) {
            GroupTally t = e.getValue();
            rows.add(new TierRow(e.getKey().key(), t.games(), t.wins(), t.winrate()));
        }
        return List.copyOf(rows);
    }

    private List<TripleAggregate> tripleAggregates() {
        List<TripleAggregate> rows = new ArrayList<>(triples.size());
        for (Map.Entry<TripleKey, GroupTally> e : triples.entrySet()) {
            GroupTally t = e.getValue();
            rows.add(new TripleAggregate(e.getKey(), t.games(), t.wins(), t.winrate(),
                t.weightedWins(), t.weightedGames(), t.weightedWinrate(),
                t.deltas(), t.tableAverages()));
        }
        return List.copyOf(rows);
    }

    private List<DistinctTripleRow> distinctTripleRows() {
        List<DistinctTripleRow> rows = new ArrayList<>(distinctTriples.size());
        for (Map.Entry<TripleKey, Integer> e : distinctTriples.entrySet()) {
            TripleKey k = e.getKey();
            rows.add(new DistinctTripleRow(k.loadout(), k.player(), k.tier().key(), e.getValue()));
        }
        return List.copyOf(rows);
    }

    private Map<Tier, Integer> tierEntryCounts() {
        Map<Tier, Integer> counts = new TreeMap<>();
        tiers.forEach((tier, t) -> counts.put(tier, t.games()));
        return counts;
    }

    private static Map<String, Integer> tierCounts(Map<Tier, Integer> byTier) {
        Map<String, Integer> out = new LinkedHashMap<>();
        byTier.forEach((tier, n) -> out.put(tier.key(), n));
        return Collections.unmodifiableMap(out);
    }
}
