package com.commandertracker.common.aggregation;

import com.commandertracker.common.model.DataQualityWarning;
import com.commandertracker.common.model.Game;
import com.commandertracker.common.model.GameEntry;
import com.commandertracker.common.model.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link StatsAggregationEngine}.
 * Covers the worked weighting example, the weighted win-rate bounds, winner resolution
 * anomalies and the deterministic ordering of every table.
 */
class StatsAggregationEngineTest {

    private static final double EPS = 1e-9;

    private static GameEntry e(String player, String loadout, Integer tier) {
        return GameEntry.of(player, loadout, tier);
    }

    private static Game game(long id, String winner, GameEntry... entries) {
        return new Game(id, null, winner, null, List.of(entries));
    }

    private static TripleAggregate triple(AggregationResult r, String player, String loadout, Tier tier) {
        TripleKey key = new TripleKey(player, loadout, tier);
        return r.triples().stream()
            .filter(t -> t.key().equals(key))
            .findFirst()
            .orElseThrow(() -> new AssertionError("missing triple " + key));
    }

    /** Mixed snapshot: discounted, amplified, tierless and winnerless wins. */
    private static List<Game> mixedSnapshot() {
        return List.of(
            game(1, "B", e("A", "X", 3), e("B", "Y", 5), e("C", "Z", 1)),
            game(2, "C", e("A", "X", 3), e("B", "Y", 5), e("C", "Z", 1)),
            game(3, "A", e("A", "X", 2), e("B", "W", 4)),
            game(4, "B", e("A", "X", 3), e("B", "Y", null)),
            game(5, "A", e("A", "Q", 4), e("C", "Z", 2), e("D", "V", 2), e("B", "Y", 5)),
            game(6, null, e("A", "X", 3), e("D", "V", 1)));
    }

    // ── weighting ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("weighted counts")
    class WeightingTests {

        @Test
        @DisplayName("worked example: B (5) beats a table averaging 3 at α = 0.5 → w = 0.5, weighted win-rate 1.0")
        void workedExample() {
            AggregationResult r = StatsAggregationEngine.aggregate(
                List.of(game(1, "B", e("A", "X", 3), e("B", "Y", 5), e("C", "Z", 1))), 0.5);

            TripleAggregate b = triple(r, "B", "Y", Tier.of(5));
            assertEquals(1, b.games());
            assertEquals(1, b.wins());
            assertEquals(0.5, b.weightedWins(), EPS);
            assertEquals(0.5, b.weightedGames(), EPS);
            assertEquals(1.0, b.weightedWinrate(), EPS);
            assertEquals(List.of(2.0), b.deltas());
            assertEquals(List.of(3.0), b.tableAverages());

            TripleAggregate a = triple(r, "A", "X", Tier.of(3));
            assertEquals(0, a.wins());
            assertEquals(1.0, a.weightedGames(), EPS);
            assertEquals(0.0, a.weightedWinrate(), EPS);
        }

        @Test
        @DisplayName("0 ≤ weighted win-rate ≤ 1 on every table for several α")
        void weightedWinrateBounded() {
            for (double alpha : new double[] {0.0, 0.25, 0.5, 1.0, 2.0, 5.0}) {
                AggregationResult r = StatsAggregationEngine.aggregate(mixedSnapshot(), alpha);
                for (TripleAggregate t : r.triples()) {
                    assertTrue(t.weightedWinrate() >= 0.0 && t.weightedWinrate() <= 1.0,
                        "triple " + t.key() + " at alpha=" + alpha + ": " + t.weightedWinrate());
                    assertTrue(t.weightedWins() <= t.weightedGames() + EPS,
                        "weighted wins exceed weighted games for " + t.key());
                }
                for (PlayerRow p : r.players()) {
                    assertTrue(p.weightedWinrate() >= 0.0 && p.weightedWinrate() <= 1.0, p.toString());
                }
                for (PairRow p : r.pairs()) {
                    assertTrue(p.weightedWinrate() >= 0.0 && p.weightedWinrate() <= 1.0, p.toString());
                }
            }
        }

        @Test
        @DisplayName("extreme α: vanishing and infinite weights keep the weighted win-rate in [0, 1]")
        void extremeAlphaStaysBounded() {
            for (double alpha : new double[] {1e17, Double.MAX_VALUE}) {
                AggregationResult r = StatsAggregationEngine.aggregate(mixedSnapshot(), alpha);
                for (TripleAggregate t : r.triples()) {
                    assertFalse(Double.isNaN(t.weightedWinrate()), "NaN for " + t.key() + " at alpha=" + alpha);
                    assertTrue(t.weightedWinrate() >= 0.0 && t.weightedWinrate() <= 1.0,
                        "triple " + t.key() + " at alpha=" + alpha + ": " + t.weightedWinrate());
                }
                for (PlayerRow p : r.players()) {
                    assertFalse(Double.isNaN(p.weightedWinrate()), p.toString());
                    assertTrue(p.weightedWinrate() >= 0.0 && p.weightedWinrate() <= 1.0, p.toString());
                }
                for (PairRow p : r.pairs()) {
                    assertFalse(Double.isNaN(p.weightedWinrate()), p.toString());
                    assertTrue(p.weightedWinrate() >= 0.0 && p.weightedWinrate() <= 1.0, p.toString());
                }

                // C (1) beats a table averaging 3: the upset weight overflows to infinity
                assertEquals(1.0, triple(r, "C", "Z", Tier.of(1)).weightedWinrate(), EPS,
                    "C/Z/1 at alpha=" + alpha);

                // B (5) beats a table averaging 3 and never loses: the discounted weight is still a full rate
                AggregationResult single = StatsAggregationEngine.aggregate(
                    List.of(game(1, "B", e("A", "X", 3), e("B", "Y", 5), e("C", "Z", 1))), alpha);
                TripleAggregate b = triple(single, "B", "Y", Tier.of(5));
                assertEquals(1.0, b.weightedWinrate(), EPS, "B/Y/5 at alpha=" + alpha);
                assertEquals(b.weightedWins(), b.weightedGames(), 0.0);
            }
        }

        @Test
        @DisplayName("α = 0 → weighted win-rate equals plain win-rate everywhere")
        void zeroAlphaMatchesWinrate() {
            AggregationResult r = StatsAggregationEngine.aggregate(mixedSnapshot(), 0.0);
            for (TripleAggregate t : r.triples()) {
                assertEquals(t.winrate(), t.weightedWinrate(), EPS, t.key().toString());
                assertEquals(t.games(), t.weightedGames(), EPS);
                assertEquals(t.wins(), t.weightedWins(), EPS);
            }
            for (PlayerRow p : r.players()) {
                assertEquals(p.winrate(), p.weightedWinrate(), EPS, p.player());
            }
        }

        @Test
        @DisplayName("upset win (ΔB < 0) is amplified")
        void upsetAmplified() {
            AggregationResult r = StatsAggregationEngine.aggregate(
                List.of(game(2, "C", e("A", "X", 3), e("B", "Y", 5), e("C", "Z", 1))), 0.5);
            TripleAggregate c = triple(r, "C", "Z", Tier.of(1));
            // ΔB = -2 → w = 2.0; weighted games = 1 + (2 - 1)
            assertEquals(2.0, c.weightedWins(), EPS);
            assertEquals(2.0, c.weightedGames(), EPS);
            assertEquals(1.0, c.weightedWinrate(), EPS);
        }

        @Test
        @DisplayName("winner without a tier counts a neutral win and no qualifying delta")
        void tierlessWinnerIsNeutral() {
            AggregationResult r = StatsAggregationEngine.aggregate(
                List.of(game(4, "B", e("A", "X", 3), e("B", "Y", null))), 0.5);
            TripleAggregate b = triple(r, "B", "Y", Tier.ABSENT);
            assertEquals(1.0, b.weightedWins(), EPS);
            assertEquals(0, b.qualifyingWins());
        }
    }

    // ── counts ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("counts and tables")
    class CountTests {

        @Test
        @DisplayName("tier games sum to the entry count")
        void tierGamesSumToEntries() {
            AggregationResult r = StatsAggregationEngine.aggregate(mixedSnapshot(), 0.5);
            assertEquals(6, r.gameCount());
            assertEquals(16, r.entryCount());
            assertEquals(r.entryCount(), r.tiers().stream().mapToInt(TierRow::games).sum());
            assertEquals(r.entryCount(), r.tierEntryCounts().values().stream().mapToInt(Integer::intValue).sum());
            assertEquals(r.entryCount(), r.distinctTriples().stream().mapToInt(DistinctTripleRow::entries).sum());
        }

        @Test
        @DisplayName("tier winner counts only include games with a unique winner")
        void tierWinnerCounts() {
            AggregationResult r = StatsAggregationEngine.aggregate(mixedSnapshot(), 0.5);
            // five resolved winners: B(5), C(1), A(2), B(n/a), A(4)
            assertEquals(Map.of("1", 1, "2", 1, "4", 1, "5", 1, "n/a", 1), r.tierWinnerCounts());
            assertEquals(List.of("1", "2", "4", "5", "n/a"), List.copyOf(r.tierWinnerCounts().keySet()));
        }

        @Test
        @DisplayName("player row: games, wins, unique and top loadout")
        void playerRow() {
            AggregationResult r = StatsAggregationEngine.aggregate(mixedSnapshot(), 0.5);
            PlayerRow a = r.players().get(0);
            assertEquals("A", a.player());
            assertEquals(6, a.games());
            assertEquals(2, a.wins());
            assertEquals(2.0 / 6, a.winrate(), EPS);
            assertEquals(2, a.uniqueLoadouts());
            assertEquals("X", a.topLoadout());
            assertEquals(5, a.topLoadoutGames());
        }

        @Test
        @DisplayName("loadout table counts games and wins per loadout")
        void loadoutTable() {
            AggregationResult r = StatsAggregationEngine.aggregate(mixedSnapshot(), 0.5);
            LoadoutRow y = r.loadouts().stream().filter(l -> l.loadout().equals("Y")).findFirst().orElseThrow();
            assertEquals(4, y.games());
            assertEquals(2, y.wins());
            assertEquals(0.5, y.winrate(), EPS);
        }

        @Test
        @DisplayName("empty snapshot → empty tables, no warnings")
        void emptySnapshot() {
            AggregationResult r = StatsAggregationEngine.aggregate(List.of(), 0.5);
            assertEquals(0, r.gameCount());
            assertTrue(r.players().isEmpty());
            assertTrue(r.triples().isEmpty());
            assertTrue(r.tierEntryCounts().isEmpty());
            assertTrue(r.warnings().isEmpty());
        }
    }

    // ── anomalies ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("data-quality anomalies")
    class AnomalyTests {

        @Test
        @DisplayName("missing winner → NO_WINNER_MATCH, entries still counted")
        void missingWinner() {
            AggregationResult r = StatsAggregationEngine.aggregate(
                List.of(game(9, null, e("A", "X", 3), e("B", "Y", 2))), 0.5);
            assertEquals(1, r.warnings().size());
            DataQualityWarning w = r.warnings().get(0);
            assertEquals(DataQualityWarning.Kind.NO_WINNER_MATCH, w.kind());
            assertEquals(9L, w.gameId());
            assertEquals(2, r.entryCount());
            assertTrue(r.players().stream().allMatch(p -> p.wins() == 0));
            assertTrue(r.tierWinnerCounts().isEmpty());
        }

        @Test
        @DisplayName("winner not at the table → NO_WINNER_MATCH naming the winner")
        void unknownWinner() {
            AggregationResult r = StatsAggregationEngine.aggregate(
                List.of(game(10, "Zed", e("A", "X", 3), e("B", "Y", 2))), 0.5);
            DataQualityWarning w = r.warnings().get(0);
            assertEquals(DataQualityWarning.Kind.NO_WINNER_MATCH, w.kind());
            assertTrue(w.detail().contains("Zed"));
        }

        @Test
        @DisplayName("winner name on two entries → AMBIGUOUS_WINNER, no win credited")
        void ambiguousWinner() {
            AggregationResult r = StatsAggregationEngine.aggregate(
                List.of(game(11, "A", e("A", "X", 3), e("A", "Y", 2), e("B", "Z", 4))), 0.5);
            assertEquals(DataQualityWarning.Kind.AMBIGUOUS_WINNER, r.warnings().get(0).kind());
            PlayerRow a = r.players().get(0);
            assertEquals(2, a.games());
            assertEquals(0, a.wins());
        }

        @Test
        @DisplayName("out-of-range or non-numeric tier → INVALID_TIER and bucket n/a; absent tokens are silent")
        void invalidTier() {
            AggregationResult r = StatsAggregationEngine.aggregate(List.of(new Game(12L, null, "A", null, List.of(
                new GameEntry("A", "X", "7"),
                new GameEntry("B", "Y", "high"),
                new GameEntry("C", "Z", "n/a"),
                new GameEntry("D", "W", "2")))), 0.5);

            long invalid = r.warnings().stream()
                .filter(w -> w.kind() == DataQualityWarning.Kind.INVALID_TIER).count();
            assertEquals(2, invalid);
            assertEquals(Map.of("2", 1, "n/a", 3), r.tierEntryCounts());
            assertEquals(List.of("2"), r.tierValues());
        }

        @Test
        @DisplayName("null elements are skipped")
        void nullGameSkipped() {
            List<Game> games = new ArrayList<>();
            games.add(null);
            games.add(game(1, "A", e("A", "X", 3)));
            AggregationResult r = StatsAggregationEngine.aggregate(games, 0.5);
            assertEquals(1, r.gameCount());
        }
    }

    // ── ordering ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("deterministic ordering")
    class OrderingTests {

        @Test
        @DisplayName("text keys: case-insensitive first, exact text second")
        void textOrdering() {
            AggregationResult r = StatsAggregationEngine.aggregate(List.of(
                game(1, "bob", e("bob", "Yuriko", 3), e("Alice", "atraxa", 3), e("alice", "Atraxa", 2))), 0.5);
            assertEquals(List.of("Alice", "alice", "bob"), r.playerNames());
            assertEquals(List.of("Atraxa", "atraxa", "Yuriko"), r.loadoutNames());
        }

        @Test
        @DisplayName("distinct triples: loadout → player → tier, n/a last")
        void distinctTripleOrdering() {
            AggregationResult r = StatsAggregationEngine.aggregate(List.of(
                game(1, null, e("B", "X", null), e("A", "Y", 2), e("B", "X", 4), e("A", "X", 1))), 0.5);
            List<String> keys = r.distinctTriples().stream()
                .map(d -> d.loadout() + "/" + d.player() + "/" + d.tier())
                .toList();
            assertEquals(List.of("X/A/1", "X/B/4", "X/B/n/a", "Y/A/2"), keys);
        }

        @Test
        @DisplayName("same snapshot twice → equal results")
        void repeatable() {
            assertEquals(StatsAggregationEngine.aggregate(mixedSnapshot(), 0.5),
                StatsAggregationEngine.aggregate(mixedSnapshot(), 0.5));
        }
    }
}
