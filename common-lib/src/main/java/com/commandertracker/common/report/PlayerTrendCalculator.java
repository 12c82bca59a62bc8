package com.commandertracker.common.report;

import com.commandertracker.common.aggregation.KeyOrder;
import com.commandertracker.common.model.Game;
import com.commandertracker.common.model.GameEntry;
import com.commandertracker.common.model.WinnerMatch;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Cumulative win-rate series per player.
 *
 * <p>Games are walked chronologically (untimestamped games first, input order breaks ties).
 * A player seated more than once in a game counts that game once. A win needs a unique
 * winner match, the same rule the aggregation engine applies.
 *
 * <p>Points are labelled by UTC day, by {@code game <id>} when the game has no timestamp,
 * and by {@code game #<n>} (1-based position in the chronological walk) when it has neither.
 */
public final class PlayerTrendCalculator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private static final Comparator<Game> CHRONOLOGICAL =
        Comparator.comparing(Game::playedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    private PlayerTrendCalculator() {}

    public static Map<String, List<TrendPoint>> compute(List<Game> games) {
        if (games == null || games.isEmpty()) return Map.of();

        List<Game> ordered = new ArrayList<>();
        for (Game g : games) {
            if (g != null) ordered.add(g);
        }
        ordered.sort(CHRONOLOGICAL);

        Map<String, List<TrendPoint>> series = new TreeMap<>(KeyOrder.TEXT);
        Map<String, int[]> running = new TreeMap<>(KeyOrder.TEXT);

        for (int position = 0; position < ordered.size(); position++) {
            Game g = ordered.get(position);
            List<String> names = new ArrayList<>(g.tableSize());
            for (GameEntry e : g.entries()) {
                if (e != null) names.add(e.player() == null ? "" : e.player());
            }
            WinnerMatch match = WinnerMatch.resolve(g.winnerName(), names);
            String winner = match.isUnique() ? names.get(match.entryIndex()) : null;
            String label = label(g, position);

            Set<String> seated = new LinkedHashSet<>(names);
            for (String player : seated) {
                int[] gw = running.computeIfAbsent(player, k -> new int[2]);
                gw[0]++;
                if (player.equals(winner)) gw[1]++;
                series.computeIfAbsent(player, k -> new ArrayList<>())
                    .add(new TrendPoint(label, gw[0], gw[1], (double) gw[1] / gw[0]));
            }
        }

        Map<String, List<TrendPoint>> out = new LinkedHashMap<>();
        series.forEach((player, points) -> out.put(player, List.copyOf(points)));
        return Collections.unmodifiableMap(out);
    }

    static String label(Game g, int position) {
        if (g.playedAt() != null) return DAY.format(g.playedAt());
        return g.id() != null ? "game " + g.id() : "game #" + (position + 1);
    }
}
