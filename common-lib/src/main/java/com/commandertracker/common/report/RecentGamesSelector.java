package com.commandertracker.common.report;

import com.commandertracker.common.aggregation.KeyOrder;
import com.commandertracker.common.model.Game;
import com.commandertracker.common.model.GameEntry;
import com.commandertracker.common.model.Tier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the latest games for the recent-games table: {@code playedAt} descending, then id
 * descending, games without timestamp or id last.
 */
final class RecentGamesSelector {

    static final Comparator<Game> LATEST_FIRST =
        Comparator.comparing(Game::playedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Game::id, Comparator.nullsLast(Comparator.<Long>reverseOrder()));

    private static final Comparator<LineupEntry> LINEUP_ORDER =
        Comparator.comparing(LineupEntry::player, KeyOrder.TEXT)
            .thenComparing(LineupEntry::loadout, KeyOrder.TEXT)
            .thenComparing(LineupEntry::tier);

    private RecentGamesSelector() {}

    static List<RecentGame> select(List<Game> games, int limit) {
        List<Game> sorted = new ArrayList<>();
        for (Game g : games) {
            if (g != null) sorted.add(g);
        }
        sorted.sort(LATEST_FIRST);

        List<RecentGame> out = new ArrayList<>(Math.min(limit, sorted.size()));
        for (Game g : sorted.subList(0, Math.min(limit, sorted.size()))) {
            out.add(toRecentGame(g));
        }
        return List.copyOf(out);
    }

    private static RecentGame toRecentGame(Game g) {
        List<LineupEntry> lineup = new ArrayList<>(g.tableSize());
        for (GameEntry e : g.entries()) {
            if (e == null) continue;
            lineup.add(new LineupEntry(
                e.player()  == null ? "" : e.player(),
                e.loadout() == null ? "" : e.loadout(),
                Tier.parse(e.tier()).key()));
        }
        lineup.sort(LINEUP_ORDER);
        return new RecentGame(g.id(), g.playedAt(), g.winnerName(), g.notes(), lineup.size(), List.copyOf(lineup));
    }
}
