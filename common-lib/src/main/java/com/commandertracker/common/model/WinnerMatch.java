package com.commandertracker.common.model;

import java.util.List;

/**
 * Winner reference resolved once per game.
 *
 * <p>{@code entryIndex} points into the game's entry list and is {@code -1}
 * unless {@code resolution} is {@link WinnerResolution#UNIQUE_MATCH}.
 */
public record WinnerMatch(WinnerResolution resolution, int entryIndex) {

    private static final WinnerMatch NONE      = new WinnerMatch(WinnerResolution.NO_MATCH, -1);
    private static final WinnerMatch AMBIGUOUS = new WinnerMatch(WinnerResolution.AMBIGUOUS_MATCH, -1);

    /**
     * Matches {@code winnerName} against {@code players} by exact string equality.
     * A null or blank winner name is {@link WinnerResolution#NO_MATCH}.
     *
     * @param winnerName the game's recorded winner
     * @param players    the player names of the game's entries, in entry order
     * @return the resolved match; never null
     */
    public static WinnerMatch resolve(String winnerName, List<String> players) {
        if (winnerName == null || winnerName.isBlank() || players == null) return NONE;

        int found = -1;
        for (int i = 0; i < players.size(); i++) {
            if (winnerName.equals(players.get(i))) {
                if (found >= 0) return AMBIGUOUS;
                found = i;
            }
        }
        return found < 0 ? NONE : new WinnerMatch(WinnerResolution.UNIQUE_MATCH, found);
    }

    public boolean isUnique() {
        return resolution == WinnerResolution.UNIQUE_MATCH;
    }
}
