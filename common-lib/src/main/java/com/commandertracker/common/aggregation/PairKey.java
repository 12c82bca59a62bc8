package com.commandertracker.common.aggregation;

import java.util.Comparator;

/** Grouping key {@code (player, loadout)}. */
public record PairKey(String player, String loadout) implements Comparable<PairKey> {

    private static final Comparator<PairKey> ORDER =
        Comparator.comparing(PairKey::player, KeyOrder.TEXT)
            .thenComparing(PairKey::loadout, KeyOrder.TEXT);

    @Override
    public int compareTo(PairKey other) {
        return ORDER.compare(this, other);
    }
}
