package com.commandertracker.common.aggregation;

import com.commandertracker.common.model.Tier;

import java.util.Comparator;

/**
 * Grouping key {@code (player, loadout, tier)}.
 *
 * <p>Natural order is player → loadout → tier. {@link #LOADOUT_FIRST} orders the
 * distinct-triple existence table (loadout → player → tier).
 */
public record TripleKey(String player, String loadout, Tier tier) implements Comparable<TripleKey> {

    private static final Comparator<TripleKey> ORDER =
        Comparator.comparing(TripleKey::player, KeyOrder.TEXT)
            .thenComparing(TripleKey::loadout, KeyOrder.TEXT)
            .thenComparing(TripleKey::tier);

    public static final Comparator<TripleKey> LOADOUT_FIRST =
        Comparator.comparing(TripleKey::loadout, KeyOrder.TEXT)
            .thenComparing(TripleKey::player, KeyOrder.TEXT)
            .thenComparing(TripleKey::tier);

    public PairKey pair() {
        return new PairKey(player, loadout);
    }

    @Override
    public int compareTo(TripleKey other) {
        return ORDER.compare(this, other);
    }
}
