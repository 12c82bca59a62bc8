package com.commandertracker.common.aggregation;

import java.util.Comparator;

/**
 * Deterministic key ordering shared by every table: case-insensitive first,
 * exact text second, so that "alice" and "Alice" never collapse or swap between runs.
 */
public final class KeyOrder {

    public static final Comparator<String> TEXT =
        Comparator.nullsFirst(String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder()));

    private KeyOrder() {}
}
