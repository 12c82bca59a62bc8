package com.commandertracker.common.model;

import java.util.Locale;
import java.util.Set;

/**
 * Optional integer power tier ("bracket") of a loadout within one game.
 *
 * <p>Either {@code present(value)} with {@value #MIN_VALUE} ≤ value ≤ {@value #MAX_VALUE},
 * or {@link #ABSENT}. The display sentinel {@value #ABSENT_KEY} only appears through
 * {@link #key()}, at serialization time.
 *
 * <p>Natural ordering: present tiers ascending, absent last.
 */
public final class Tier implements Comparable<Tier> {

    public static final int MIN_VALUE = 1;
    public static final int MAX_VALUE = 5;

    public static final String ABSENT_KEY = "n/a";

    public static final Tier ABSENT = new Tier(null);

    /** Stored tokens that mean "no tier recorded" and are not data-quality anomalies. */
    private static final Set<String> ABSENT_TOKENS = Set.of("", "n/a", "na", "none", "null", "-");

    private static final Tier[] PRESENT = new Tier[MAX_VALUE + 1];

    static {
        for (int v = MIN_VALUE; v <= MAX_VALUE; v++) {
            PRESENT[v] = new Tier(v);
        }
    }

    private final Integer value;

    private Tier(Integer value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is outside the valid range
     */
    public static Tier of(int value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Tier out of range [" + MIN_VALUE + ", " + MAX_VALUE + "]: " + value);
        }
        return PRESENT[value];
    }

    /**
     * Lenient parse of a stored tier value. Anything that is not an integer in the
     * valid range yields {@link #ABSENT}; callers that need to tell "not recorded"
     * apart from "invalid" use {@link #isAbsentToken(String)}.
     */
    public static Tier parse(String raw) {
        if (isAbsentToken(raw)) return ABSENT;
        try {
            int v = Integer.parseInt(raw.trim());
            return isValid(v) ? PRESENT[v] : ABSENT;
        } catch (NumberFormatException e) {
            return ABSENT;
        }
    }

    /** True if {@code raw} explicitly records the absence of a tier. */
    public static boolean isAbsentToken(String raw) {
        return raw == null || ABSENT_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    public static boolean isValid(int value) {
        return value >= MIN_VALUE && value <= MAX_VALUE;
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * @throws IllegalStateException if the tier is absent
     */
    public int value() {
        if (value == null) {
            throw new IllegalStateException("Tier is absent");
        }
        return value;
    }

    /** Grouping and display key: the decimal value, or {@value #ABSENT_KEY}. */
    public String key() {
        return value == null ? ABSENT_KEY : value.toString();
    }

    @Override
    public int compareTo(Tier other) {
        if (value == null) return other.value == null ? 0 : 1;
        if (other.value == null) return -1;
        return Integer.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tier other)) return false;
        return value == null ? other.value == null : value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value;
    }

    @Override
    public String toString() {
        return key();
    }
}
