package com.commandertracker.common.model;

/**
 * Outcome of matching a game's {@code winnerName} against its entries.
 *
 * <ul>
 *   <li>{@link #UNIQUE_MATCH}:    exactly one entry's player equals the winner name.</li>
 *   <li>{@link #NO_MATCH}:        no winner recorded, or no entry carries that name.</li>
 *   <li>{@link #AMBIGUOUS_MATCH}: more than one entry carries that name.</li>
 * </ul>
 *
 * Only {@link #UNIQUE_MATCH} contributes a win.
 */
public enum WinnerResolution {
    UNIQUE_MATCH,
    NO_MATCH,
    AMBIGUOUS_MATCH
}
