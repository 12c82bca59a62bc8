package com.commandertracker.common.pressure;

/**
 * Pressure metrics of one triple group.
 *
 * <ul>
 *   <li>{@code index}          – mean ΔB over qualifying wins; null below the minimum sample.</li>
 *   <li>{@code label}          – qualitative reading of {@code index}.</li>
 *   <li>{@code winCoverage}    – qualifying wins / wins in [0.0, 1.0]; null without wins.</li>
 *   <li>{@code avgTableTier}   – mean table average over qualifying wins; null without any.</li>
 *   <li>{@code qualifyingWins} – wins where both the winner tier and table average were defined.</li>
 * </ul>
 */
public record PressureSummary(
    Double index,
    String label,
    Double winCoverage,
    Double avgTableTier,
    int    qualifyingWins
) {}
