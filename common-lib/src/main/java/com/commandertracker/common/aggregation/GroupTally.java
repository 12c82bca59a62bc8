package com.commandertracker.common.aggregation;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable counters for one grouping key, alive only for the duration of one run.
 *
 * <p>Weighted accumulation: a win of weight {@code w} adds {@code w} to
 * {@code weightedWins}. {@code weightedGames} is derived as
 * {@code (games − wins) + weightedWins}, so every loss counts 1 and every win counts
 * its own weight on both sides. Deriving it instead of summing {@code +1} and
 * {@code w − 1} keeps tiny weights from cancelling to zero and huge ones from
 * overflowing to {@code ∞ − ∞}.
 */
final class GroupTally {

    private int games;
    private int wins;
    private double weightedWins;

    /** ΔB of each qualifying win, in game order. Only filled for triple keys. */
    private final List<Double> deltas = new ArrayList<>();

    /** Table average of each qualifying win, parallel to {@link #deltas}. */
    private final List<Double> tableAverages = new ArrayList<>();

    void recordEntry() {
        games++;
    }

    void recordWin(double weight) {
        wins++;
        weightedWins += weight;
    }

    void recordQualifyingWin(double delta, double tableAverage) {
        deltas.add(delta);
        tableAverages.add(tableAverage);
    }

    int games() {
        return games;
    }

    int wins() {
        return wins;
    }

    double weightedWins() {
        return weightedWins;
    }

    double weightedGames() {
        return (games - wins) + weightedWins;
    }

    double winrate() {
        return games > 0 ? (double) wins / games : 0.0;
    }

    /**
     * Zero without wins. With wins, an infinite {@code weightedWins} or a group that
     * never lost (whose weights may have underflowed to zero) reads as 1.0.
     */
    double weightedWinrate() {
        if (wins == 0) return 0.0;
        if (Double.isInfinite(weightedWins)) return 1.0;
        double weightedGames = weightedGames();
        if (weightedGames <= 0.0) return 1.0;
        return Math.max(0.0, Math.min(1.0, weightedWins / weightedGames));
    }

    List<Double> deltas() {
        return List.copyOf(deltas);
    }

    List<Double> tableAverages() {
        return List.copyOf(tableAverages);
    }
}
