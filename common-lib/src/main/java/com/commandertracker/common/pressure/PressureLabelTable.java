package com.commandertracker.common.pressure;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Step function mapping a pressure index to a qualitative label.
 *
 * <p>Bands are {@code (floor, label)} pairs; an index takes the label of the highest
 * floor it reaches. A floor is reached at {@code index ≥ floor}, or at
 * {@code index > floor} for an exclusive band, which lets the label below keep the
 * boundary value. Below the lowest floor an index takes {@code baseLabel}. A null
 * index (insufficient sample) takes {@value #INSUFFICIENT_LABEL}.
 *
 * <pre>
 *   default:   index ≤ -1.0        → underdog
 *              -1.0 &lt; index &lt; 1.0  → fair
 *               1.0 ≤ index &lt; 2.0  → over
 *               2.0 ≤ index         → pubstomp
 * </pre>
 */
public final class PressureLabelTable {

    public static final String INSUFFICIENT_LABEL = "n/a";

    public static final PressureLabelTable DEFAULT = new PressureLabelTable("underdog", List.of(
        new Band(-1.0, "fair", true),
        new Band( 1.0, "over"),
        new Band( 2.0, "pubstomp")
    ));

    /**
     * One step of the function: every index ≥ {@code floor} gets {@code label}, or
     * every index &gt; {@code floor} when {@code exclusive}.
     */
    public record Band(
        @JsonProperty("floor")     double  floor,
        @JsonProperty("label")     String  label,
        @JsonProperty("exclusive") boolean exclusive
    ) {
        public Band(double floor, String label) {
            this(floor, label, false);
        }

        boolean reachedBy(double index) {
            return exclusive ? index > floor : index >= floor;
        }
    }

    private final String baseLabel;
    private final List<Band> bands;

    /**
     * @throws IllegalArgumentException on blank labels, non-finite or duplicate floors
     */
    public PressureLabelTable(String baseLabel, List<Band> bands) {
        if (baseLabel == null || baseLabel.isBlank()) {
            throw new IllegalArgumentException("Pressure base label must not be blank");
        }
        List<Band> sorted = new ArrayList<>(bands == null ? List.of() : bands);
        sorted.sort(Comparator.comparingDouble(Band::floor));
        for (int i = 0; i < sorted.size(); i++) {
            Band b = sorted.get(i);
            if (!Double.isFinite(b.floor())) {
                throw new IllegalArgumentException("Pressure band floor must be finite: " + b.floor());
            }
            if (b.label() == null || b.label().isBlank()) {
                throw new IllegalArgumentException("Pressure band label must not be blank at floor " + b.floor());
            }
            if (i > 0 && sorted.get(i - 1).floor() == b.floor()) {
                throw new IllegalArgumentException("Duplicate pressure band floor: " + b.floor());
            }
        }
        this.baseLabel = baseLabel.trim();
        this.bands = List.copyOf(sorted);
    }

    /**
     * Parses {@code "floor:label,floor:label,..."}, e.g. {@code ">-1.0:fair,1.0:over,2.0:pubstomp"}.
     * A leading {@code >} marks an exclusive floor.
     *
     * @throws IllegalArgumentException on malformed input
     */
    public static PressureLabelTable parse(String baseLabel, String bandSpec) {
        List<Band> bands = new ArrayList<>();
        if (bandSpec != null && !bandSpec.isBlank()) {
            for (String part : bandSpec.split(",")) {
                String token = part.trim();
                boolean exclusive = token.startsWith(">");
                String body = exclusive ? token.substring(1).trim() : token;
                int sep = body.indexOf(':');
                if (sep <= 0 || sep == body.length() - 1) {
                    throw new IllegalArgumentException("Malformed pressure band '" + token + "', expected [>]floor:label");
                }
                double floor;
                try {
                    floor = Double.parseDouble(body.substring(0, sep).trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Malformed pressure band floor in '" + token + "'", e);
                }
                bands.add(new Band(floor, body.substring(sep + 1).trim(), exclusive));
            }
        }
        return new PressureLabelTable(baseLabel, bands);
    }

    public String label(Double index) {
        if (index == null || index.isNaN()) return INSUFFICIENT_LABEL;
        String label = baseLabel;
        for (Band b : bands) {
            if (b.reachedBy(index)) {
                label = b.label();
            } else {
                break;
            }
        }
        return label;
    }

    public String baseLabel() {
        return baseLabel;
    }

    /** Bands in ascending floor order. */
    public List<Band> bands() {
        return bands;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PressureLabelTable other)) return false;
        return baseLabel.equals(other.baseLabel) && bands.equals(other.bands);
    }

    @Override
    public int hashCode() {
        return 31 * baseLabel.hashCode() + bands.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(baseLabel);
        for (Band b : bands) {
            sb.append(" | ").append(b.exclusive() ? ">" : "").append(b.floor()).append(':').append(b.label());
        }
        return sb.toString();
    }
}
