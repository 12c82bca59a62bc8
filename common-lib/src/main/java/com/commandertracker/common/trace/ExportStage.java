package com.commandertracker.common.trace;

import com.commandertracker.common.exception.StatsException;

/**
 * Phase of an export run, written to MDC next to the runId so a run's log lines can be
 * filtered down to one phase.
 */
public enum ExportStage {

    /** Reading and joining the game tables. */
    SOURCE("source"),
    /** Aggregating the snapshot into a report. */
    ASSEMBLY("assembly"),
    /** Writing the report document. */
    OUTPUT("output");

    private final String tag;

    ExportStage(String tag) {
        this.tag = tag;
    }

    /** Lower-case MDC value. */
    public String tag() {
        return tag;
    }

    /**
     * The phase a failure came from: the stage a {@link StatsException} names, otherwise
     * {@link #ASSEMBLY}, since source and output failures are always wrapped.
     */
    public static ExportStage of(Throwable failure) {
        if (failure instanceof StatsException se && se.getStage() != null) {
            return se.getStage() == StatsException.Stage.SOURCE ? SOURCE : OUTPUT;
        }
        return ASSEMBLY;
    }
}
