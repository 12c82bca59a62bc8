package com.commandertracker.common.exception;

/**
 * Fatal failure of a statistics run. Data-quality anomalies never raise this;
 * they are reported as warnings instead.
 */
public class StatsException extends RuntimeException {

    public enum Stage {
        /** The game store could not be read. */
        SOURCE,
        /** The report document could not be written. */
        OUTPUT
    }

    private final Stage stage;

    public StatsException(Stage stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public StatsException(Stage stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
