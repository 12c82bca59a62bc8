package com.commandertracker.stats.service;

import java.nio.file.Path;

/** Outcome of one successful export. */
public record ExportSummary(
    String runId,
    Path   output,
    int    games,
    int    entries,
    int    warnings
) {}
