package com.commandertracker.stats.job;

import com.commandertracker.stats.service.ExportSummary;
import com.commandertracker.stats.service.StatsExportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one export when the application starts. A failed export fails the start, so the
 * process exits non-zero and the previous document stays in place.
 *
 * <p>Disabled with {@code stats.export.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "stats.export.enabled", havingValue = "true", matchIfMissing = true)
public class StatsExportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StatsExportRunner.class);

    private final StatsExportService exportService;

    public StatsExportRunner(StatsExportService exportService) {
        this.exportService = exportService;
    }

    @Override
    public void run(ApplicationArguments args) {
        ExportSummary summary = exportService.export().block();
        if (summary != null) {
            log.info("Startup export complete. output={} runId={}", summary.output(), summary.runId());
        }
    }
}
