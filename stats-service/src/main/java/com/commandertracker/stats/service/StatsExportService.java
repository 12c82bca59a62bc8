package com.commandertracker.stats.service;

import com.commandertracker.common.model.DataQualityWarning;
import com.commandertracker.common.report.StatsOptions;
import com.commandertracker.common.report.StatsReport;
import com.commandertracker.common.report.StatsReportAssembler;
import com.commandertracker.common.report.StatsReportSerializer;
import com.commandertracker.common.trace.ExportStage;
import com.commandertracker.common.trace.RunContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One export run: snapshot → report → file.
 *
 * <pre>
 *   GameSnapshotLoader ─▶ StatsReportAssembler ─▶ warnings logged ─▶ StatsReportSerializer.write
 * </pre>
 *
 * <p>Every run gets a fresh time-prefixed {@code runId}, carried in the Reactor Context and
 * bridged to MDC, together with the current {@link ExportStage}, for each log line. A failure
 * is logged under the stage it came from. Data-quality warnings are logged and written to the report; they
 * never fail the run. Source and output failures propagate as
 * {@link com.commandertracker.common.exception.StatsException}, and nothing is written
 * when the source fails.
 */
@Service
public class StatsExportService {

    private static final Logger log = LoggerFactory.getLogger(StatsExportService.class);

    private final GameSnapshotLoader loader;
    private final StatsReportAssembler assembler;
    private final StatsReportSerializer serializer;
    private final StatsOptions options;
    private final Path output;

    public StatsExportService(GameSnapshotLoader loader,
                              StatsReportAssembler assembler,
                              StatsReportSerializer serializer,
                              StatsOptions options,
                              @Value("${stats.export.output:docs/data/stats.v1.json}") String output) {
        this.loader     = loader;
        this.assembler  = assembler;
        this.serializer = serializer;
        this.options    = options;
        this.output     = Path.of(output);
    }

    public Mono<ExportSummary> export() {
        String runId = RunContextUtil.newRunId(Instant.now());
        RunContextUtil.withMdc(runId, ExportStage.SOURCE, () ->
            log.info("[StatsExport] started. output={} alpha={} runId={}", output, options.alpha(), runId));

        Mono<ExportSummary> pipeline = loader.loadSnapshot()
            .map(snapshot -> assembler.assemble(snapshot, options))
            .doOnNext(report -> logWarnings(report, runId))
            .flatMap(report -> Mono.fromCallable(() -> write(report, runId))
                .subscribeOn(Schedulers.boundedElastic()))
            .doOnError(e -> RunContextUtil.withMdc(runId, ExportStage.of(e), () ->
                log.error("[StatsExport] failed. stage={} runId={}", ExportStage.of(e).tag(), runId, e)));

        return RunContextUtil.withRunId(pipeline, runId);
    }

    private ExportSummary write(StatsReport report, String runId) {
        serializer.write(report, output);
        ExportSummary summary = new ExportSummary(runId, output,
            report.counts().games(), report.counts().entries(), report.warnings().size());
        RunContextUtil.withMdc(runId, ExportStage.OUTPUT, () ->
            log.info("[StatsExport] written. output={} games={} entries={} triples={} warnings={} runId={}",
                output, summary.games(), summary.entries(), report.triples().size(), summary.warnings(), runId));
        return summary;
    }

    private void logWarnings(StatsReport report, String runId) {
        for (DataQualityWarning w : report.warnings()) {
            RunContextUtil.withMdc(runId, ExportStage.ASSEMBLY, () ->
                log.warn("[DataQuality] kind={} gameId={} detail={} runId={}",
                    w.kind(), w.gameId(), w.detail(), runId));
        }
    }
}
