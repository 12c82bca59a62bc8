package com.commandertracker.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Logging context of one export run: the {@code runId} tying its lines together and the
 * {@link ExportStage} each line was written in.
 *
 * <p>Run ids lead with the UTC start time ({@code 20261018T101500Z-1a2b3c4d}), so log
 * files sort by run. Inside the pipeline the runId travels in the Reactor Context; MDC
 * holds {@value #RUN_ID_KEY} and {@value #STAGE_KEY} only for the duration of one log
 * statement and is cleared right after, never kept as thread state.
 *
 * <pre>
 *     String runId = RunContextUtil.newRunId(Instant.now());
 *     return RunContextUtil.withRunId(loader.loadSnapshot(), runId);
 *     ...
 *     RunContextUtil.withMdc(runId, ExportStage.SOURCE, () -&gt; log.warn("..."));
 * </pre>
 */
public final class RunContextUtil {

    public static final String RUN_ID_KEY = "runId";
    public static final String STAGE_KEY = "exportStage";
    public static final String UNKNOWN_RUN = "unknown";

    private static final DateTimeFormatter RUN_PREFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private RunContextUtil() {}

    /** A new run id: start time to the second plus eight random hex digits. */
    public static String newRunId(Instant startedAt) {
        return RUN_PREFIX.format(startedAt) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** The runId in {@code ctx}, or {@value #UNKNOWN_RUN}; never null. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, UNKNOWN_RUN);
    }

    /**
     * Puts {@code runId} and the stage tag into the MDC while {@code logAction} runs,
     * then removes both. Only for logging side effects.
     */
    public static void withMdc(String runId, ExportStage stage, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        MDC.put(STAGE_KEY, stage.tag());
        try {
            logAction.run();
        } finally {
            MDC.remove(STAGE_KEY);
            MDC.remove(RUN_ID_KEY);
        }
    }
}
