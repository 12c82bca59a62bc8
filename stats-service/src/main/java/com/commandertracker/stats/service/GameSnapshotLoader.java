package com.commandertracker.stats.service;

import com.commandertracker.common.exception.StatsException;
import com.commandertracker.common.model.Game;
import com.commandertracker.common.model.GameEntry;
import com.commandertracker.common.trace.ExportStage;
import com.commandertracker.common.trace.RunContextUtil;
import com.commandertracker.stats.model.GameEntryRecord;
import com.commandertracker.stats.model.GameRecord;
import com.commandertracker.stats.repository.GameEntryRecordRepository;
import com.commandertracker.stats.repository.GameRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads both game tables and joins them into an immutable {@link Game} snapshot.
 *
 * <p>Games keep the repository's id order; entries keep their order within a game. Entries
 * pointing at a missing game are dropped with a WARN log. Any read failure surfaces as a
 * {@link StatsException} at stage {@code SOURCE}.
 */
@Service
public class GameSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(GameSnapshotLoader.class);

    private final GameRecordRepository gameRepository;
    private final GameEntryRecordRepository entryRepository;

    public GameSnapshotLoader(GameRecordRepository gameRepository,
                              GameEntryRecordRepository entryRepository) {
        this.gameRepository  = gameRepository;
        this.entryRepository = entryRepository;
    }

    public Mono<List<Game>> loadSnapshot() {
        return Mono.deferContextual(ctx -> {
            String runId = RunContextUtil.getRunId(ctx);
            return Mono.zip(
                    gameRepository.findAllOrderById().collectList(),
                    entryRepository.findAllOrderByGame().collectList())
                .map(t -> join(t.getT1(), t.getT2(), runId));
        })
        .onErrorMap(e -> !(e instanceof StatsException),
            e -> new StatsException(StatsException.Stage.SOURCE, "Could not read game store: " + e.getMessage(), e));
    }

    // ── join ─────────────────────────────────────────────────────────────────

    List<Game> join(List<GameRecord> games, List<GameEntryRecord> entries, String runId) {
        Set<Long> known = new HashSet<>();
        for (GameRecord g : games) {
            if (g.getId() != null) known.add(g.getId());
        }

        Map<Long, List<GameEntry>> byGame = new LinkedHashMap<>();
        int orphans = 0;
        for (GameEntryRecord e : entries) {
            if (e.getGameId() == null || !known.contains(e.getGameId())) {
                orphans++;
                RunContextUtil.withMdc(runId, ExportStage.SOURCE, () ->
                    log.warn("[Snapshot] orphan entry skipped. entryId={} gameId={} runId={}",
                        e.getId(), e.getGameId(), runId));
                continue;
            }
            byGame.computeIfAbsent(e.getGameId(), k -> new ArrayList<>())
                .add(new GameEntry(e.getPlayer(), e.getCommander(), e.getBracket()));
        }

        List<Game> snapshot = new ArrayList<>(games.size());
        int entryCount = 0;
        for (GameRecord g : games) {
            List<GameEntry> lineup = g.getId() != null ? byGame.getOrDefault(g.getId(), List.of()) : List.of();
            entryCount += lineup.size();
            snapshot.add(new Game(
                g.getId(),
                g.getPlayedAt() != null ? g.getPlayedAt().toInstant(ZoneOffset.UTC) : null,
                g.getWinnerPlayer(),
                g.getNotes(),
                lineup));
        }

        int entriesLoaded = entryCount;
        int orphansSkipped = orphans;
        RunContextUtil.withMdc(runId, ExportStage.SOURCE, () ->
            log.info("[Snapshot] loaded. games={} entries={} orphans={} runId={}",
                snapshot.size(), entriesLoaded, orphansSkipped, runId));
        return List.copyOf(snapshot);
    }
}
