package com.commandertracker.stats.service;

import com.commandertracker.common.exception.StatsException;
import com.commandertracker.common.model.Game;
import com.commandertracker.common.model.GameEntry;
import com.commandertracker.common.report.StatsOptions;
import com.commandertracker.common.report.StatsReportAssembler;
import com.commandertracker.common.report.StatsReportSerializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatsExportServiceTest {

    private static final List<Game> SNAPSHOT = List.of(
        new Game(1L, Instant.parse("2026-01-10T20:00:00Z"), "B", null,
            List.of(GameEntry.of("A", "X", 3), GameEntry.of("B", "Y", 5), GameEntry.of("C", "Z", 1))),
        new Game(2L, Instant.parse("2026-01-11T20:00:00Z"), null, null,
            List.of(GameEntry.of("A", "X", 3), GameEntry.of("C", "Z", 2))));

    @Mock
    private GameSnapshotLoader loader;

    private StatsExportService service(Path output) {
        return new StatsExportService(loader,
            new StatsReportAssembler(Clock.fixed(Instant.parse("2026-02-01T08:00:00Z"), ZoneOffset.UTC)),
            new StatsReportSerializer(),
            StatsOptions.DEFAULT,
            output.toString());
    }

    @Test
    @DisplayName("export writes the document and reports counts and warnings")
    void exportWrites(@TempDir Path dir) throws IOException {
        when(loader.loadSnapshot()).thenReturn(Mono.just(SNAPSHOT));
        Path output = dir.resolve("data/stats.v1.json");

        ExportSummary summary = service(output).export().block();

        assertNotNull(summary);
        assertEquals(output, summary.output());
        assertEquals(2, summary.games());
        assertEquals(5, summary.entries());
        assertEquals(1, summary.warnings());
        assertTrue(summary.runId().matches("\\d{8}T\\d{6}Z-[0-9a-f]{8}"), summary.runId());

        JsonNode root = new ObjectMapper().readTree(Files.readString(output));
        assertEquals("stats.v1", root.get("schema").asText());
        assertEquals("2026-02-01T08:00:00Z", root.get("generated_utc").asText());
        assertEquals("NO_WINNER_MATCH", root.get("warnings").get(0).get("kind").asText());
        JsonNode pair = root.get("by_player_loadout").get(1);
        assertEquals("B", pair.get("player").asText());
        assertEquals(1.0, pair.get("weighted_winrate").asDouble(), 1e-9);
    }

    @Test
    @DisplayName("each export gets its own runId")
    void distinctRunIds(@TempDir Path dir) {
        when(loader.loadSnapshot()).thenReturn(Mono.just(SNAPSHOT));
        StatsExportService service = service(dir.resolve("stats.v1.json"));

        String first = service.export().block().runId();
        String second = service.export().block().runId();

        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("source failure → StatsException SOURCE, nothing written")
    void sourceFailure(@TempDir Path dir) {
        when(loader.loadSnapshot()).thenReturn(
            Mono.error(new StatsException(StatsException.Stage.SOURCE, "database down")));
        Path output = dir.resolve("stats.v1.json");

        StatsException ex = assertThrows(StatsException.class, () -> service(output).export().block());

        assertEquals(StatsException.Stage.SOURCE, ex.getStage());
        assertFalse(Files.exists(output));
    }

    @Test
    @DisplayName("output failure → StatsException OUTPUT")
    void outputFailure(@TempDir Path dir) throws IOException {
        when(loader.loadSnapshot()).thenReturn(Mono.just(SNAPSHOT));
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "file");

        StatsException ex = assertThrows(StatsException.class,
            () -> service(blocker.resolve("stats.v1.json")).export().block());

        assertEquals(StatsException.Stage.OUTPUT, ex.getStage());
    }
}
