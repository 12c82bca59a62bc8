package com.commandertracker.common.report;

import com.commandertracker.common.exception.StatsException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a {@link StatsReport} as pretty-printed UTF-8 JSON.
 *
 * <p>{@link #write} goes through a temporary file in the target directory and a move, so a
 * reader never sees a half-written document. Timestamps are ISO-8601 strings.
 */
public final class StatsReportSerializer {

    private final ObjectWriter writer;

    public StatsReportSerializer() {
        this(defaultMapper());
    }

    public StatsReportSerializer(ObjectMapper mapper) {
        this.writer = mapper.copy()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .writerWithDefaultPrettyPrinter();
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    public String toJson(StatsReport report) {
        try {
            return writer.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new StatsException(StatsException.Stage.OUTPUT, "Could not serialize report: " + e.getMessage(), e);
        }
    }

    /**
     * @throws StatsException stage {@code OUTPUT} when the document cannot be written;
     *                        the previous file at {@code target}, if any, is left untouched
     */
    public void write(StatsReport report, Path target) {
        byte[] bytes = (toJson(report) + "\n").getBytes(StandardCharsets.UTF_8);
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new StatsException(StatsException.Stage.OUTPUT, "Could not write report to " + absolute, e);
        }
    }

    private static void deleteQuietly(Path tmp, IOException failure) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }
}
