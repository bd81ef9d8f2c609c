package com.specforge.core.runstate;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.RunStateException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSON-Lines event log of a run ({@code logs.jsonl}).
 *
 * <p>Lines are only ever appended, never rewritten or reordered. A single writer per run is
 * assumed, so plain file-append semantics suffice.
 */
public class RunEventLog {

    public static final String LOG_FILE = "logs.jsonl";

    private static final TypeReference<LinkedHashMap<String, Object>> LINE_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RunEventLog() {
        this(new ObjectMapper());
    }

    public RunEventLog(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Appends one entry as a single JSON line.
     *
     * @param runDir run directory
     * @param entry entry to append
     * @throws RunStateException if the log cannot be written
     */
    public void appendLogLine(Path runDir, LogEntry entry) {
        try {
            String line = objectMapper.writeValueAsString(entry.toMap()) + "\n";
            Files.writeString(runDir.resolve(LOG_FILE), line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RunStateException(ErrorCode.RUN_STATE_IO, "Cannot append to " + LOG_FILE + " in " + runDir, e);
        }
    }

    /**
     * Reads every entry in append order.
     *
     * @param runDir run directory
     * @return entries, empty when the log does not exist
     * @throws RunStateException if the log cannot be read or a line is not valid JSON
     */
    public List<LogEntry> readLogLines(Path runDir) {
        Path file = runDir.resolve(LOG_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<LogEntry> entries = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    entries.add(LogEntry.fromMap(objectMapper.readValue(line, LINE_TYPE)));
                }
            }
        } catch (IOException e) {
            throw new RunStateException(ErrorCode.RUN_STATE_INVALID, "Cannot read " + file, e);
        }
        return entries;
    }
}
