package com.specforge.core.runstate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One line of a run's event log.
 *
 * <p>Serialized flat: {@code {"timestamp": ..., "level": ..., "message": ..., <fields>}}.
 *
 * @param timestamp ISO-8601 time
 * @param level {@code info}, {@code warn} or {@code error}
 * @param message event message
 * @param fields additional structured fields
 */
public record LogEntry(
    String timestamp,
    String level,
    String message,
    Map<String, Object> fields
) {
    public static final String TIMESTAMP = "timestamp";
    public static final String LEVEL = "level";
    public static final String MESSAGE = "message";

    /**
     * Compact constructor with validation.
     */
    public LogEntry {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(message, "message must not be null");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static LogEntry info(String timestamp, String message, Map<String, Object> fields) {
        return new LogEntry(timestamp, "info", message, fields);
    }

    public static LogEntry warn(String timestamp, String message, Map<String, Object> fields) {
        return new LogEntry(timestamp, "warn", message, fields);
    }

    public static LogEntry error(String timestamp, String message, Map<String, Object> fields) {
        return new LogEntry(timestamp, "error", message, fields);
    }

    /**
     * Returns the flat representation written to the log.
     *
     * @return ordered map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put(TIMESTAMP, timestamp);
        flat.put(LEVEL, level);
        flat.put(MESSAGE, message);
        fields.forEach(flat::putIfAbsent);
        return flat;
    }

    /**
     * Rebuilds an entry from its flat representation.
     *
     * @param flat decoded log line
     * @return entry
     */
    public static LogEntry fromMap(Map<String, Object> flat) {
        Map<String, Object> fields = new LinkedHashMap<>(flat);
        Object timestamp = fields.remove(TIMESTAMP);
        Object level = fields.remove(LEVEL);
        Object message = fields.remove(MESSAGE);
        return new LogEntry(
            timestamp == null ? null : timestamp.toString(),
            level == null ? "info" : level.toString(),
            message == null ? "" : message.toString(),
            fields);
    }

    /**
     * Returns one structured field.
     *
     * @param name field name
     * @return value, or null
     */
    public Object field(String name) {
        return fields.get(name);
    }
}
