package work.lcod.ftml.api;

import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.lcod.ftml.shared.Json;

/**
 * Outcome of an {@link FtmlRunner} execution (usable by the CLI and embedding apps).
 */
public record ExtractionReport(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter PRETTY = Json.mapper().writerWithDefaultPrettyPrinter();
    private static final ObjectWriter COMPACT = Json.mapper().writer();

    public ExtractionReport {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ExtractionReport success(Map<String, Object> metadata, Instant startedAt) {
        return new ExtractionReport(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static ExtractionReport failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new ExtractionReport(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        return toJson(PRETTY);
    }

    public String toCompactJson() {
        return toJson(COMPACT);
    }

    private String toJson(ObjectWriter writer) {
        try {
            return writer.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
