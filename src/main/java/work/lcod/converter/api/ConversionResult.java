package work.lcod.converter.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link WorkflowConverter#convert(byte[], String)}, usable by the CLI and embedding apps.
 */
public record ConversionResult(
    Status status,
    Optional<String> script,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectWriter YAML_WRITER = new ObjectMapper(new YAMLFactory()).writer();

    public ConversionResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(script, "script");
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ConversionResult success(String script, Map<String, Object> metadata, Instant startedAt) {
        return new ConversionResult(Status.SUCCESS, Optional.of(script), metadata, startedAt, Instant.now());
    }

    public static ConversionResult partial(String script, Map<String, Object> metadata, Instant startedAt) {
        return new ConversionResult(Status.PARTIAL, Optional.of(script), metadata, startedAt, Instant.now());
    }

    public static ConversionResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new ConversionResult(Status.FAILURE, Optional.empty(), meta, startedAt, Instant.now());
    }

    public ConversionResult withMetadata(String key, Object value) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put(key, value);
        return new ConversionResult(status, script, meta, startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return JSON_WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public String toYaml() {
        try {
            return YAML_WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "status: error\nmessage: \"" + ex.getMessage() + "\"\n";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        PARTIAL(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
