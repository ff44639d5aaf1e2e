package work.lcod.converter.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Best-effort document metadata. Only {@code version} has a default; the rest may be null.
 */
public record WorkflowMetadata(String version, String author, String description, String creationDate) {
    public static final String UNKNOWN_VERSION = "Unknown";

    public WorkflowMetadata {
        version = version == null || version.isBlank() ? UNKNOWN_VERSION : version;
    }

    public static WorkflowMetadata empty() {
        return new WorkflowMetadata(null, null, null, null);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("version", version);
        map.put("author", author);
        map.put("description", description);
        map.put("creationDate", creationDate);
        return map;
    }
}
