package work.lcod.converter.graph;

import java.util.Objects;

/**
 * Directed edge between two nodes. Either endpoint may name a node that is not part of the workflow.
 */
public record Connection(String sourceId, String destinationId, String portName) {
    public static final String DEFAULT_PORT = "Output";

    public Connection {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(destinationId, "destinationId");
        portName = portName == null || portName.isBlank() ? DEFAULT_PORT : portName;
    }

    public Connection(String sourceId, String destinationId) {
        this(sourceId, destinationId, DEFAULT_PORT);
    }
}
