package work.lcod.converter.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable workflow graph: nodes in document order, connections in document order, metadata.
 */
public final class Workflow {
    private final List<WorkflowNode> nodes;
    private final List<Connection> connections;
    private final WorkflowMetadata metadata;
    private final Map<String, WorkflowNode> nodesById;

    public Workflow(List<WorkflowNode> nodes, List<Connection> connections, WorkflowMetadata metadata) {
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        this.connections = List.copyOf(Objects.requireNonNull(connections, "connections"));
        this.metadata = metadata == null ? WorkflowMetadata.empty() : metadata;
        var index = new LinkedHashMap<String, WorkflowNode>();
        for (WorkflowNode node : this.nodes) {
            if (index.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
        this.nodesById = Collections.unmodifiableMap(index);
    }

    public List<WorkflowNode> nodes() {
        return nodes;
    }

    public List<Connection> connections() {
        return connections;
    }

    public WorkflowMetadata metadata() {
        return metadata;
    }

    public Optional<WorkflowNode> node(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public boolean contains(String id) {
        return nodesById.containsKey(id);
    }

    /**
     * Sources of every connection ending at {@code id}, in connection order. Unknown sources are included.
     */
    public List<String> upstream(String id) {
        var sources = new ArrayList<String>();
        for (Connection connection : connections) {
            if (connection.destinationId().equals(id)) {
                sources.add(connection.sourceId());
            }
        }
        return sources;
    }

    /**
     * Destinations of every connection starting at {@code id}, in connection order.
     */
    public List<String> downstream(String id) {
        var destinations = new ArrayList<String>();
        for (Connection connection : connections) {
            if (connection.sourceId().equals(id)) {
                destinations.add(connection.destinationId());
            }
        }
        return destinations;
    }

    public List<Connection> danglingConnections() {
        var dangling = new ArrayList<Connection>();
        for (Connection connection : connections) {
            if (!contains(connection.sourceId()) || !contains(connection.destinationId())) {
                dangling.add(connection);
            }
        }
        return dangling;
    }
}
