package work.lcod.converter.graph;

import java.util.List;
import java.util.Objects;

/**
 * Linear emission order over a workflow. When a cycle blocks some nodes, {@link #isComplete()} is false and
 * {@link #unscheduled()} names them in node-list order.
 */
public record ExecutionOrder(List<String> nodeIds, List<String> unscheduled) {
    public ExecutionOrder {
        nodeIds = List.copyOf(Objects.requireNonNull(nodeIds, "nodeIds"));
        unscheduled = List.copyOf(Objects.requireNonNull(unscheduled, "unscheduled"));
    }

    public int size() {
        return nodeIds.size();
    }

    public int totalNodes() {
        return nodeIds.size() + unscheduled.size();
    }

    public boolean isComplete() {
        return unscheduled.isEmpty();
    }

    public int indexOf(String nodeId) {
        return nodeIds.indexOf(nodeId);
    }
}
