package work.lcod.converter.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Kahn's algorithm over the workflow graph.
 *
 * <p>Only connections whose endpoints are both known nodes take part. The queue starts with zero in-degree nodes in
 * node-list order; afterwards a node is enqueued at the moment its in-degree drops to zero. Nodes caught in a cycle
 * are left out and reported through {@link ExecutionOrder#unscheduled()}.
 */
public final class ExecutionOrderResolver {
    private ExecutionOrderResolver() {}

    public static ExecutionOrder resolve(Workflow workflow) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (WorkflowNode node : workflow.nodes()) {
            adjacency.put(node.id(), new ArrayList<>());
            inDegree.put(node.id(), 0);
        }
        for (Connection connection : workflow.connections()) {
            String source = connection.sourceId();
            String destination = connection.destinationId();
            if (adjacency.containsKey(source) && adjacency.containsKey(destination)) {
                adjacency.get(source).add(destination);
                inDegree.merge(destination, 1, Integer::sum);
            }
        }

        Queue<String> queue = new ArrayDeque<>();
        for (String id : adjacency.keySet()) {
            if (inDegree.get(id) == 0) {
                queue.offer(id);
            }
        }

        var ordered = new ArrayList<String>(adjacency.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            ordered.add(current);
            for (String neighbour : adjacency.get(current)) {
                int remaining = inDegree.merge(neighbour, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(neighbour);
                }
            }
        }

        var unscheduled = new ArrayList<String>();
        if (ordered.size() < adjacency.size()) {
            for (String id : adjacency.keySet()) {
                if (inDegree.get(id) > 0) {
                    unscheduled.add(id);
                }
            }
        }
        return new ExecutionOrder(ordered, unscheduled);
    }
}
