package work.lcod.converter.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.converter.classify.ToolKind;
import work.lcod.converter.graph.ExecutionOrder;
import work.lcod.converter.graph.Workflow;
import work.lcod.converter.graph.WorkflowNode;

/**
 * Builds a {@link WorkflowAnalysis}. Tool types are listed by count, most frequent first, ties by tag.
 */
public final class WorkflowAnalyzer {
    private WorkflowAnalyzer() {}

    public static WorkflowAnalysis analyze(Workflow workflow, ExecutionOrder order) {
        var counts = new HashMap<String, Integer>();
        var inputs = new ArrayList<String>();
        var outputs = new ArrayList<String>();
        var transformations = new ArrayList<String>();
        for (WorkflowNode node : workflow.nodes()) {
            counts.merge(node.toolType().tag(), 1, Integer::sum);
            ToolKind kind = node.toolType().kind();
            if (kind == ToolKind.INPUT_DATA || kind == ToolKind.TEXT_INPUT) {
                inputs.add(node.id());
            } else if (kind == ToolKind.OUTPUT_DATA) {
                outputs.add(node.id());
            } else {
                transformations.add(node.id());
            }
        }

        var sorted = new LinkedHashMap<String, Integer>();
        counts.entrySet().stream()
            .sorted(Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue).reversed()
                .thenComparing(Map.Entry::getKey))
            .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));

        return new WorkflowAnalysis(
            workflow.nodes().size(),
            workflow.connections().size(),
            workflow.danglingConnections().size(),
            sorted,
            inputs,
            outputs,
            transformations,
            order.nodeIds(),
            order.unscheduled()
        );
    }
}
