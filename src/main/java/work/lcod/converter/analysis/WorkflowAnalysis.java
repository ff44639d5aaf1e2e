package work.lcod.converter.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural summary of a workflow: sizes, tool-type distribution and the input/output/transformation split.
 */
public record WorkflowAnalysis(
    int totalNodes,
    int totalConnections,
    int danglingConnections,
    Map<String, Integer> toolTypes,
    List<String> inputs,
    List<String> outputs,
    List<String> transformations,
    List<String> executionOrder,
    List<String> unscheduled
) {
    public WorkflowAnalysis {
        toolTypes = Collections.unmodifiableMap(new LinkedHashMap<>(toolTypes));
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        transformations = List.copyOf(transformations);
        executionOrder = List.copyOf(executionOrder);
        unscheduled = List.copyOf(unscheduled);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("totalNodes", totalNodes);
        map.put("totalConnections", totalConnections);
        map.put("danglingConnections", danglingConnections);
        map.put("toolTypes", toolTypes);
        map.put("inputs", inputs);
        map.put("outputs", outputs);
        map.put("transformations", transformations);
        map.put("executionOrder", executionOrder);
        map.put("unscheduled", unscheduled);
        return map;
    }
}
