package work.lcod.converter.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.converter.classify.ToolKind;
import work.lcod.converter.graph.Connection;
import work.lcod.converter.graph.Workflow;
import work.lcod.converter.graph.WorkflowNode;
import work.lcod.converter.support.ConverterTestSupport;

/**
 * Runs one generator against a target node fed by plain upstream nodes.
 */
final class GeneratorHarness {
    static final String TARGET = "9";

    private GeneratorHarness() {}

    static Fragment generate(ToolKind kind, Map<String, Object> config, String... sourceIds) {
        var nodes = new ArrayList<WorkflowNode>();
        var connections = new ArrayList<Connection>();
        for (String source : sourceIds) {
            nodes.add(ConverterTestSupport.plainNode(source));
            connections.add(new Connection(source, TARGET));
        }
        nodes.add(ConverterTestSupport.toolNode(TARGET, kind, config));
        return generate(new Workflow(nodes, connections, null), TARGET);
    }

    static Fragment generate(Workflow workflow, String id) {
        WorkflowNode node = workflow.node(id).orElseThrow();
        var ctx = new EmissionContext(workflow, new VariableBindings("df"), node);
        return GeneratorRegistry.standard().resolve(node.toolType().kind()).generate(ctx, node);
    }

    static List<String> lines(ToolKind kind, Map<String, Object> config, String... sourceIds) {
        return generate(kind, config, sourceIds).lines();
    }
}
