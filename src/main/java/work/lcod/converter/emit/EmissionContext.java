package work.lcod.converter.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.converter.graph.Workflow;
import work.lcod.converter.graph.WorkflowNode;

/**
 * What a generator can see while emitting one node: its binding, its sources and its configuration.
 */
public final class EmissionContext {
    private final Workflow workflow;
    private final VariableBindings bindings;
    private final WorkflowNode node;

    public EmissionContext(Workflow workflow, VariableBindings bindings, WorkflowNode node) {
        this.workflow = Objects.requireNonNull(workflow, "workflow");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.node = Objects.requireNonNull(node, "node");
    }

    public Workflow workflow() {
        return workflow;
    }

    public WorkflowNode node() {
        return node;
    }

    public String variable() {
        return bindings.bind(node.id());
    }

    /**
     * Helper variable for this node, reserved so no node binding can reuse the name.
     */
    public String temporary(String role) {
        return bindings.temporary(node.id(), role);
    }

    /**
     * Binding of the source of the first connection that ends at this node.
     */
    public Optional<String> primarySource() {
        List<String> sources = workflow.upstream(node.id());
        if (sources.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(bindings.bind(sources.get(0)));
    }

    /**
     * Bindings of every connection that ends at this node, in connection order.
     */
    public List<String> allSources() {
        var variables = new ArrayList<String>();
        for (String source : workflow.upstream(node.id())) {
            variables.add(bindings.bind(source));
        }
        return variables;
    }

    public Map<String, Object> config() {
        return node.config();
    }

    public Optional<String> configString(String... aliases) {
        return ConfigLookup.string(node.config(), aliases);
    }
}
