package work.lcod.converter.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.converter.graph.ExecutionOrder;
import work.lcod.converter.graph.Workflow;
import work.lcod.converter.graph.WorkflowNode;

/**
 * Walks the execution order and asks the registry for one fragment per node.
 */
public final class CodeEmitter {
    private static final Logger log = LoggerFactory.getLogger(CodeEmitter.class);

    private final GeneratorRegistry registry;
    private final String variablePrefix;

    public CodeEmitter(GeneratorRegistry registry, String variablePrefix) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.variablePrefix = Objects.requireNonNull(variablePrefix, "variablePrefix");
    }

    /**
     * Emits fragments with a fresh binding table; nothing is shared between calls.
     */
    public Emission emit(Workflow workflow, ExecutionOrder order) {
        var bindings = new VariableBindings(variablePrefix);
        var emitted = new ArrayList<EmittedFragment>(order.size());
        for (String nodeId : order.nodeIds()) {
            Optional<WorkflowNode> node = workflow.node(nodeId);
            if (node.isEmpty()) {
                continue;
            }
            String variable = bindings.bind(nodeId);
            var ctx = new EmissionContext(workflow, bindings, node.get());
            FragmentGenerator generator = registry.resolve(node.get().toolType().kind());
            Fragment fragment = generator.generate(ctx, node.get());
            if (fragment.needsManualCompletion()) {
                log.debug("Node {} ({}) needs manual completion", nodeId, node.get().toolType().tag());
            }
            emitted.add(new EmittedFragment(node.get(), variable, fragment));
        }
        return new Emission(emitted, bindings.snapshot());
    }

    /**
     * A node together with its binding and fragment.
     */
    public record EmittedFragment(WorkflowNode node, String variable, Fragment fragment) {}

    /**
     * Ordered fragments plus the binding table they were emitted against.
     */
    public record Emission(List<EmittedFragment> fragments, Map<String, String> bindings) {
        public Emission {
            fragments = List.copyOf(fragments);
        }

        public long manualCompletionCount() {
            return fragments.stream().filter(f -> f.fragment().needsManualCompletion()).count();
        }
    }
}
