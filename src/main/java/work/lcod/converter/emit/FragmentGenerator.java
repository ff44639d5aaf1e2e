package work.lcod.converter.emit;

import work.lcod.converter.graph.WorkflowNode;

/**
 * Produces the statements for one node. Registered per tool kind in a {@link GeneratorRegistry}.
 */
@FunctionalInterface
public interface FragmentGenerator {
    Fragment generate(EmissionContext ctx, WorkflowNode node);
}
