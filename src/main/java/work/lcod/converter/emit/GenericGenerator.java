package work.lcod.converter.emit;

import java.util.Optional;
import work.lcod.converter.graph.WorkflowNode;

/**
 * Fallback for tool types without a dedicated generator: passes the primary source through unchanged.
 */
final class GenericGenerator {
    private GenericGenerator() {}

    static Fragment generate(EmissionContext ctx, WorkflowNode node) {
        String tag = node.toolType().tag();
        var fragment = Fragment.builder()
            .line("# Tool type '" + PythonLiterals.commentText(tag) + "' - requires manual implementation")
            .needsManualCompletion();
        Optional<String> source = ctx.primarySource();
        if (source.isPresent()) {
            fragment.line(ctx.variable() + " = " + source.get() + ".copy()")
                .line("# TODO: Implement " + PythonLiterals.commentText(tag) + " logic");
        } else {
            fragment.line("# No source data available");
        }
        return fragment.build();
    }
}
