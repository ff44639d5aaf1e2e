package work.lcod.converter.emit;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import work.lcod.converter.classify.ToolKind;
import work.lcod.converter.graph.WorkflowNode;

/**
 * Generators for multi-input tools. Inputs are taken in connection order; join keys are left for the user.
 */
public final class CombineGenerators {
    private static final Set<String> JOIN_TYPES = Set.of("inner", "left", "right", "outer");
    private static final String DEFAULT_JOIN_TYPE = "inner";

    private CombineGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(ToolKind.JOIN, CombineGenerators::join);
        registry.register(ToolKind.UNION, CombineGenerators::union);
        return registry;
    }

    static Fragment join(EmissionContext ctx, WorkflowNode node) {
        List<String> sources = ctx.allSources();
        if (sources.size() < 2) {
            return Fragment.comment("Join tool: Insufficient source data");
        }
        String variable = ctx.variable();
        String how = ctx.configString("JoinType")
            .map(type -> type.trim().toLowerCase(Locale.ROOT))
            .filter(JOIN_TYPES::contains)
            .orElse(DEFAULT_JOIN_TYPE);
        return Fragment.builder()
            .require(Fragment.PANDAS)
            .line("# Join two datasets")
            .line("# TODO: Specify join keys")
            .line(variable + " = pd.merge(")
            .line("    " + sources.get(0) + ",")
            .line("    " + sources.get(1) + ",")
            .line("    on='key_column',  # Specify join column(s)")
            .line("    how='" + how + "'")
            .line(")")
            .line("print('Join:', len(" + variable + "), 'rows')")
            .build();
    }

    static Fragment union(EmissionContext ctx, WorkflowNode node) {
        List<String> sources = ctx.allSources();
        if (sources.isEmpty()) {
            return Fragment.comment("Union tool: No source data");
        }
        String variable = ctx.variable();
        var fragment = Fragment.builder().line("# Union multiple datasets");
        if (sources.size() == 1) {
            fragment.line(variable + " = " + sources.get(0) + ".copy()");
        } else {
            fragment.require(Fragment.PANDAS)
                .line(variable + " = pd.concat([" + String.join(", ", sources) + "], ignore_index=True)");
        }
        return fragment
            .line("print('Union:', len(" + variable + "), 'rows')")
            .build();
    }
}
