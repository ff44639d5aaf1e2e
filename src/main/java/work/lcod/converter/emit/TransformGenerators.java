package work.lcod.converter.emit;

import java.util.Optional;
import work.lcod.converter.classify.ToolKind;
import work.lcod.converter.graph.WorkflowNode;

/**
 * Generators for reshaping tools: summarize, cross tab, transpose, text to columns.
 */
public final class TransformGenerators {
    private TransformGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(ToolKind.SUMMARIZE, TransformGenerators::summarize);
        registry.register(ToolKind.CROSS_TAB, TransformGenerators::crossTab);
        registry.register(ToolKind.TRANSPOSE, TransformGenerators::transpose);
        registry.register(ToolKind.TEXT_TO_COLUMNS, TransformGenerators::textToColumns);
        return registry;
    }

    static Fragment summarize(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Summarize tool: No source data");
        }
        return Fragment.builder()
            .line("# Summarize/Group by")
            .line("# TODO: Specify group by columns and aggregations")
            .line(ctx.variable() + " = " + source.get() + ".groupby('group_column').agg({")
            .line("    'value_column': 'sum',")
            .line("    'count_column': 'count'")
            .line("}).reset_index()")
            .build();
    }

    static Fragment crossTab(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Cross Tab tool: No source data");
        }
        return Fragment.builder()
            .require(Fragment.PANDAS)
            .line("# Create cross-tabulation")
            .line("# TODO: Specify row, column, and value fields")
            .line(ctx.variable() + " = pd.pivot_table(")
            .line("    " + source.get() + ",")
            .line("    values='value_column',")
            .line("    index='row_column',")
            .line("    columns='column_column',")
            .line("    aggfunc='sum'")
            .line(").reset_index()")
            .build();
    }

    static Fragment transpose(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Transpose tool: No source data");
        }
        return Fragment.builder()
            .line("# Transpose data")
            .line(ctx.variable() + " = " + source.get() + ".transpose()")
            .build();
    }

    static Fragment textToColumns(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Text to Columns tool: No source data");
        }
        String variable = ctx.variable();
        String delimiter = ctx.configString("Delimiter", "Delimeter").orElse(",");
        String parts = ctx.temporary("split");
        return Fragment.builder()
            .require(Fragment.PANDAS)
            .line("# Split text column")
            .line(variable + " = " + source.get() + ".copy()")
            .line("# TODO: Specify column to split")
            .line(parts + " = " + variable + "['text_column'].str.split(" + PythonLiterals.quote(delimiter) + ", expand=True)")
            .line(variable + " = pd.concat([" + variable + ", " + parts + "], axis=1)")
            .build();
    }
}
