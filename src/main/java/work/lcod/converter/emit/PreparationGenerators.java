package work.lcod.converter.emit;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.converter.classify.ToolKind;
import work.lcod.converter.graph.WorkflowNode;

/**
 * Generators for single-input row and column preparation tools.
 */
public final class PreparationGenerators {
    static final String DEFAULT_SAMPLE_SIZE = "100";
    static final String DEFAULT_FORMULA_FIELD = "new_column";

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private PreparationGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(ToolKind.SELECT, PreparationGenerators::select);
        registry.register(ToolKind.FILTER, PreparationGenerators::filter);
        registry.register(ToolKind.FORMULA, PreparationGenerators::formula);
        registry.register(ToolKind.SORT, PreparationGenerators::sort);
        registry.register(ToolKind.UNIQUE, PreparationGenerators::unique);
        registry.register(ToolKind.SAMPLE, PreparationGenerators::sample);
        registry.register(ToolKind.RECORD_ID, PreparationGenerators::recordId);
        return registry;
    }

    static Fragment select(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Select tool: No source data");
        }
        return Fragment.builder()
            .line("# Select and configure fields")
            .line(ctx.variable() + " = " + source.get() + ".copy()")
            .line("# TODO: Apply field selections and type conversions")
            .build();
    }

    static Fragment filter(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Filter tool: No source data");
        }
        String variable = ctx.variable();
        String src = source.get();
        var fragment = Fragment.builder().line("# Apply filter");
        Optional<String> expression = ctx.configString("Expression", "Filter");
        if (expression.isPresent()) {
            var translation = ExpressionTranslator.translate(expression.get(), src);
            fragment.requireAll(translation.imports())
                .line(variable + " = " + src + "[" + translation.text() + "]");
        } else {
            fragment.line("# TODO: Add filter condition")
                .line(variable + " = " + src + ".copy()");
        }
        return fragment
            .line("print('Filter:', len(" + variable + "), 'rows (from', len(" + src + "), ')')")
            .build();
    }

    static Fragment formula(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Formula tool: No source data");
        }
        String variable = ctx.variable();
        Map<String, Object> formulaField = ConfigLookup.section(ctx.config(), "FormulaFields", "FormulaField")
            .orElse(Map.of());
        Optional<String> expression = ctx.configString("Expression", "Formula")
            .or(() -> ConfigLookup.attribute(formulaField, "expression"));
        String field = ctx.configString("Field", "OutputField")
            .or(() -> ConfigLookup.attribute(formulaField, "field"))
            .orElse(DEFAULT_FORMULA_FIELD);
        String target = variable + "[" + PythonLiterals.quote(field) + "]";

        var fragment = Fragment.builder()
            .line("# Apply formula")
            .line(variable + " = " + source.get() + ".copy()");
        if (expression.isPresent()) {
            var translation = ExpressionTranslator.translate(expression.get(), variable);
            fragment.requireAll(translation.imports())
                .line(target + " = " + translation.text());
        } else {
            fragment.line("# TODO: Add formula expression")
                .line(target + " = None");
        }
        return fragment.build();
    }

    static Fragment sort(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Sort tool: No source data");
        }
        var fragment = Fragment.builder().line("# Sort data");
        Map<String, Object> sortField = ConfigLookup.section(ctx.config(), "SortInfo", "Field").orElse(Map.of());
        Optional<String> field = ConfigLookup.attribute(sortField, "field");
        if (field.isPresent()) {
            boolean descending = ConfigLookup.attribute(sortField, "order")
                .map(order -> order.toLowerCase(Locale.ROOT).startsWith("desc"))
                .orElse(false);
            return fragment
                .line(ctx.variable() + " = " + source.get() + ".sort_values(" + PythonLiterals.quote(field.get())
                    + ", ascending=" + (descending ? "False" : "True") + ")")
                .build();
        }
        return fragment
            .line("# TODO: Specify sort columns and order")
            .line(ctx.variable() + " = " + source.get() + ".sort_values('column_name', ascending=True)")
            .build();
    }

    static Fragment unique(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Unique tool: No source data");
        }
        String variable = ctx.variable();
        return Fragment.builder()
            .line("# Remove duplicates")
            .line(variable + " = " + source.get() + ".drop_duplicates()")
            .line("print('Unique:', len(" + variable + "), 'rows (from', len(" + source.get() + "), ')')")
            .build();
    }

    static Fragment sample(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Sample tool: No source data");
        }
        String size = ctx.configString("N")
            .map(String::trim)
            .filter(n -> DIGITS.matcher(n).matches())
            .orElse(DEFAULT_SAMPLE_SIZE);
        return Fragment.builder()
            .line("# Sample records")
            .line(ctx.variable() + " = " + source.get() + ".sample(n=" + size + ", random_state=42)")
            .build();
    }

    static Fragment recordId(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Record ID tool: No source data");
        }
        String variable = ctx.variable();
        return Fragment.builder()
            .line("# Add record ID")
            .line(variable + " = " + source.get() + ".copy()")
            .line(variable + "['RecordID'] = range(1, len(" + variable + ") + 1)")
            .build();
    }
}
