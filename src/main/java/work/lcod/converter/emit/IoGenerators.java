package work.lcod.converter.emit;

import java.util.Locale;
import java.util.Optional;
import work.lcod.converter.classify.ToolKind;
import work.lcod.converter.graph.WorkflowNode;

/**
 * Generators for reading, writing and browsing data.
 */
public final class IoGenerators {
    static final String DEFAULT_INPUT = "input.csv";
    static final String DEFAULT_OUTPUT = "output.csv";

    private IoGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(ToolKind.INPUT_DATA, IoGenerators::inputData);
        registry.register(ToolKind.OUTPUT_DATA, IoGenerators::outputData);
        registry.register(ToolKind.BROWSE, IoGenerators::browse);
        return registry;
    }

    static Fragment inputData(EmissionContext ctx, WorkflowNode node) {
        String path = ctx.configString("File", "FileName").orElse(DEFAULT_INPUT);
        String variable = ctx.variable();
        String literal = PythonLiterals.quote(path);
        String lower = path.toLowerCase(Locale.ROOT);

        var fragment = Fragment.builder()
            .require(Fragment.PANDAS)
            .line("# Read input file: " + PythonLiterals.commentText(path));
        if (lower.endsWith(".csv")) {
            fragment.line(variable + " = pd.read_csv(" + literal + ")");
        } else if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
            fragment.require(Fragment.OPENPYXL)
                .line(variable + " = pd.read_excel(" + literal + ")");
        } else if (lower.endsWith(".txt")) {
            String delimiter = ctx.configString("Delimeter", "Delimiter").orElse("\t");
            fragment.line(variable + " = pd.read_csv(" + literal + ", delimiter=" + PythonLiterals.quote(delimiter) + ")");
        } else {
            fragment.line(variable + " = pd.read_csv(" + literal + ")  # Adjust read method as needed");
        }
        return fragment
            .line("print('Loaded', len(" + variable + "), 'rows from', " + literal + ")")
            .build();
    }

    static Fragment outputData(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Output tool " + node.id() + ": No source data");
        }
        String path = ctx.configString("File", "FileName_Out", "FileName").orElse(DEFAULT_OUTPUT);
        String literal = PythonLiterals.quote(path);
        String lower = path.toLowerCase(Locale.ROOT);

        var fragment = Fragment.builder()
            .line("# Write output file: " + PythonLiterals.commentText(path));
        if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
            fragment.require(Fragment.OPENPYXL)
                .line(source.get() + ".to_excel(" + literal + ", index=False)");
        } else {
            fragment.line(source.get() + ".to_csv(" + literal + ", index=False)");
        }
        return fragment
            .line("print('Wrote', len(" + source.get() + "), 'rows to', " + literal + ")")
            .build();
    }

    static Fragment browse(EmissionContext ctx, WorkflowNode node) {
        Optional<String> source = ctx.primarySource();
        if (source.isEmpty()) {
            return Fragment.comment("Browse tool: No source data");
        }
        return Fragment.builder()
            .line("# Display data (Browse equivalent)")
            .line("print('Browse - First 10 rows:')")
            .line("print(" + source.get() + ".head(10))")
            .line("print('Shape:', " + source.get() + ".shape)")
            .build();
    }
}
