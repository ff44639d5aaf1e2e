package work.lcod.converter.script;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;
import work.lcod.converter.emit.CodeEmitter.Emission;
import work.lcod.converter.emit.CodeEmitter.EmittedFragment;
import work.lcod.converter.emit.PythonLiterals;
import work.lcod.converter.graph.ExecutionOrder;
import work.lcod.converter.graph.WorkflowMetadata;

/**
 * Joins emitted fragments into one Python script: docstring header, sorted imports, a {@code main()} wrapper with
 * one banner-tagged block per node, and the {@code __main__} guard.
 *
 * <p>Every physical line of a fragment statement is indented under {@code main()}.
 * The output only depends on its inputs. A generation timestamp is written only when one is supplied.
 */
public final class ScriptAssembler {
    private static final String BANNER = "# " + "-".repeat(60);
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
        .withZone(ZoneOffset.UTC);

    private final String title;
    private final String indent;
    private final List<String> baseImports;
    private final Optional<Instant> generatedAt;

    public ScriptAssembler(String title, String indent, List<String> baseImports, Optional<Instant> generatedAt) {
        this.title = Objects.requireNonNull(title, "title");
        this.indent = Objects.requireNonNull(indent, "indent");
        this.baseImports = List.copyOf(baseImports);
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
    }

    public String assemble(WorkflowMetadata metadata, ExecutionOrder order, Emission emission) {
        var script = new StringBuilder();
        appendHeader(script, metadata);
        script.append('\n');
        appendImports(script, emission);
        script.append("\n\n");

        script.append("def main():\n");
        script.append(indent).append("\"\"\"Main workflow execution function\"\"\"\n");
        script.append('\n');
        for (EmittedFragment emitted : emission.fragments()) {
            var node = emitted.node();
            line(script, BANNER);
            line(script, "# " + PythonLiterals.commentText(node.label())
                + " (Type: " + PythonLiterals.commentText(node.toolType().tag())
                + ", ID: " + PythonLiterals.commentText(node.id()) + ")");
            line(script, BANNER);
            for (String statement : emitted.fragment().lines()) {
                line(script, statement);
            }
            script.append('\n');
        }
        if (!order.isComplete()) {
            line(script, "# WARNING: not converted, part of a dependency cycle: "
                + PythonLiterals.commentText(String.join(", ", order.unscheduled())));
            script.append('\n');
        }
        line(script, "return True");
        script.append("\n\n");
        script.append("if __name__ == '__main__':\n");
        script.append(indent).append("main()\n");
        return script.toString();
    }

    private void appendHeader(StringBuilder script, WorkflowMetadata metadata) {
        script.append("\"\"\"\n");
        script.append(docText(title)).append('\n');
        script.append("Workflow version: ").append(docText(metadata.version())).append('\n');
        if (metadata.author() != null) {
            script.append("Author: ").append(docText(metadata.author())).append('\n');
        }
        if (metadata.description() != null) {
            script.append("Description: ").append(docText(metadata.description())).append('\n');
        }
        generatedAt.ifPresent(instant -> script.append("Generated: ").append(TIMESTAMP.format(instant)).append(" UTC\n"));
        script.append("\"\"\"\n");
    }

    private void appendImports(StringBuilder script, Emission emission) {
        var imports = new TreeSet<String>(baseImports);
        for (EmittedFragment emitted : emission.fragments()) {
            imports.addAll(emitted.fragment().imports());
        }
        for (String spec : imports) {
            script.append("import ").append(spec).append('\n');
        }
    }

    private void line(StringBuilder script, String text) {
        for (String physical : LINE_BREAK.split(text, -1)) {
            script.append(indent).append(physical).append('\n');
        }
    }

    private static String docText(String value) {
        return value.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"");
    }
}
