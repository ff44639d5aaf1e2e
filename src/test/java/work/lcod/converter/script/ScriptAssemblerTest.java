package work.lcod.converter.script;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.converter.api.ConverterConfiguration;
import work.lcod.converter.classify.ToolKind;
import work.lcod.converter.classify.ToolType;
import work.lcod.converter.emit.CodeEmitter;
import work.lcod.converter.emit.Fragment;
import work.lcod.converter.emit.GeneratorRegistry;
import work.lcod.converter.graph.Connection;
import work.lcod.converter.graph.ExecutionOrder;
import work.lcod.converter.graph.ExecutionOrderResolver;
import work.lcod.converter.graph.Workflow;
import work.lcod.converter.graph.WorkflowMetadata;
import work.lcod.converter.graph.WorkflowNode;
import work.lcod.converter.support.ConverterTestSupport;

class ScriptAssemblerTest {
    private static final String BANNER = "    # " + "-".repeat(60);

    private static Workflow copyWorkflow(WorkflowMetadata metadata) {
        WorkflowNode input = new WorkflowNode(
            "1", ToolType.of(ToolKind.INPUT_DATA), ConverterTestSupport.ENGINE, Optional.empty(),
            Map.of("File", "a.csv"), Optional.of("Load"), Optional.empty()
        );
        WorkflowNode output = ConverterTestSupport.toolNode("2", ToolKind.OUTPUT_DATA, Map.of("File", "b.xlsx"));
        return new Workflow(List.of(input, output), List.of(new Connection("1", "2")), metadata);
    }

    private static String assemble(Workflow workflow, String indent, Optional<Instant> generatedAt) {
        return assemble(workflow, GeneratorRegistry.standard(), indent, generatedAt);
    }

    private static String assemble(
        Workflow workflow,
        GeneratorRegistry registry,
        String indent,
        Optional<Instant> generatedAt
    ) {
        ExecutionOrder order = ExecutionOrderResolver.resolve(workflow);
        var emission = new CodeEmitter(registry, "df").emit(workflow, order);
        return new ScriptAssembler(
            ConverterConfiguration.DEFAULT_TITLE, indent, ConverterConfiguration.DEFAULT_IMPORTS, generatedAt
        ).assemble(workflow.metadata(), order, emission);
    }

    @Test
    void assemblesCompleteScript() {
        String script = assemble(
            copyWorkflow(new WorkflowMetadata("2020.1", "Ann", null, null)),
            "    ",
            Optional.empty()
        );

        String expected = String.join("\n",
            "\"\"\"",
            "Auto-generated Python script from Alteryx workflow",
            "Workflow version: 2020.1",
            "Author: Ann",
            "\"\"\"",
            "",
            "import numpy as np",
            "import openpyxl",
            "import pandas as pd",
            "",
            "",
            "def main():",
            "    \"\"\"Main workflow execution function\"\"\"",
            "",
            BANNER,
            "    # Load (Type: input_data, ID: 1)",
            BANNER,
            "    # Read input file: a.csv",
            "    df_1 = pd.read_csv('a.csv')",
            "    print('Loaded', len(df_1), 'rows from', 'a.csv')",
            "",
            BANNER,
            "    # Tool 2 (Type: output_data, ID: 2)",
            BANNER,
            "    # Write output file: b.xlsx",
            "    df_1.to_excel('b.xlsx', index=False)",
            "    print('Wrote', len(df_1), 'rows to', 'b.xlsx')",
            "",
            "    return True",
            "",
            "",
            "if __name__ == '__main__':",
            "    main()",
            ""
        );
        assertEquals(expected, script);
    }

    @Test
    void addsTimestampOnlyWhenConfigured() {
        Workflow workflow = copyWorkflow(WorkflowMetadata.empty());
        String stamped = assemble(workflow, "    ", Optional.of(Instant.parse("2024-01-02T03:04:05Z")));

        assertTrue(stamped.contains("\nGenerated: 2024-01-02 03:04:05 UTC\n"));
        assertTrue(stamped.contains("\nWorkflow version: Unknown\n"));
        assertTrue(!assemble(workflow, "    ", Optional.empty()).contains("Generated:"));
    }

    @Test
    void usesConfiguredIndent() {
        String script = assemble(copyWorkflow(WorkflowMetadata.empty()), "\t", Optional.empty());
        assertTrue(script.contains("\n\tdf_1 = pd.read_csv('a.csv')\n"));
        assertTrue(script.endsWith("if __name__ == '__main__':\n\tmain()\n"));
    }

    @Test
    void indentsEveryPhysicalLineOfAStatement() {
        GeneratorRegistry registry = GeneratorRegistry.standard().register(
            ToolKind.OUTPUT_DATA,
            (ctx, node) -> Fragment.builder()
                .line("total = (1\n+ 2)")
                .line("label = 'a'\r\nflag = True\rdone = 1")
                .build()
        );
        String script = assemble(copyWorkflow(WorkflowMetadata.empty()), registry, "    ", Optional.empty());

        assertTrue(script.contains("\n    total = (1\n    + 2)\n"), script);
        assertTrue(script.contains("\n    label = 'a'\n    flag = True\n    done = 1\n"), script);
        String body = script.substring(script.indexOf("def main():\n") + "def main():\n".length(), script.indexOf("if __name__"));
        for (String line : body.split("\n")) {
            assertTrue(line.isEmpty() || line.startsWith("    "), () -> "line escapes main(): [" + line + "]");
        }
    }

    @Test
    void escapesDocstringTerminators() {
        String script = assemble(
            copyWorkflow(new WorkflowMetadata("1", null, "Say \"\"\"hi\"\"\"", null)),
            "    ",
            Optional.empty()
        );
        assertTrue(script.contains("Description: Say \\\"\\\"\\\"hi\\\"\\\"\\\"\n"));
    }

    @Test
    void notesNodesLeftOutByCycle() {
        Workflow workflow = ConverterTestSupport.parse(ConverterTestSupport.fixture("cycle.yxmd"));
        String script = assemble(workflow, "    ", Optional.empty());

        assertTrue(script.contains("    # WARNING: not converted, part of a dependency cycle: 2, 3\n"));
        assertTrue(script.contains("(Type: input_data, ID: 1)"));
        assertTrue(!script.contains("ID: 2)"));
    }
}
