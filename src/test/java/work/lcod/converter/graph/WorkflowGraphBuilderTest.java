package work.lcod.converter.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.converter.classify.ToolKind;
import work.lcod.converter.document.WorkflowFormatException;
import work.lcod.converter.support.ConverterTestSupport;

class WorkflowGraphBuilderTest {
    @Test
    void buildsNodesInDocumentOrder() {
        Workflow workflow = ConverterTestSupport.parse(ConverterTestSupport.fixture("sales_filter.yxmd"));

        assertEquals(List.of("1", "2", "3"), workflow.nodes().stream().map(WorkflowNode::id).toList());
        WorkflowNode input = workflow.node("1").orElseThrow();
        assertEquals(ToolKind.INPUT_DATA, input.toolType().kind());
        assertEquals("AlteryxBasePluginsEngine.dll", input.pluginRef());
        assertEquals(Optional.of("Load sales"), input.annotation());
        assertEquals(Optional.of(new GuiPosition(54, 90)), input.guiPosition());
        assertEquals("a.csv", input.config().get("File"));

        WorkflowNode filter = workflow.node("2").orElseThrow();
        assertEquals(ToolKind.FILTER, filter.toolType().kind());
        assertEquals("[Amount] > 100", filter.config().get("Expression"));
        assertEquals(ToolKind.OUTPUT_DATA, workflow.node("3").orElseThrow().toolType().kind());
    }

    @Test
    void readsConnectionPorts() {
        Workflow workflow = ConverterTestSupport.parse(ConverterTestSupport.fixture("customer_join.yxmd"));

        assertEquals(
            List.of(
                new Connection("1", "3", "Output"),
                new Connection("2", "3", "Output"),
                new Connection("3", "4", "Join")
            ),
            workflow.connections()
        );
    }

    @Test
    void readsMetadata() {
        Workflow workflow = ConverterTestSupport.parse(ConverterTestSupport.fixture("sales_filter.yxmd"));

        WorkflowMetadata metadata = workflow.metadata();
        assertEquals("2020.1", metadata.version());
        assertEquals("Data Team", metadata.author());
        assertEquals("Keeps orders above 100", metadata.description());
        assertNull(metadata.creationDate());
    }

    @Test
    void defaultsMissingVersion() {
        Workflow workflow = ConverterTestSupport.parse("<AlteryxDocument><Nodes/></AlteryxDocument>".getBytes());
        assertEquals(WorkflowMetadata.UNKNOWN_VERSION, workflow.metadata().version());
        assertTrue(workflow.nodes().isEmpty());
        assertTrue(workflow.connections().isEmpty());
    }

    @Test
    void prefersVersionAttribute() {
        Workflow workflow = ConverterTestSupport.parse(
            "<AlteryxDocument version=\"3\" yxmdVer=\"2020.1\"/>".getBytes()
        );
        assertEquals("3", workflow.metadata().version());
    }

    @Test
    void skipsNodesWithoutIdAndKeepsFirstDuplicate() {
        byte[] raw = ConverterTestSupport.workflowXml(
            List.of(
                "<Node><Properties><Configuration><File>x.csv</File></Configuration></Properties></Node>",
                ConverterTestSupport.node("1", "<File>first.csv</File>"),
                ConverterTestSupport.node("1", "<File>second.csv</File>")
            ),
            List.of()
        );
        Workflow workflow = ConverterTestSupport.parse(raw);

        assertEquals(1, workflow.nodes().size());
        assertEquals("first.csv", workflow.node("1").orElseThrow().config().get("File"));
    }

    @Test
    void readsTextEndpointsAndSkipsIncompleteConnections() {
        Workflow workflow = ConverterTestSupport.parse(ConverterTestSupport.fixture("cycle.yxmd"));
        assertEquals(new Connection("1", "2"), workflow.connections().get(0));

        byte[] raw = ConverterTestSupport.workflowXml(
            List.of(ConverterTestSupport.node("1", "<File>a.csv</File>")),
            List.of("<Connection><Origin ToolID=\"1\"/></Connection>", "<Connection><Destination>1</Destination></Connection>")
        );
        assertTrue(ConverterTestSupport.parse(raw).connections().isEmpty());
    }

    @Test
    void fallsBackToDefaultAnnotationText() {
        byte[] raw = ConverterTestSupport.workflowXml(
            List.of("<Node ToolID=\"1\"><Properties><Configuration/>"
                + "<Annotation><Name></Name><DefaultAnnotationText>Sort by date</DefaultAnnotationText></Annotation>"
                + "</Properties></Node>"),
            List.of()
        );
        WorkflowNode node = ConverterTestSupport.parse(raw).node("1").orElseThrow();
        assertEquals(Optional.of("Sort by date"), node.annotation());
        assertEquals("Sort by date", node.label());
    }

    @Test
    void containerDoesNotBorrowChildSettings() {
        byte[] raw = ConverterTestSupport.workflowXml(
            List.of("<Node ToolID=\"10\">"
                + "<Properties><Configuration><Caption>Container</Caption></Configuration></Properties>"
                + "<ChildNodes>" + ConverterTestSupport.node("11", "<File>a.csv</File>") + "</ChildNodes>"
                + "</Node>"),
            List.of()
        );
        Workflow workflow = ConverterTestSupport.parse(raw);

        assertEquals(List.of("10", "11"), workflow.nodes().stream().map(WorkflowNode::id).toList());
        WorkflowNode container = workflow.node("10").orElseThrow();
        assertEquals("", container.pluginRef());
        assertEquals(Map.of("Caption", "Container"), container.config());
        assertEquals(ToolKind.UNKNOWN, container.toolType().kind());
        assertEquals(ToolKind.INPUT_DATA, workflow.node("11").orElseThrow().toolType().kind());
    }

    @Test
    void classifiesMacroNodes() {
        byte[] raw = ConverterTestSupport.workflowXml(
            List.of("<Node ToolID=\"5\"><EngineSettings Macro=\"Cleanse.yxmc\" />"
                + "<Properties><Configuration><Value name=\"x\">1</Value></Configuration></Properties></Node>"),
            List.of()
        );
        WorkflowNode node = ConverterTestSupport.parse(raw).node("5").orElseThrow();
        assertEquals("macro:Cleanse.yxmc", node.toolType().tag());
        assertEquals(Optional.of("Cleanse.yxmc"), node.macroRef());
    }

    @Test
    void deepConfigurationFailsTheBuild() {
        var document = ConverterTestSupport.document(new String(ConverterTestSupport.workflowXml(
            List.of(ConverterTestSupport.node("1", "<A><B><C>x</C></B></A>")),
            List.of()
        )));
        assertThrows(WorkflowFormatException.class, () -> WorkflowGraphBuilder.build(document, 2));
    }
}
