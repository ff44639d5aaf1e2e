package work.lcod.converter.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import work.lcod.converter.classify.ToolType;
import work.lcod.converter.classify.ToolTypeClassifier;

/**
 * Walks a parsed workflow document and produces the {@link Workflow} graph.
 *
 * <p>Nodes without a {@code ToolID} and connections without both endpoints are decorative as far as the graph is
 * concerned and are skipped without complaint.
 */
public final class WorkflowGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(WorkflowGraphBuilder.class);

    private static final String NODE = "Node";
    private static final String CONNECTION = "Connection";

    private WorkflowGraphBuilder() {}

    public static Workflow build(Document document, int maxConfigDepth) {
        Element root = document.getDocumentElement();
        var metadata = extractMetadata(root);
        var nodes = extractNodes(root, maxConfigDepth);
        var connections = extractConnections(root);
        log.debug("Built workflow with {} nodes and {} connections", nodes.size(), connections.size());
        return new Workflow(nodes, connections, metadata);
    }

    public static Workflow build(Document document) {
        return build(document, ConfigExtractor.DEFAULT_MAX_DEPTH);
    }

    static WorkflowMetadata extractMetadata(Element root) {
        String version = XmlElements.attribute(root, "version")
            .or(() -> XmlElements.attribute(root, "yxmdVer"))
            .orElse(null);
        Optional<Element> metaInfo = XmlElements.child(root, "Properties")
            .flatMap(properties -> XmlElements.first(properties, "MetaInfo"));
        if (metaInfo.isEmpty()) {
            return new WorkflowMetadata(version, null, null, null);
        }
        return new WorkflowMetadata(
            version,
            childText(metaInfo.get(), "Author"),
            childText(metaInfo.get(), "Description"),
            childText(metaInfo.get(), "CreationDate")
        );
    }

    private static String childText(Element parent, String tag) {
        return XmlElements.child(parent, tag)
            .map(XmlElements::text)
            .filter(text -> !text.isEmpty())
            .orElse(null);
    }

    static List<WorkflowNode> extractNodes(Element root, int maxConfigDepth) {
        var nodes = new ArrayList<WorkflowNode>();
        var seen = new LinkedHashSet<String>();
        for (Element element : XmlElements.descendants(root, NODE)) {
            Optional<String> id = XmlElements.attribute(element, "ToolID");
            if (id.isEmpty()) {
                continue;
            }
            if (!seen.add(id.get())) {
                log.debug("Skipping node with duplicate ToolID {}", id.get());
                continue;
            }
            nodes.add(buildNode(id.get(), element, maxConfigDepth));
        }
        return nodes;
    }

    private static WorkflowNode buildNode(String id, Element element, int maxConfigDepth) {
        Optional<Element> engine = XmlElements.first(element, "EngineSettings", NODE);
        String plugin = engine.flatMap(e -> XmlElements.attribute(e, "EngineDll")).orElse("");
        Optional<String> macro = engine.flatMap(e -> XmlElements.attribute(e, "Macro"));

        Optional<Element> properties = XmlElements.first(element, "Properties", NODE);
        Map<String, Object> config = properties
            .flatMap(p -> XmlElements.first(p, "Configuration", NODE))
            .map(configuration -> ConfigExtractor.extract(configuration, maxConfigDepth))
            .orElse(Map.of());

        ToolType toolType = ToolTypeClassifier.classify(plugin, macro.orElse(null), config);
        return new WorkflowNode(
            id,
            toolType,
            plugin,
            macro,
            config,
            properties.flatMap(WorkflowGraphBuilder::extractAnnotation),
            extractPosition(element)
        );
    }

    private static Optional<String> extractAnnotation(Element properties) {
        Optional<Element> annotation = XmlElements.first(properties, "Annotation", NODE);
        if (annotation.isEmpty()) {
            return Optional.empty();
        }
        return XmlElements.first(annotation.get(), "Name")
            .map(XmlElements::text)
            .filter(text -> !text.isEmpty())
            .or(() -> XmlElements.first(annotation.get(), "DefaultAnnotationText")
                .map(XmlElements::text)
                .filter(text -> !text.isEmpty()));
    }

    private static Optional<GuiPosition> extractPosition(Element node) {
        return XmlElements.first(node, "GuiSettings", NODE)
            .flatMap(gui -> XmlElements.first(gui, "Position", NODE))
            .map(position -> new GuiPosition(
                coordinate(position, "x"),
                coordinate(position, "y")
            ));
    }

    private static double coordinate(Element position, String name) {
        String raw = XmlElements.attribute(position, name).orElse("0");
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            log.debug("Ignoring non-numeric position {}={}", name, raw);
            return 0d;
        }
    }

    static List<Connection> extractConnections(Element root) {
        var connections = new ArrayList<Connection>();
        for (Element element : XmlElements.descendants(root, CONNECTION)) {
            Optional<Element> origin = XmlElements.first(element, "Origin");
            Optional<Element> destination = XmlElements.first(element, "Destination");
            Optional<String> sourceId = origin.flatMap(WorkflowGraphBuilder::endpointId);
            Optional<String> destinationId = destination.flatMap(WorkflowGraphBuilder::endpointId);
            if (sourceId.isEmpty() || destinationId.isEmpty()) {
                continue;
            }
            String port = XmlElements.attribute(element, "name")
                .or(() -> origin.flatMap(o -> XmlElements.attribute(o, "Connection")))
                .orElse(Connection.DEFAULT_PORT);
            connections.add(new Connection(sourceId.get(), destinationId.get(), port));
        }
        return connections;
    }

    private static Optional<String> endpointId(Element endpoint) {
        String text = XmlElements.text(endpoint);
        if (!text.isEmpty()) {
            return Optional.of(text);
        }
        return XmlElements.attribute(endpoint, "ToolID");
    }
}
