package work.lcod.converter.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Small DOM helpers shared by the graph builder and the config extractor.
 */
final class XmlElements {
    private XmlElements() {}

    static List<Element> children(Element element) {
        var result = new ArrayList<Element>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    static Optional<Element> child(Element element, String tag) {
        for (Element child : children(element)) {
            if (tag.equals(child.getTagName())) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * All descendants named {@code tag}, in document order.
     */
    static List<Element> descendants(Element root, String tag) {
        var result = new ArrayList<Element>();
        NodeList nodes = root.getElementsByTagName(tag);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * First descendant named {@code tag} in document order, without entering elements named {@code boundary}.
     */
    static Optional<Element> first(Element scope, String tag, String boundary) {
        Deque<Element> stack = new ArrayDeque<>();
        pushChildren(stack, scope);
        while (!stack.isEmpty()) {
            Element current = stack.pop();
            if (tag.equals(current.getTagName())) {
                return Optional.of(current);
            }
            if (boundary != null && boundary.equals(current.getTagName())) {
                continue;
            }
            pushChildren(stack, current);
        }
        return Optional.empty();
    }

    static Optional<Element> first(Element scope, String tag) {
        return first(scope, tag, null);
    }

    private static void pushChildren(Deque<Element> stack, Element element) {
        List<Element> children = children(element);
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    /**
     * Trimmed text of the element's own text and CDATA children. Markup nested below the element is ignored.
     */
    static String text(Element element) {
        var content = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            short type = node.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                content.append(node.getNodeValue());
            }
        }
        return content.toString().trim();
    }

    static Optional<String> attribute(Element element, String name) {
        if (!element.hasAttribute(name)) {
            return Optional.empty();
        }
        String value = element.getAttribute(name).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    static Map<String, String> attributes(Element element) {
        NamedNodeMap attributes = element.getAttributes();
        if (attributes == null || attributes.getLength() == 0) {
            return Map.of();
        }
        var map = new LinkedHashMap<String, String>();
        for (int i = 0; i < attributes.getLength(); i++) {
            Node attribute = attributes.item(i);
            map.put(attribute.getNodeName(), attribute.getNodeValue());
        }
        return Collections.unmodifiableMap(map);
    }
}
