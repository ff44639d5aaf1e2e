package work.lcod.converter.graph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;
import work.lcod.converter.document.WorkflowFormatException;

/**
 * Turns a {@code Configuration} subtree into nested maps.
 *
 * <p>Leaf with text: the trimmed text. Leaf with attributes only: the attribute map. Empty leaf: {@code null}.
 * Element with children: a nested map keyed by child tag. Same-named siblings overwrite each other; the key keeps
 * the position of its first occurrence.
 *
 * <p>Walks the tree with an explicit stack. Nesting beyond {@code maxDepth} levels fails the whole document.
 */
public final class ConfigExtractor {
    public static final int DEFAULT_MAX_DEPTH = 64;
    /** Upper bound accepted for {@code maxDepth}. */
    public static final int MAX_DEPTH_LIMIT = 512;

    private ConfigExtractor() {}

    public static Map<String, Object> extract(Element configuration, int maxDepth) {
        if (maxDepth < 1 || maxDepth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException(
                "maxDepth must be between 1 and " + MAX_DEPTH_LIMIT + ": " + maxDepth
            );
        }
        var root = new LinkedHashMap<String, Object>();
        if (configuration == null) {
            return Collections.unmodifiableMap(root);
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(configuration, root, 1));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            for (Element child : XmlElements.children(frame.element())) {
                String key = child.getTagName();
                List<Element> grandChildren = XmlElements.children(child);
                if (grandChildren.isEmpty()) {
                    frame.target().put(key, leafValue(child));
                    continue;
                }
                if (frame.depth() + 1 > maxDepth) {
                    throw new WorkflowFormatException(
                        "Configuration nesting exceeds " + maxDepth + " levels at <" + key + ">"
                    );
                }
                // the parent holds a read-only view; the frame keeps the writable map until it is filled
                var nested = new LinkedHashMap<String, Object>();
                frame.target().put(key, Collections.unmodifiableMap(nested));
                stack.push(new Frame(child, nested, frame.depth() + 1));
            }
        }
        return Collections.unmodifiableMap(root);
    }

    public static Map<String, Object> extract(Element configuration) {
        return extract(configuration, DEFAULT_MAX_DEPTH);
    }

    private static Object leafValue(Element leaf) {
        String text = XmlElements.text(leaf);
        if (!text.isEmpty()) {
            return text;
        }
        Map<String, String> attributes = XmlElements.attributes(leaf);
        return attributes.isEmpty() ? null : attributes;
    }

    private record Frame(Element element, Map<String, Object> target, int depth) {}
}
