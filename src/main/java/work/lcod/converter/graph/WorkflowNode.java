package work.lcod.converter.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.converter.classify.ToolType;

/**
 * A single tool of the workflow. The tool type is resolved by the builder and never changes afterwards.
 */
public record WorkflowNode(
    String id,
    ToolType toolType,
    String pluginRef,
    Optional<String> macroRef,
    Map<String, Object> config,
    Optional<String> annotation,
    Optional<GuiPosition> guiPosition
) {
    public WorkflowNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(toolType, "toolType");
        Objects.requireNonNull(macroRef, "macroRef");
        Objects.requireNonNull(annotation, "annotation");
        Objects.requireNonNull(guiPosition, "guiPosition");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank.");
        }
        pluginRef = pluginRef == null ? "" : pluginRef;
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /**
     * Annotation when present, otherwise {@code Tool <id>}.
     */
    public String label() {
        return annotation.orElse("Tool " + id);
    }
}
