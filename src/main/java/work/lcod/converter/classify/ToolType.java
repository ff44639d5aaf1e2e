package work.lcod.converter.classify;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolved tool type of a node. Macro nodes also carry the macro name.
 */
public record ToolType(ToolKind kind, Optional<String> macroName) {
    private static final String MACRO_PREFIX = "macro:";

    public static final ToolType UNKNOWN = new ToolType(ToolKind.UNKNOWN, Optional.empty());

    public ToolType {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(macroName, "macroName");
        if (kind == ToolKind.MACRO && macroName.isEmpty()) {
            throw new IllegalArgumentException("Macro tool types need a macro name.");
        }
        if (kind != ToolKind.MACRO && macroName.isPresent()) {
            throw new IllegalArgumentException("Only macro tool types carry a macro name.");
        }
    }

    public static ToolType of(ToolKind kind) {
        return new ToolType(kind, Optional.empty());
    }

    public static ToolType macro(String name) {
        return new ToolType(ToolKind.MACRO, Optional.of(name));
    }

    public String tag() {
        return macroName.map(name -> MACRO_PREFIX + name).orElse(kind.tag());
    }

    @Override
    public String toString() {
        return tag();
    }
}
