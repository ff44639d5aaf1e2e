package work.lcod.converter.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a node's plugin signature and configuration to a {@link ToolType}.
 *
 * <p>Rules run in a fixed order and the first match wins:
 * <ol>
 *   <li>file reference in the configuration: input or output data,</li>
 *   <li>engine plugin family: substring markers in the serialized configuration,</li>
 *   <li>GUI plugin family: markers in the plugin name,</li>
 *   <li>macro reference,</li>
 *   <li>otherwise {@link ToolType#UNKNOWN}.</li>
 * </ol>
 * The marker checks are a heuristic. Nested configurations that mention several markers resolve to whichever
 * marker comes first, and callers rely on that ordering.
 */
public final class ToolTypeClassifier {
    static final String ENGINE_FAMILY = "AlteryxBasePluginsEngine";
    static final String GUI_FAMILY = "AlteryxBasePluginsGui";

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final List<String> FILE_KEYS = List.of("File", "FileName");
    private static final String OUTPUT_FILE_KEY = "FileName_Out";

    private static final List<Marker> ENGINE_MARKERS = List.of(
        new Marker(ToolKind.FILTER, "filter"),
        new Marker(ToolKind.JOIN, "join"),
        new Marker(ToolKind.SORT, "sort"),
        new Marker(ToolKind.SUMMARIZE, "summarize", "groupby"),
        new Marker(ToolKind.FORMULA, "formula"),
        new Marker(ToolKind.SELECT, "select"),
        new Marker(ToolKind.UNIQUE, "unique"),
        new Marker(ToolKind.SAMPLE, "sample"),
        new Marker(ToolKind.RECORD_ID, "recordid"),
        // only consulted once none of the markers above matched
        new Marker(ToolKind.UNION, "union"),
        new Marker(ToolKind.TEXT_TO_COLUMNS, "texttocolumns"),
        new Marker(ToolKind.CROSS_TAB, "crosstab"),
        new Marker(ToolKind.TRANSPOSE, "transpose")
    );

    private static final List<Marker> GUI_MARKERS = List.of(
        new Marker(ToolKind.BROWSE, "browse"),
        new Marker(ToolKind.TEXT_INPUT, "textinput")
    );

    private static final List<ClassificationRule> RULES = List.of(
        ToolTypeClassifier::fileRule,
        ToolTypeClassifier::engineRule,
        ToolTypeClassifier::guiRule,
        ToolTypeClassifier::macroRule
    );

    private ToolTypeClassifier() {}

    public static ToolType classify(String pluginRef, String macroRef, Map<String, Object> config) {
        String plugin = pluginRef == null ? "" : pluginRef;
        Map<String, Object> safeConfig = config == null ? Map.of() : config;
        for (ClassificationRule rule : RULES) {
            Optional<ToolType> match = rule.apply(plugin, macroRef, safeConfig);
            if (match.isPresent()) {
                return match.get();
            }
        }
        return ToolType.UNKNOWN;
    }

    static Optional<ToolType> fileRule(String pluginRef, String macroRef, Map<String, Object> config) {
        boolean hasFile = FILE_KEYS.stream().anyMatch(config::containsKey);
        if (!hasFile) {
            return Optional.empty();
        }
        boolean outputMarker = config.containsKey(OUTPUT_FILE_KEY)
            || config.keySet().stream().anyMatch(key -> key.toLowerCase(Locale.ROOT).contains("output"));
        return Optional.of(ToolType.of(outputMarker ? ToolKind.OUTPUT_DATA : ToolKind.INPUT_DATA));
    }

    static Optional<ToolType> engineRule(String pluginRef, String macroRef, Map<String, Object> config) {
        if (!pluginRef.contains(ENGINE_FAMILY)) {
            return Optional.empty();
        }
        return firstMarker(ENGINE_MARKERS, serialize(config));
    }

    static Optional<ToolType> guiRule(String pluginRef, String macroRef, Map<String, Object> config) {
        if (!pluginRef.contains(GUI_FAMILY)) {
            return Optional.empty();
        }
        return firstMarker(GUI_MARKERS, pluginRef.toLowerCase(Locale.ROOT));
    }

    static Optional<ToolType> macroRule(String pluginRef, String macroRef, Map<String, Object> config) {
        if (macroRef == null || macroRef.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(ToolType.macro(macroRef.trim()));
    }

    private static Optional<ToolType> firstMarker(List<Marker> markers, String haystack) {
        for (Marker marker : markers) {
            for (String needle : marker.needles()) {
                if (haystack.contains(needle)) {
                    return Optional.of(ToolType.of(marker.kind()));
                }
            }
        }
        return Optional.empty();
    }

    static String serialize(Map<String, Object> config) {
        try {
            return JSON.writeValueAsString(config).toLowerCase(Locale.ROOT);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Configuration is not serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    private record Marker(ToolKind kind, List<String> needles) {
        Marker(ToolKind kind, String... needles) {
            this(kind, List.of(needles));
        }
    }
}
