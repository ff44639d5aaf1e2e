package work.lcod.converter.emit;

import java.util.Map;
import java.util.Optional;

/**
 * Alias-based reads over a node configuration.
 */
public final class ConfigLookup {
    private ConfigLookup() {}

    /**
     * First alias whose value is a non-blank string.
     */
    public static Optional<String> string(Map<String, Object> config, String... aliases) {
        for (String alias : aliases) {
            if (config.get(alias) instanceof String value && !value.isBlank()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Follows {@code path} through nested maps, e.g. {@code FormulaFields/FormulaField}.
     */
    @SuppressWarnings("unchecked")
    public static Optional<Map<String, Object>> section(Map<String, Object> config, String... path) {
        Object current = config;
        for (String key : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(key);
        }
        if (current instanceof Map<?, ?> map) {
            return Optional.of((Map<String, Object>) map);
        }
        return Optional.empty();
    }

    /**
     * Reads an attribute of a leaf that only carried attributes (e.g. {@code <FormulaField field="x"/>}).
     */
    public static Optional<String> attribute(Map<String, Object> section, String name) {
        if (section.get(name) instanceof String value && !value.isBlank()) {
            return Optional.of(value);
        }
        return Optional.empty();
    }
}
