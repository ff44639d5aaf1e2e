package work.lcod.converter.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.lcod.converter.api.ConverterConfiguration;
import work.lcod.converter.api.LogLevel;
import work.lcod.converter.graph.ConfigExtractor;

/**
 * Reads converter settings from a TOML file on top of an existing builder.
 *
 * <pre>
 * [script]
 * prefix = "df"
 * indent = 4            # spaces, or a literal string such as "\t"
 * title = "Converted sales workflow"
 * imports = ["numpy as np", "pandas as pd"]
 *
 * [parser]
 * maxConfigDepth = 64
 *
 * [log]
 * level = "info"
 * </pre>
 * Missing keys keep the builder's current value.
 */
public final class ConverterSettingsLoader {
    private ConverterSettingsLoader() {}

    public static ConverterConfiguration.Builder load(Path path, ConverterConfiguration.Builder builder) {
        try {
            return parse(Files.readString(path), builder);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
    }

    public static ConverterConfiguration.Builder parse(String toml, ConverterConfiguration.Builder builder) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings: " + errors);
        }
        try {
            apply(result, builder);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid settings: " + ex.getMessage(), ex);
        }
        return builder;
    }

    private static void apply(TomlParseResult settings, ConverterConfiguration.Builder builder) {
        String prefix = settings.getString("script.prefix");
        if (prefix != null) {
            builder.variablePrefix(prefix);
        }
        if (settings.isLong("script.indent")) {
            long width = settings.getLong("script.indent");
            if (width < 1 || width > 16) {
                throw new IllegalArgumentException("Invalid settings: script.indent must be between 1 and 16");
            }
            builder.indent(" ".repeat((int) width));
        } else if (settings.isString("script.indent")) {
            builder.indent(settings.getString("script.indent"));
        }
        String title = settings.getString("script.title");
        if (title != null) {
            builder.scriptTitle(title);
        }
        TomlArray imports = settings.getArray("script.imports");
        if (imports != null) {
            var specs = new ArrayList<String>(imports.size());
            for (int i = 0; i < imports.size(); i++) {
                specs.add(imports.getString(i));
            }
            builder.baseImports(List.copyOf(specs));
        }
        Long depth = settings.getLong("parser.maxConfigDepth");
        if (depth != null) {
            if (depth < 1 || depth > ConfigExtractor.MAX_DEPTH_LIMIT) {
                throw new IllegalArgumentException(
                    "Invalid settings: parser.maxConfigDepth must be between 1 and " + ConfigExtractor.MAX_DEPTH_LIMIT
                );
            }
            builder.maxConfigDepth(depth.intValue());
        }
        String level = settings.getString("log.level");
        if (level != null) {
            builder.logLevel(LogLevel.from(level));
        }
    }
}
