package work.lcod.converter.api;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.converter.emit.Fragment;
import work.lcod.converter.graph.ConfigExtractor;

/**
 * Immutable settings for one converter instance.
 */
public record ConverterConfiguration(
    String variablePrefix,
    String indent,
    String scriptTitle,
    List<String> baseImports,
    int maxConfigDepth,
    Optional<Instant> generatedAt,
    LogLevel logLevel
) {
    public static final String DEFAULT_PREFIX = "df";
    public static final String DEFAULT_INDENT = "    ";
    public static final String DEFAULT_TITLE = "Auto-generated Python script from Alteryx workflow";
    public static final List<String> DEFAULT_IMPORTS = List.of(Fragment.NUMPY, Fragment.PANDAS);

    public ConverterConfiguration {
        Objects.requireNonNull(variablePrefix, "variablePrefix");
        Objects.requireNonNull(indent, "indent");
        Objects.requireNonNull(scriptTitle, "scriptTitle");
        Objects.requireNonNull(baseImports, "baseImports");
        Objects.requireNonNull(generatedAt, "generatedAt");
        Objects.requireNonNull(logLevel, "logLevel");
        if (indent.isEmpty() || !indent.isBlank()) {
            throw new IllegalArgumentException("Indent must be non-empty whitespace.");
        }
        if (maxConfigDepth < 1 || maxConfigDepth > ConfigExtractor.MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException(
                "maxConfigDepth must be between 1 and " + ConfigExtractor.MAX_DEPTH_LIMIT + ": " + maxConfigDepth
            );
        }
        baseImports = List.copyOf(baseImports);
    }

    public static ConverterConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .variablePrefix(variablePrefix)
            .indent(indent)
            .scriptTitle(scriptTitle)
            .baseImports(baseImports)
            .maxConfigDepth(maxConfigDepth)
            .generatedAt(generatedAt)
            .logLevel(logLevel);
    }

    public static final class Builder {
        private String variablePrefix = DEFAULT_PREFIX;
        private String indent = DEFAULT_INDENT;
        private String scriptTitle = DEFAULT_TITLE;
        private List<String> baseImports = DEFAULT_IMPORTS;
        private int maxConfigDepth = ConfigExtractor.DEFAULT_MAX_DEPTH;
        private Optional<Instant> generatedAt = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder variablePrefix(String variablePrefix) {
            this.variablePrefix = variablePrefix;
            return this;
        }

        public Builder indent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder scriptTitle(String scriptTitle) {
            this.scriptTitle = scriptTitle;
            return this;
        }

        public Builder baseImports(List<String> baseImports) {
            this.baseImports = baseImports;
            return this;
        }

        public Builder maxConfigDepth(int maxConfigDepth) {
            this.maxConfigDepth = maxConfigDepth;
            return this;
        }

        public Builder generatedAt(Optional<Instant> generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ConverterConfiguration build() {
            return new ConverterConfiguration(
                variablePrefix,
                indent,
                scriptTitle,
                baseImports,
                maxConfigDepth,
                generatedAt,
                logLevel
            );
        }
    }
}
