package work.lcod.converter.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Statements emitted for one node, plus the imports they need.
 */
public record Fragment(List<String> lines, Set<String> imports, boolean needsManualCompletion) {
    public static final String PANDAS = "pandas as pd";
    public static final String NUMPY = "numpy as np";
    public static final String OPENPYXL = "openpyxl";

    public Fragment {
        lines = List.copyOf(lines);
        imports = Collections.unmodifiableSet(new TreeSet<>(imports));
    }

    public static Fragment comment(String text) {
        return builder().line("# " + text).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> lines = new ArrayList<>();
        private final Set<String> imports = new TreeSet<>();
        private boolean needsManualCompletion;

        public Builder line(String line) {
            lines.add(line);
            return this;
        }

        public Builder lines(String... more) {
            for (String line : more) {
                lines.add(line);
            }
            return this;
        }

        public Builder require(String importSpec) {
            imports.add(importSpec);
            return this;
        }

        public Builder requireAll(Set<String> importSpecs) {
            imports.addAll(importSpecs);
            return this;
        }

        public Builder needsManualCompletion() {
            this.needsManualCompletion = true;
            return this;
        }

        public Fragment build() {
            return new Fragment(lines, imports, needsManualCompletion);
        }
    }
}
