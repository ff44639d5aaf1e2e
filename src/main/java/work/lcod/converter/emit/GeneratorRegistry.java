package work.lcod.converter.emit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.converter.classify.ToolKind;

/**
 * Maps tool kinds to fragment generators. Kinds without an entry use the fallback generator.
 */
public final class GeneratorRegistry {
    private final Map<ToolKind, FragmentGenerator> generators = new EnumMap<>(ToolKind.class);
    private FragmentGenerator fallback = GenericGenerator::generate;

    /**
     * Registry with every built-in generator, shared by the converter, the CLI and tests.
     */
    public static GeneratorRegistry standard() {
        var registry = new GeneratorRegistry();
        IoGenerators.register(registry);
        PreparationGenerators.register(registry);
        CombineGenerators.register(registry);
        TransformGenerators.register(registry);
        return registry;
    }

    public GeneratorRegistry register(ToolKind kind, FragmentGenerator generator) {
        generators.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(generator, "generator"));
        return this;
    }

    public GeneratorRegistry fallback(FragmentGenerator generator) {
        this.fallback = Objects.requireNonNull(generator, "generator");
        return this;
    }

    public void unregister(ToolKind kind) {
        if (kind != null) {
            generators.remove(kind);
        }
    }

    public boolean supports(ToolKind kind) {
        return generators.containsKey(kind);
    }

    public FragmentGenerator resolve(ToolKind kind) {
        return generators.getOrDefault(kind, fallback);
    }

    public Map<ToolKind, FragmentGenerator> entries() {
        return Collections.unmodifiableMap(generators);
    }
}
