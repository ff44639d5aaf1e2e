package work.lcod.converter.classify;

import java.util.Map;
import java.util.Optional;

/**
 * One step of the ordered classifier. Returning empty hands the node to the next rule.
 */
@FunctionalInterface
public interface ClassificationRule {
    Optional<ToolType> apply(String pluginRef, String macroRef, Map<String, Object> config);
}
