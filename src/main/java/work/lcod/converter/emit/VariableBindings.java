package work.lcod.converter.emit;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Node id to Python identifier map for one generation run.
 *
 * <p>Names are {@code <prefix>_<id>} with characters outside {@code [A-Za-z0-9_]} replaced by {@code _}. If two ids
 * sanitize to the same name, the later one gets a numeric suffix, so the mapping stays one-to-one. A binding is
 * created on first reference and never changes afterwards.
 *
 * <p>Helper variables a node needs next to its own binding come from {@link #temporary(String, String)} and share
 * the same name pool, so they never shadow a node binding in either order of creation.
 */
public final class VariableBindings {
    private static final Pattern INVALID = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String prefix;
    private final Map<String, String> byNodeId = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> temporaries = new HashMap<>();
    private final Set<String> taken = new HashSet<>();

    public VariableBindings(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (!IDENTIFIER.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Variable prefix is not a valid identifier: " + prefix);
        }
        this.prefix = prefix;
    }

    public String bind(String nodeId) {
        Objects.requireNonNull(nodeId, "nodeId");
        String existing = byNodeId.get(nodeId);
        if (existing != null) {
            return existing;
        }
        String name = claim(prefix + "_" + INVALID.matcher(nodeId).replaceAll("_"));
        byNodeId.put(nodeId, name);
        return name;
    }

    /**
     * Name for a helper variable owned by {@code nodeId}, derived from the node's binding plus {@code role}.
     * Repeated calls with the same arguments return the same name.
     */
    public String temporary(String nodeId, String role) {
        Objects.requireNonNull(role, "role");
        String owner = bind(nodeId);
        Map<String, String> byRole = temporaries.computeIfAbsent(nodeId, id -> new HashMap<>());
        String existing = byRole.get(role);
        if (existing != null) {
            return existing;
        }
        String name = claim(owner + "_" + INVALID.matcher(role).replaceAll("_"));
        byRole.put(role, name);
        return name;
    }

    private String claim(String base) {
        String candidate = base;
        int suffix = 2;
        while (taken.contains(candidate)) {
            candidate = base + "_" + suffix++;
        }
        taken.add(candidate);
        return candidate;
    }

    public boolean isBound(String nodeId) {
        return byNodeId.containsKey(nodeId);
    }

    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(byNodeId));
    }
}
