package ai.diffgraph.graph;

import java.util.HashMap;
import java.util.Map;

import ai.diffgraph.scan.DeclaredSymbol;

/**
 * Name lookup for best-effort call resolution, one table per front end:
 * - a declaration in the caller's own file wins (top-level before nested callbacks)
 * - otherwise a top-level name declared exactly once across the snapshot
 */
public final class SymbolTable {

    private final Map<String, Map<String, String>> topLevelByFile = new HashMap<>();
    private final Map<String, Map<String, String>> nestedByFile = new HashMap<>();
    private final Map<String, String> firstTopLevel = new HashMap<>();
    private final Map<String, Integer> topLevelCounts = new HashMap<>();

    public void register(String filePath, DeclaredSymbol symbol) {
        if (symbol.nested()) {
            nestedByFile.computeIfAbsent(filePath, k -> new HashMap<>()).putIfAbsent(symbol.name(), symbol.nodeId());
            return;
        }
        topLevelByFile.computeIfAbsent(filePath, k -> new HashMap<>()).putIfAbsent(symbol.name(), symbol.nodeId());
        firstTopLevel.putIfAbsent(symbol.name(), symbol.nodeId());
        topLevelCounts.merge(symbol.name(), 1, Integer::sum);
    }

    /** Node id for {@code name} as seen from {@code filePath}, or null. */
    public String resolve(String name, String filePath) {
        if (name == null || name.isBlank()) return null;

        final String local = topLevelByFile.getOrDefault(filePath, Map.of()).get(name);
        if (local != null) return local;

        final String nested = nestedByFile.getOrDefault(filePath, Map.of()).get(name);
        if (nested != null) return nested;

        if (topLevelCounts.getOrDefault(name, 0) == 1) return firstTopLevel.get(name);

        return null;
    }
}
