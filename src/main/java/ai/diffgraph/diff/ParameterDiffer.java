package ai.diffgraph.diff;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import ai.diffgraph.model.Ids;

/**
 * Per-parameter diff of two parameter-list texts such as {@code (a: string, b = 1)}.
 * Parameters are keyed by name and paired by position within a key; a paired parameter
 * whose type text changed is modified.
 */
public final class ParameterDiffer {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private ParameterDiffer() {
    }

    public static DetailDiff diff(String oldParams, String newParams) {
        final List<Param> before = parse(oldParams);
        final List<Param> after = parse(newParams);
        final DiffStatus[] beforeStatus = new DiffStatus[before.size()];
        final DiffStatus[] afterStatus = new DiffStatus[after.size()];

        final Map<String, List<Integer>> beforeByKey = byKey(before);
        final Map<String, List<Integer>> afterByKey = byKey(after);
        for (Map.Entry<String, List<Integer>> entry : beforeByKey.entrySet()) {
            final List<Integer> olds = entry.getValue();
            final List<Integer> news = afterByKey.getOrDefault(entry.getKey(), List.of());
            final int paired = Math.min(olds.size(), news.size());
            for (int i = 0; i < paired; i++) {
                final int o = olds.get(i);
                final int n = news.get(i);
                final DiffStatus status = before.get(o).type().equals(after.get(n).type())
                        ? DiffStatus.UNCHANGED
                        : DiffStatus.MODIFIED;
                beforeStatus[o] = status;
                afterStatus[n] = status;
            }
            for (int i = paired; i < olds.size(); i++) {
                beforeStatus[olds.get(i)] = DiffStatus.REMOVED;
            }
        }
        return new DetailDiff(tokens(before, beforeStatus, DiffStatus.REMOVED),
                tokens(after, afterStatus, DiffStatus.ADDED));
    }

    /** All parameters of one side with the same status, for functions without a counterpart. */
    public static List<TokenDiff> uniform(String params, DiffStatus status) {
        final List<TokenDiff> out = new ArrayList<>();
        for (Param param : parse(params)) {
            out.add(new TokenDiff(param.text(), status));
        }
        return out;
    }

    static List<Param> parse(String params) {
        final List<Param> out = new ArrayList<>();
        if (params == null) {
            return out;
        }
        String text = params.trim();
        if (text.startsWith("(") && text.endsWith(")")) {
            text = text.substring(1, text.length() - 1);
        }
        for (String item : TopLevelSplitter.split(text, ',')) {
            final int eq = TopLevelSplitter.firstTopLevelIndex(item, '=');
            final String declared = eq >= 0 ? item.substring(0, eq) : item;
            final int colon = TopLevelSplitter.firstTopLevelIndex(declared, ':');
            final String name = colon >= 0 ? declared.substring(0, colon) : declared;
            final String type = colon >= 0 ? Ids.stripWhitespace(declared.substring(colon + 1)) : "";
            out.add(new Param(key(name), Ids.collapseWhitespace(item), type));
        }
        return out;
    }

    static String key(String name) {
        String key = name.trim();
        if (key.startsWith("...")) {
            key = key.substring(3).trim();
        }
        if (key.endsWith("?")) {
            key = key.substring(0, key.length() - 1).trim();
        }
        return IDENTIFIER.matcher(key).matches() ? key : Ids.stripWhitespace(key);
    }

    private static Map<String, List<Integer>> byKey(List<Param> params) {
        final Map<String, List<Integer>> out = new LinkedHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            out.computeIfAbsent(params.get(i).key(), k -> new ArrayList<>()).add(i);
        }
        return out;
    }

    private static List<TokenDiff> tokens(List<Param> params, DiffStatus[] statuses, DiffStatus unpaired) {
        final List<TokenDiff> out = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            out.add(new TokenDiff(params.get(i).text(), statuses[i] != null ? statuses[i] : unpaired));
        }
        return out;
    }

    record Param(String key, String text, String type) {
    }
}
