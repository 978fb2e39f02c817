package ai.diffgraph.diff;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ai.diffgraph.model.Ids;

/**
 * Diff of two hook dependency arrays such as {@code [count, mode]}. Entries with the same
 * normalized text are unchanged; the remaining entries pair up by position as modified.
 */
public final class DependencyDiffer {

    private DependencyDiffer() {
    }

    public static DetailDiff diff(String oldDeps, String newDeps) {
        final List<String> before = parse(oldDeps);
        final List<String> after = parse(newDeps);
        final DiffStatus[] beforeStatus = new DiffStatus[before.size()];
        final DiffStatus[] afterStatus = new DiffStatus[after.size()];

        final Map<String, Deque<Integer>> afterByText = new HashMap<>();
        for (int i = 0; i < after.size(); i++) {
            afterByText.computeIfAbsent(Ids.stripWhitespace(after.get(i)), k -> new ArrayDeque<>()).add(i);
        }
        for (int i = 0; i < before.size(); i++) {
            final Deque<Integer> bucket = afterByText.get(Ids.stripWhitespace(before.get(i)));
            if (bucket != null && !bucket.isEmpty()) {
                beforeStatus[i] = DiffStatus.UNCHANGED;
                afterStatus[bucket.poll()] = DiffStatus.UNCHANGED;
            }
        }

        final List<Integer> oldRest = unmatched(beforeStatus);
        final List<Integer> newRest = unmatched(afterStatus);
        final int paired = Math.min(oldRest.size(), newRest.size());
        for (int i = 0; i < paired; i++) {
            beforeStatus[oldRest.get(i)] = DiffStatus.MODIFIED;
            afterStatus[newRest.get(i)] = DiffStatus.MODIFIED;
        }
        return new DetailDiff(tokens(before, beforeStatus, DiffStatus.REMOVED),
                tokens(after, afterStatus, DiffStatus.ADDED));
    }

    public static List<TokenDiff> uniform(String deps, DiffStatus status) {
        final List<TokenDiff> out = new ArrayList<>();
        for (String entry : parse(deps)) {
            out.add(new TokenDiff(entry, status));
        }
        return out;
    }

    static List<String> parse(String deps) {
        if (deps == null) {
            return List.of();
        }
        String text = deps.trim();
        if (text.startsWith("[") && text.endsWith("]")) {
            text = text.substring(1, text.length() - 1);
        }
        final List<String> out = new ArrayList<>();
        for (String entry : TopLevelSplitter.split(text, ',')) {
            out.add(Ids.collapseWhitespace(entry));
        }
        return out;
    }

    private static List<Integer> unmatched(DiffStatus[] statuses) {
        final List<Integer> out = new ArrayList<>();
        for (int i = 0; i < statuses.length; i++) {
            if (statuses[i] == null) {
                out.add(i);
            }
        }
        return out;
    }

    private static List<TokenDiff> tokens(List<String> entries, DiffStatus[] statuses, DiffStatus unpaired) {
        final List<TokenDiff> out = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            out.add(new TokenDiff(entries.get(i), statuses[i] != null ? statuses[i] : unpaired));
        }
        return out;
    }
}
