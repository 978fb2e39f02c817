package ai.diffgraph.diff;

import java.util.List;

/**
 * Token diff of one paired detail (parameter list or dependency array), in each side's
 * own order.
 */
public record DetailDiff(List<TokenDiff> before, List<TokenDiff> after) {

    public DetailDiff {
        before = List.copyOf(before);
        after = List.copyOf(after);
    }
}
