package ai.diffgraph.diff;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TopLevelSplitterTest {

    @Test
    void splitsOnlyAtTopLevelCommas() {
        assertThat(TopLevelSplitter.split("a: Map<string, number>, { x, y }: Point, [p, q] = [1, 2]", ','))
                .containsExactly("a: Map<string, number>", "{ x, y }: Point", "[p, q] = [1, 2]");
    }

    @Test
    void ignoresDelimitersInsideStrings() {
        assertThat(TopLevelSplitter.split("sep = ',', label = \"a, \\\"b\\\"\", t = `x,${y}`", ','))
                .containsExactly("sep = ','", "label = \"a, \\\"b\\\"\"", "t = `x,${y}`");
    }

    @Test
    void arrowTypesDoNotCloseGenerics() {
        assertThat(TopLevelSplitter.split("cb: Map<string, () => void>, n: number", ','))
                .containsExactly("cb: Map<string, () => void>", "n: number");
    }

    @Test
    void lessThanComparisonsDoNotOpenGenerics() {
        assertThat(TopLevelSplitter.split("a = x < y, b: number", ','))
                .containsExactly("a = x < y", "b: number");
        assertThat(TopLevelSplitter.split("limit = n <= max ? n : max, f = g(a > b, c)", ','))
                .containsExactly("limit = n <= max ? n : max", "f = g(a > b, c)");
        assertThat(TopLevelSplitter.split("cb: <T>(x: T, y: T) => T, m: Array<Map<K, V>>, z", ','))
                .containsExactly("cb: <T>(x: T, y: T) => T", "m: Array<Map<K, V>>", "z");
    }

    @Test
    void firstTopLevelEqualsSkipsArrowsAndComparisons() {
        assertThat(TopLevelSplitter.firstTopLevelIndex("cb: () => void", '=')).isEqualTo(-1);
        assertThat(TopLevelSplitter.firstTopLevelIndex("ok = a == b", '=')).isEqualTo(3);
        assertThat(TopLevelSplitter.firstTopLevelIndex("{ a = 1 }: Opts = {}", '=')).isEqualTo(16);
    }

    @Test
    void blankInputHasNoParts() {
        assertThat(TopLevelSplitter.split("  ", ',')).isEmpty();
        assertThat(TopLevelSplitter.split(null, ',')).isEmpty();
        assertThat(TopLevelSplitter.split("a,,b,", ',')).containsExactly("a", "b");
    }
}
