package ai.diffgraph.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.diffgraph.model.EdgeKind;
import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;
import ai.diffgraph.model.Language;
import ai.diffgraph.model.NodeKind;
import ai.diffgraph.model.SnapshotGraph;
import ai.diffgraph.model.SourceFile;
import ai.diffgraph.scan.ExtractionContext;
import ai.diffgraph.scan.ExtractionException;
import ai.diffgraph.scan.FileExtraction;
import ai.diffgraph.scan.LanguageExtractor;
import ai.diffgraph.scan.TypeScriptExtractor;

class SnapshotGraphBuilderTest {

    private static final ExtractionContext CONTEXT = new ExtractionContext("repo", "snap", "ref");

    /** Fails on every file it claims. */
    private static final LanguageExtractor BROKEN = new LanguageExtractor() {
        @Override
        public boolean supports(String path) {
            return path.endsWith(".broken");
        }

        @Override
        public FileExtraction extract(SourceFile file, ExtractionContext context) throws ExtractionException {
            throw new ExtractionException(ExtractionException.Reason.PARSE_FAILURE, file.path(), "cannot parse");
        }
    };

    /** Blows up with an unchecked exception. */
    private static final LanguageExtractor CRASHING = new LanguageExtractor() {
        @Override
        public boolean supports(String path) {
            return path.endsWith(".crash");
        }

        @Override
        public FileExtraction extract(SourceFile file, ExtractionContext context) {
            throw new IllegalStateException("bug");
        }
    };

    @Test
    void failingFilesAreDroppedAndCounted() {
        final SnapshotGraphBuilder builder = new SnapshotGraphBuilder(
                List.of(new TypeScriptExtractor(), BROKEN, CRASHING), 1);

        final SnapshotGraph graph = builder.build(CONTEXT, List.of(
                new SourceFile("a.broken", "???"),
                new SourceFile("ok.ts", "export function ok() {\n  return 1;\n}\n"),
                new SourceFile("b.crash", "!!!")));

        assertThat(graph.warnings()).isEqualTo(2);
        assertThat(graph.nodes()).extracting(GraphNode::filePath).containsOnly("ok.ts");
        assertThat(graph.nodes()).extracting(GraphNode::name).contains("ok.ts", "ok");
    }

    @Test
    void unsupportedFilesBecomeBareFileNodes() {
        final SnapshotGraphBuilder builder = new SnapshotGraphBuilder(List.of(new TypeScriptExtractor()), 1);

        final SnapshotGraph graph = builder.build(CONTEXT, List.of(
                new SourceFile("docs/readme.md", "# Title\n\ntext\n"),
                new SourceFile("empty.cfg", "  \n")));

        assertThat(graph.nodes()).hasSize(1);
        final GraphNode readme = graph.nodes().get(0);
        assertThat(readme.kind()).isEqualTo(NodeKind.FILE);
        assertThat(readme.language()).isEqualTo(Language.UNKNOWN);
        assertThat(readme.name()).isEqualTo("readme.md");
        assertThat(readme.endLine()).isEqualTo(3);
        assertThat(graph.warnings()).isZero();
    }

    @Test
    void callsResolveAcrossFiles() {
        final SnapshotGraphBuilder builder = new SnapshotGraphBuilder(List.of(new TypeScriptExtractor()), 2);

        final SnapshotGraph graph = builder.build(CONTEXT, List.of(
                new SourceFile("src/main.ts", "import { helper } from './util';\n"
                        + "export function main() {\n  return helper(1);\n}\n"),
                new SourceFile("src/util.ts", "export function helper(n: number) {\n  return n + 1;\n}\n")));

        final GraphNode main = byName(graph, "main");
        final GraphNode helper = byName(graph, "helper");
        assertThat(graph.edges())
                .filteredOn(e -> e.kind() == EdgeKind.CALLS && e.flowType() == null)
                .extracting(GraphEdge::source, GraphEdge::target)
                .containsExactly(tuple(main.id(), helper.id()));
    }

    @Test
    void parallelAndSequentialBuildsAreIdentical() {
        final List<SourceFile> files = List.of(
                new SourceFile("a.ts", "export function a() {\n  if (x) { b(); }\n}\n"),
                new SourceFile("b.ts", "export function b() {\n  return a();\n}\n"),
                new SourceFile("c.ts", "export const c = () => {\n  try { a(); } finally { b(); }\n};\n"));

        final SnapshotGraph sequential = new SnapshotGraphBuilder(List.of(new TypeScriptExtractor()), 1)
                .build(CONTEXT, files);
        final SnapshotGraph parallel = new SnapshotGraphBuilder(List.of(new TypeScriptExtractor()), 4)
                .build(CONTEXT, files);

        assertThat(parallel.nodes()).isEqualTo(sequential.nodes());
        assertThat(parallel.edges()).isEqualTo(sequential.edges());
    }

    private static GraphNode byName(SnapshotGraph graph, String name) {
        return graph.nodes().stream()
                .filter(n -> n.kind().isFunctionLike() && n.name().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
