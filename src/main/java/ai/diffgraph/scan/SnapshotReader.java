package ai.diffgraph.scan;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.diffgraph.model.SourceFile;

/**
 * Reads the source files of one tree state from a directory. Paths are repo-relative with
 * forward slashes, sorted; dependency, build and VCS directories are skipped.
 */
public final class SnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotReader.class);

    private static final Set<String> SKIPPED_DIRS = Set.of(
            ".git", ".idea", "node_modules", "dist", "build", "out", "__pycache__", ".venv");

    private final Predicate<String> supported;

    public SnapshotReader(Predicate<String> supported) {
        this.supported = Objects.requireNonNull(supported, "supported");
    }

    public List<SourceFile> read(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }

        final List<Path> found = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (!dir.equals(root) && SKIPPED_DIRS.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && supported.test(relative(root, file))) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });

        found.sort(Comparator.comparing(p -> relative(root, p)));
        final List<SourceFile> out = new ArrayList<>(found.size());
        for (Path file : found) {
            try {
                out.add(new SourceFile(relative(root, file), Files.readString(file)));
            } catch (CharacterCodingException e) {
                log.warn("Skipping {}: not UTF-8 text", file);
            }
        }
        return out;
    }

    static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
