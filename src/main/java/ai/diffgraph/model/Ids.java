package ai.diffgraph.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content-derived identifiers. Every id is a truncated SHA-256 over a colon-joined key,
 * so re-extracting unchanged input reproduces identical ids.
 */
public final class Ids {

    private static final int HASH_LENGTH = 16;

    private Ids() {
    }

    public static String stableHash(String value) {
        Objects.requireNonNull(value, "value");
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            final byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String snapshotId(String repoId, String ref) {
        Objects.requireNonNull(repoId, "repoId");
        Objects.requireNonNull(ref, "ref");
        return stableHash(repoId + ":" + ref);
    }

    public static String nodeId(String snapshotId,
                                NodeKind kind,
                                String qualifiedName,
                                int startLine,
                                int endLine,
                                String disambiguator) {
        Objects.requireNonNull(snapshotId, "snapshotId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        return stableHash(snapshotId + ":" + kind.label() + ":" + qualifiedName
                + ":" + startLine + ":" + endLine + ":" + (disambiguator == null ? "" : disambiguator));
    }

    public static String moduleId(String snapshotId, String specifier) {
        Objects.requireNonNull(snapshotId, "snapshotId");
        Objects.requireNonNull(specifier, "specifier");
        return stableHash(snapshotId + ":module:" + specifier);
    }

    public static String edgeId(String snapshotId, EdgeKind kind, String source, String target, String discriminator) {
        Objects.requireNonNull(snapshotId, "snapshotId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        return stableHash(snapshotId + ":" + kind.name() + ":" + source + ":" + target
                + ":" + (discriminator == null ? "" : discriminator));
    }

    /**
     * Hash of the source span with every whitespace character removed, so reformatting
     * keeps the value stable.
     */
    public static String signatureHash(String sourceText) {
        return stableHash(stripWhitespace(sourceText == null ? "" : sourceText));
    }

    public static String stripWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    public static String lastSegment(String dottedName) {
        final int i = dottedName.lastIndexOf('.');
        return i >= 0 ? dottedName.substring(i + 1) : dottedName;
    }
}
