package ai.diffgraph.scan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import ai.diffgraph.cfg.Stmt;
import ai.diffgraph.model.BranchKind;

/**
 * Reads the summarizer's per-function statement outline into {@link Stmt}s. Hash text is
 * taken from the file itself: the header line for compound statements, the full span for
 * simple ones.
 */
final class PythonOutlineReader {

    private final String[] lines;

    PythonOutlineReader(String content) {
        this.lines = content.split("\n", -1);
    }

    List<Stmt> block(JsonNode statements) {
        if (statements == null || !statements.isArray()) {
            return List.of();
        }
        final List<Stmt> out = new ArrayList<>(statements.size());
        for (JsonNode statement : statements) {
            out.add(statement(statement));
        }
        return out;
    }

    private Stmt statement(JsonNode node) {
        return switch (node.path("type").asText("other")) {
            case "if" -> new Stmt.If(
                    source(node, true),
                    truth(node.get("test")),
                    node.path("elif").asBoolean(false),
                    block(node.get("body")),
                    node.hasNonNull("orelse") ? block(node.get("orelse")) : null);
            case "for" -> new Stmt.Loop(source(node, true), BranchKind.FOR, block(node.get("body")));
            case "while" -> new Stmt.Loop(source(node, true), BranchKind.WHILE, block(node.get("body")));
            case "match" -> {
                final List<List<Stmt>> cases = new ArrayList<>();
                for (JsonNode clause : node.path("cases")) {
                    cases.add(block(clause));
                }
                yield new Stmt.Switch(source(node, true), cases);
            }
            case "try" -> tryStatement(node);
            case "return" -> new Stmt.Return(source(node, false), List.of());
            case "raise" -> new Stmt.Throw(source(node, false));
            case "call" -> new Stmt.Call(source(node, false), node.path("callee").asText(null));
            case "block" -> new Stmt.Block(block(node.get("body")));
            default -> Stmt.OTHER;
        };
    }

    private Stmt tryStatement(JsonNode node) {
        // an else clause only runs when the body completed, so it extends the body
        final List<Stmt> body = new ArrayList<>(block(node.get("body")));
        body.addAll(block(node.get("orelse")));

        final List<Stmt.Handler> handlers = new ArrayList<>();
        for (JsonNode handler : node.path("handlers")) {
            handlers.add(new Stmt.Handler(source(handler, true), block(handler.get("body"))));
        }
        Stmt.Handler finalizer = null;
        final JsonNode finalBody = node.get("finalbody");
        if (finalBody != null && finalBody.isObject()) {
            finalizer = new Stmt.Handler(source(finalBody, true), block(finalBody.get("body")));
        }
        return new Stmt.Try(source(node, true), body, handlers, finalizer);
    }

    private static Boolean truth(JsonNode test) {
        if (test == null || !test.isBoolean()) {
            return null;
        }
        return test.booleanValue();
    }

    private Stmt.Source source(JsonNode node, boolean headerOnly) {
        final int start = node.path("start").asInt(0);
        final int end = Math.max(start, node.path("end").asInt(start));
        final String text = headerOnly ? lines(start, start) : lines(start, end);
        final String snippet = node.path("snippet").asText("");
        return new Stmt.Source(start, end, Snippets.bounded(snippet.isEmpty() ? Snippets.firstLine(text) : snippet), text);
    }

    String lines(int start, int end) {
        if (start < 1 || start > lines.length) {
            return "";
        }
        final int last = Math.min(end, lines.length);
        return String.join("\n", Arrays.asList(lines).subList(start - 1, last));
    }
}
