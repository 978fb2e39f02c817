package ai.diffgraph.scan;

import java.util.ArrayList;
import java.util.List;

import org.treesitter.TSNode;

import ai.diffgraph.cfg.Stmt;
import ai.diffgraph.model.BranchKind;
import ai.diffgraph.model.Ids;

/**
 * Translates TS/JS statement syntax into the {@link Stmt} outline.
 */
final class TypeScriptStatements {

    private final TsSyntax syntax;

    TypeScriptStatements(TsSyntax syntax) {
        this.syntax = syntax;
    }

    /** Statements of a block, or a one-element list for a braceless body. */
    List<Stmt> body(TSNode node) {
        if (node == null) {
            return List.of();
        }
        if (!"statement_block".equals(node.getType())) {
            return List.of(statement(node));
        }
        final List<Stmt> out = new ArrayList<>();
        for (TSNode child : TsSyntax.namedChildren(node)) {
            out.add(statement(child));
        }
        return out;
    }

    private Stmt statement(TSNode node) {
        return switch (node.getType()) {
            case "statement_block" -> new Stmt.Block(body(node));
            case "if_statement" -> ifStatement(node, false);
            case "for_statement", "for_in_statement" -> loop(node, BranchKind.FOR);
            case "while_statement", "do_statement" -> loop(node, BranchKind.WHILE);
            case "switch_statement" -> switchStatement(node);
            case "try_statement" -> tryStatement(node);
            case "return_statement" -> returnStatement(node);
            case "throw_statement" -> new Stmt.Throw(source(node, syntax.text(node)));
            case "expression_statement" -> expressionStatement(node);
            case "lexical_declaration", "variable_declaration" -> declaration(node);
            case "labeled_statement" -> {
                final TSNode labeled = TsSyntax.field(node, "body");
                yield labeled == null ? Stmt.OTHER : statement(labeled);
            }
            default -> Stmt.OTHER;
        };
    }

    private Stmt ifStatement(TSNode node, boolean elif) {
        final TSNode condition = TsSyntax.field(node, "condition");
        final String inner = stripParens(syntax.text(condition));
        final String header = "if (" + Ids.collapseWhitespace(inner) + ")";

        List<Stmt> elseBody = null;
        final TSNode alternative = TsSyntax.field(node, "alternative");
        if (alternative != null) {
            final TSNode elseStatement = "else_clause".equals(alternative.getType())
                    ? TsSyntax.firstNamedChild(alternative)
                    : alternative;
            if (elseStatement == null) {
                elseBody = List.of();
            } else if ("if_statement".equals(elseStatement.getType())) {
                elseBody = List.of(ifStatement(elseStatement, true));
            } else {
                elseBody = body(elseStatement);
            }
        }

        return new Stmt.If(
                new Stmt.Source(TsSyntax.startLine(node), TsSyntax.endLine(node), Snippets.bounded(header), header),
                knownTruth(condition == null ? null : TsSyntax.unwrap(condition)),
                elif,
                body(TsSyntax.field(node, "consequence")),
                elseBody
        );
    }

    private Boolean knownTruth(TSNode expression) {
        if (expression == null) {
            return null;
        }
        return switch (expression.getType()) {
            case "true" -> Boolean.TRUE;
            case "false", "null", "undefined" -> Boolean.FALSE;
            case "unary_expression" -> negated(expression);
            default -> null;
        };
    }

    private Boolean negated(TSNode unary) {
        if (!"!".equals(syntax.text(TsSyntax.field(unary, "operator")))) {
            return null;
        }
        final Boolean inner = knownTruth(TsSyntax.unwrap(TsSyntax.field(unary, "argument")));
        return inner == null ? null : !inner;
    }

    private Stmt loop(TSNode node, BranchKind kind) {
        final TSNode loopBody = TsSyntax.field(node, "body");
        final String header;
        if ("do_statement".equals(node.getType())) {
            header = "do while " + Ids.collapseWhitespace(syntax.text(TsSyntax.field(node, "condition")));
        } else if (loopBody != null) {
            header = syntax.slice(node.getStartByte(), loopBody.getStartByte());
        } else {
            header = syntax.text(node);
        }
        return new Stmt.Loop(source(node, header), kind, body(loopBody));
    }

    private Stmt switchStatement(TSNode node) {
        final String header = "switch " + Ids.collapseWhitespace(syntax.text(TsSyntax.field(node, "value")));
        final List<List<Stmt>> clauses = new ArrayList<>();
        final TSNode switchBody = TsSyntax.field(node, "body");
        if (switchBody != null) {
            for (TSNode clause : TsSyntax.namedChildren(switchBody)) {
                final TSNode value = TsSyntax.field(clause, "value");
                final List<Stmt> statements = new ArrayList<>();
                for (TSNode child : TsSyntax.namedChildren(clause)) {
                    if (!TsSyntax.sameNode(child, value)) {
                        statements.add(statement(child));
                    }
                }
                clauses.add(statements);
            }
        }
        return new Stmt.Switch(source(node, header), clauses);
    }

    private Stmt tryStatement(TSNode node) {
        final List<Stmt.Handler> handlers = new ArrayList<>();
        final TSNode handler = TsSyntax.field(node, "handler");
        if (handler != null) {
            final TSNode parameter = TsSyntax.field(handler, "parameter");
            final String header = parameter == null ? "catch" : "catch (" + Ids.collapseWhitespace(syntax.text(parameter)) + ")";
            handlers.add(new Stmt.Handler(clauseSource(handler, header), body(TsSyntax.field(handler, "body"))));
        }
        Stmt.Handler finalizer = null;
        final TSNode finallyClause = TsSyntax.field(node, "finalizer");
        if (finallyClause != null) {
            finalizer = new Stmt.Handler(clauseSource(finallyClause, "finally"), body(TsSyntax.field(finallyClause, "body")));
        }
        return new Stmt.Try(clauseSource(node, "try"), body(TsSyntax.field(node, "body")), handlers, finalizer);
    }

    private Stmt returnStatement(TSNode node) {
        final TSNode argument = TsSyntax.firstNamedChild(node);
        if (argument != null && syntax.containsJsx(argument)) {
            final List<String> tags = syntax.jsxTagNames(argument);
            final String snippet = "return JSX " + (tags.isEmpty() ? "<>" : "<" + tags.get(0) + ">");
            return new Stmt.Return(new Stmt.Source(TsSyntax.startLine(node), TsSyntax.endLine(node),
                    Snippets.bounded(snippet), syntax.text(node)), tags);
        }
        return new Stmt.Return(source(node, syntax.text(node)), List.of());
    }

    private Stmt expressionStatement(TSNode node) {
        final TSNode expression = TsSyntax.unwrap(TsSyntax.firstNamedChild(node));
        if (expression == null) {
            return Stmt.OTHER;
        }
        final String type = expression.getType();
        if ("assignment_expression".equals(type) || "augmented_assignment_expression".equals(type)) {
            return valueStatement(node, TsSyntax.unwrap(TsSyntax.field(expression, "right")));
        }
        return valueStatement(node, expression);
    }

    private Stmt declaration(TSNode node) {
        for (TSNode declarator : TsSyntax.namedChildren(node)) {
            if (!"variable_declarator".equals(declarator.getType())) {
                continue;
            }
            final Stmt classified = valueStatement(node, TsSyntax.unwrap(TsSyntax.field(declarator, "value")));
            if (classified != Stmt.OTHER) {
                return classified;
            }
        }
        return Stmt.OTHER;
    }

    private Stmt valueStatement(TSNode statement, TSNode value) {
        if (value == null) {
            return Stmt.OTHER;
        }
        if ("call_expression".equals(value.getType())) {
            return new Stmt.Call(source(statement, syntax.text(statement)), syntax.calleeName(value));
        }
        if ("ternary_expression".equals(value.getType())) {
            return new Stmt.Ternary(source(statement, syntax.text(statement)));
        }
        return Stmt.OTHER;
    }

    private Stmt.Source source(TSNode node, String text) {
        return new Stmt.Source(TsSyntax.startLine(node), TsSyntax.endLine(node), Snippets.bounded(text), text);
    }

    private static Stmt.Source clauseSource(TSNode node, String header) {
        return new Stmt.Source(TsSyntax.startLine(node), TsSyntax.endLine(node), header, header);
    }

    private static String stripParens(String text) {
        final String trimmed = text.trim();
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
