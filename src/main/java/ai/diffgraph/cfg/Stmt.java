package ai.diffgraph.cfg;

import java.util.List;

import ai.diffgraph.model.BranchKind;

/**
 * Language-neutral statement outline consumed by {@link ControlFlowBuilder}. Front ends
 * translate their syntax trees into this shape; anything without a control meaning
 * becomes {@link Other}.
 */
public sealed interface Stmt
        permits Stmt.If, Stmt.Loop, Stmt.Switch, Stmt.Try, Stmt.Return, Stmt.Throw,
                Stmt.Call, Stmt.Ternary, Stmt.Block, Stmt.Other {

    /**
     * Where a statement sits and what it looks like.
     *
     * @param snippet whitespace-collapsed, bounded display text
     * @param text    source text hashed into the branch signature
     */
    record Source(int startLine, int endLine, String snippet, String text) {
    }

    /**
     * @param knownTruth literal condition value, null when not a literal
     * @param elseBody   null when the statement has no else
     */
    record If(Source source, Boolean knownTruth, boolean elif, List<Stmt> thenBody, List<Stmt> elseBody)
            implements Stmt {
    }

    record Loop(Source source, BranchKind kind, List<Stmt> body) implements Stmt {
    }

    record Switch(Source source, List<List<Stmt>> clauses) implements Stmt {
    }

    /**
     * @param finalizer null without a finally clause
     */
    record Try(Source source, List<Stmt> body, List<Handler> handlers, Handler finalizer) implements Stmt {
    }

    /** A catch (or except) clause, or the finally clause of a {@link Try}. */
    record Handler(Source source, List<Stmt> body) {
    }

    /**
     * @param jsxTags tags rendered by the returned expression, empty when it is not JSX
     */
    record Return(Source source, List<String> jsxTags) implements Stmt {
    }

    record Throw(Source source) implements Stmt {
    }

    record Call(Source source, String callee) implements Stmt {
    }

    record Ternary(Source source) implements Stmt {
    }

    /** Nested statement list with no control node of its own ({@code { ... }}, {@code with}). */
    record Block(List<Stmt> body) implements Stmt {
    }

    record Other() implements Stmt {
    }

    Other OTHER = new Other();
}
