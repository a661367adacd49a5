package com.astdump.syntax;

import java.util.List;

/**
 * Read-only view of a node in a parse tree owned by some external parser.
 */
public interface SyntaxNode {

    /**
     * Grammatical category of the node, e.g. {@code IntegerLiteral} or {@code BinaryOperator}.
     */
    String kind();

    /**
     * Display name of the node. Empty for purely structural nodes, never null.
     */
    String spelling();

    /**
     * Range of the source text covered by this node.
     */
    SourceSpan span();

    /**
     * Child nodes in source order.
     */
    List<? extends SyntaxNode> children();

    /**
     * Object whose identity decides whether two views denote the same node.
     * Adapters that create a fresh view per access return the wrapped node here.
     */
    default Object identity() {
        return this;
    }
}
