package com.astdump.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Syntax node built by hand, for callers that assemble a tree without a parser front end.
 *
 * <p>Identity is object identity: two nodes with equal fields are still distinct nodes.</p>
 */
public final class GenericSyntaxNode implements SyntaxNode {

    private final String kind;
    private final String spelling;
    private final SourceSpan span;
    private final List<SyntaxNode> children = new ArrayList<>();

    public GenericSyntaxNode(String kind, String spelling, SourceSpan span) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.spelling = spelling != null ? spelling : "";
        this.span = span != null ? span : SourceSpan.empty();
    }

    public GenericSyntaxNode(String kind, String spelling) {
        this(kind, spelling, SourceSpan.empty());
    }

    public GenericSyntaxNode addChild(SyntaxNode child) {
        children.add(Objects.requireNonNull(child, "child"));
        return this;
    }

    public GenericSyntaxNode addChildren(SyntaxNode... nodes) {
        for (SyntaxNode node : nodes) {
            addChild(node);
        }
        return this;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public String spelling() {
        return spelling;
    }

    @Override
    public SourceSpan span() {
        return span;
    }

    @Override
    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return kind + (spelling.isEmpty() ? "" : "(" + spelling + ")") + span;
    }
}
