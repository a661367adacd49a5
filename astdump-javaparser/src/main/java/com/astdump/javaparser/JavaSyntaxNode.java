package com.astdump.javaparser;

import com.astdump.syntax.SourceSpan;
import com.astdump.syntax.SourceText;
import com.astdump.syntax.SyntaxNode;
import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithName;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.VoidType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Syntax node view over a JavaParser node.
 *
 * <p>The kind is the JavaParser class name ({@code IntegerLiteralExpr}, {@code BinaryExpr}, ...).
 * Children are ordered by where they begin in the source; nodes without a range (e.g. the unknown
 * parameter types of a lambda) keep their relative order after the positioned ones. Comments are
 * left out unless requested, in which case a node's own comment and its orphan comments become
 * children too.</p>
 */
public final class JavaSyntaxNode implements SyntaxNode {

    /**
     * Kinds whose first source token is copied into the document as the literal value.
     */
    public static final Set<String> LITERAL_KINDS = Set.of("IntegerLiteralExpr", "LongLiteralExpr");

    private static final Comparator<Node> BY_BEGIN = Comparator.comparing(
        (Node n) -> n.getRange().map(r -> r.begin).orElse(null),
        Comparator.nullsLast(Comparator.<Position>naturalOrder()));

    private final Node node;
    private final SourceText source;
    private final boolean includeComments;

    public JavaSyntaxNode(Node node, SourceText source, boolean includeComments) {
        this.node = Objects.requireNonNull(node, "node");
        this.source = Objects.requireNonNull(source, "source");
        this.includeComments = includeComments;
    }

    public Node getNode() {
        return node;
    }

    @Override
    public String kind() {
        return node.getClass().getSimpleName();
    }

    @Override
    public String spelling() {
        if (node instanceof SimpleName simpleName) {
            return simpleName.getIdentifier();
        }
        if (node instanceof Name name) {
            return name.asString();
        }
        if (node instanceof NodeWithSimpleName<?> named) {
            return named.getNameAsString();
        }
        if (node instanceof NodeWithName<?> named) {
            return named.getNameAsString();
        }
        if (node instanceof BinaryExpr binary) {
            return binary.getOperator().asString();
        }
        if (node instanceof UnaryExpr unary) {
            return unary.getOperator().asString();
        }
        if (node instanceof AssignExpr assign) {
            return assign.getOperator().asString();
        }
        if (node instanceof PrimitiveType primitive) {
            return primitive.asString();
        }
        if (node instanceof VoidType voidType) {
            return voidType.asString();
        }
        if (node instanceof Modifier modifier) {
            return modifier.getKeyword().asString();
        }
        return "";
    }

    /**
     * The node's range as offsets into the source text; empty when JavaParser recorded no range.
     * JavaParser ranges are inclusive at both ends, spans are exclusive at the end.
     */
    @Override
    public SourceSpan span() {
        Optional<Range> range = node.getRange();
        if (range.isEmpty()) {
            return SourceSpan.empty();
        }
        Position begin = range.get().begin;
        Position end = range.get().end;
        return new SourceSpan(source.offsetOf(begin.line, begin.column), source.offsetOf(end.line, end.column) + 1);
    }

    @Override
    public List<JavaSyntaxNode> children() {
        List<Node> childNodes = new ArrayList<>(node.getChildNodes());
        if (includeComments) {
            node.getComment().ifPresent(comment -> addIfAbsent(childNodes, comment));
            node.getOrphanComments().forEach(comment -> addIfAbsent(childNodes, comment));
        } else {
            childNodes.removeIf(child -> child instanceof Comment);
        }
        childNodes.sort(BY_BEGIN);

        List<JavaSyntaxNode> children = new ArrayList<>(childNodes.size());
        for (Node child : childNodes) {
            children.add(new JavaSyntaxNode(child, source, includeComments));
        }
        return children;
    }

    private static void addIfAbsent(List<Node> nodes, Node candidate) {
        for (Node existing : nodes) {
            if (existing == candidate) {
                return;
            }
        }
        nodes.add(candidate);
    }

    @Override
    public Object identity() {
        return node;
    }

    @Override
    public String toString() {
        return kind() + node.getRange().map(r -> "@" + r.begin).orElse("");
    }
}
