package com.astdump.document;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * One node of the output document.
 *
 * <p>{@code value} is null when the node carries no literal. {@code children} is null rather than empty
 * for leaves, so a leaf renders without a {@code children} field at all.</p>
 *
 * <p>{@code equals} and {@code hashCode} compare whole subtrees without recursion. {@code toString}
 * describes this node only.</p>
 */
public record DocumentNode(
    String kind,
    String name,
    String value,
    List<DocumentNode> children
) {
    public DocumentNode {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        children = children == null || children.isEmpty() ? null : List.copyOf(children);
    }

    public DocumentNode(String kind, String name) {
        this(kind, name, null, null);
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean hasChildren() {
        return children != null;
    }

    /**
     * Children of this node; empty for leaves.
     */
    public List<DocumentNode> childList() {
        return children != null ? children : List.of();
    }

    /**
     * Number of nodes in this subtree, including this one. Iterative, so safe on very deep documents.
     */
    public int nodeCount() {
        int count = 0;
        Deque<DocumentNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            DocumentNode node = pending.pop();
            count++;
            for (DocumentNode child : node.childList()) {
                pending.push(child);
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentNode other)) {
            return false;
        }
        Deque<DocumentNode[]> pending = new ArrayDeque<>();
        pending.push(new DocumentNode[] {this, other});
        while (!pending.isEmpty()) {
            DocumentNode[] pair = pending.pop();
            DocumentNode left = pair[0];
            DocumentNode right = pair[1];
            if (left == right) {
                continue;
            }
            List<DocumentNode> leftChildren = left.childList();
            List<DocumentNode> rightChildren = right.childList();
            if (!left.kind.equals(right.kind)
                || !left.name.equals(right.name)
                || !Objects.equals(left.value, right.value)
                || leftChildren.size() != rightChildren.size()) {
                return false;
            }
            for (int i = 0; i < leftChildren.size(); i++) {
                pending.push(new DocumentNode[] {leftChildren.get(i), rightChildren.get(i)});
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        // pre-order fields plus child counts identify the tree
        int hash = 1;
        Deque<DocumentNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            DocumentNode node = pending.pop();
            List<DocumentNode> nodeChildren = node.childList();
            hash = 31 * hash + Objects.hash(node.kind, node.name, node.value, nodeChildren.size());
            for (int i = nodeChildren.size() - 1; i >= 0; i--) {
                pending.push(nodeChildren.get(i));
            }
        }
        return hash;
    }

    @Override
    public String toString() {
        return "DocumentNode[kind=" + kind + ", name=" + name
            + (value != null ? ", value=" + value : "")
            + ", children=" + childList().size() + "]";
    }
}
