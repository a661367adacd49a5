package com.astdump.walk;

import com.astdump.document.DocumentMapper;
import com.astdump.document.DocumentNode;
import com.astdump.syntax.InvalidSpanException;
import com.astdump.syntax.SyntaxNode;
import com.astdump.token.TokenExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Converts a syntax tree into a document tree.
 *
 * <p>Nodes are entered in pre-order: a node's literal is extracted before any of its children are
 * visited, and children are visited left to right. Documents are assembled bottom-up as each node's
 * last child completes. The traversal keeps its own stack of frames, so the depth it can handle is
 * limited by {@link SerializationOptions#maxDepth()} and heap size, not by the thread stack.</p>
 *
 * <p>A walker holds no state between calls and may be reused.</p>
 */
public class TreeWalker {

    private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

    private final TokenExtractor tokenExtractor;
    private final SerializationOptions options;

    public TreeWalker(TokenExtractor tokenExtractor, SerializationOptions options) {
        this.tokenExtractor = Objects.requireNonNull(tokenExtractor, "tokenExtractor");
        this.options = Objects.requireNonNull(options, "options");
    }

    public TreeWalker(TokenExtractor tokenExtractor) {
        this(tokenExtractor, SerializationOptions.defaults());
    }

    /**
     * Serializes {@code root} and everything reachable from it.
     *
     * @throws CyclicTreeException         if a node is reached a second time
     * @throws TreeDepthExceededException  if nesting exceeds the configured maximum
     */
    public DocumentNode serializeNode(SyntaxNode root) {
        Objects.requireNonNull(root, "Cannot serialize an absent syntax tree");

        Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<Object> onPath = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Frame> stack = new ArrayDeque<>();

        stack.push(enter(root, 1, visited, onPath));

        while (true) {
            Frame top = stack.peek();
            if (top.pending.hasNext()) {
                SyntaxNode child = top.pending.next();
                if (child == null) {
                    throw new NullPointerException("Null child under " + top.node.kind() + " at depth " + top.depth);
                }
                int depth = top.depth + 1;
                if (depth > options.maxDepth()) {
                    throw new TreeDepthExceededException(options.maxDepth());
                }
                stack.push(enter(child, depth, visited, onPath));
                continue;
            }

            stack.pop();
            onPath.remove(top.node.identity());
            DocumentNode document = DocumentMapper.buildDocument(
                top.node.kind(), spellingOf(top.node), top.literal, top.built);

            Frame parent = stack.peek();
            if (parent == null) {
                return document;
            }
            parent.built.add(document);
        }
    }

    private Frame enter(SyntaxNode node, int depth, Set<Object> visited, Set<Object> onPath) {
        Object identity = node.identity();
        if (onPath.contains(identity)) {
            throw new CyclicTreeException(
                "Cycle detected: " + node.kind() + " at depth " + depth + " is its own ancestor",
                node.kind(), depth);
        }
        if (!visited.add(identity)) {
            throw new CyclicTreeException(
                "Node " + node.kind() + " at depth " + depth + " is reachable from more than one parent",
                node.kind(), depth);
        }
        onPath.add(identity);

        Optional<String> literal = Optional.empty();
        if (options.isLiteralKind(node.kind())) {
            literal = extractLiteral(node);
        }
        return new Frame(node, depth, literal);
    }

    private Optional<String> extractLiteral(SyntaxNode node) {
        try {
            return tokenExtractor.extractFirstTokenSpelling(node.span());
        } catch (InvalidSpanException e) {
            logger.debug("No literal value for {} at {}: {}", node.kind(), node.span(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String spellingOf(SyntaxNode node) {
        String spelling = node.spelling();
        return spelling != null ? spelling : "";
    }

    // One node being serialized: the children still to visit and the documents already built for the rest
    private static final class Frame {
        final SyntaxNode node;
        final int depth;
        final Optional<String> literal;
        final Iterator<? extends SyntaxNode> pending;
        final List<DocumentNode> built;

        Frame(SyntaxNode node, int depth, Optional<String> literal) {
            this.node = node;
            this.depth = depth;
            this.literal = literal;
            List<? extends SyntaxNode> children = node.children();
            this.pending = children.iterator();
            this.built = new ArrayList<>(children.size());
        }
    }
}
