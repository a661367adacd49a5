package com.astdump.walk;

import com.astdump.AstDumpException;

/**
 * Thrown when the walker reaches a node it has already entered. The input is then not a tree, and
 * continuing would either never terminate or duplicate output.
 */
public class CyclicTreeException extends AstDumpException {

    private final String kind;
    private final int depth;

    public CyclicTreeException(String message, String kind, int depth) {
        super(message);
        this.kind = kind;
        this.depth = depth;
    }

    public String getKind() {
        return kind;
    }

    public int getDepth() {
        return depth;
    }
}
