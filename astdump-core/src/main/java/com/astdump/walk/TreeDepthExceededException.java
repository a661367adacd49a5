package com.astdump.walk;

import com.astdump.AstDumpException;

public class TreeDepthExceededException extends AstDumpException {

    private final int maxDepth;

    public TreeDepthExceededException(int maxDepth) {
        super("Syntax tree is deeper than the configured maximum of " + maxDepth + " levels");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
