package com.chainmirror.ingestion.reconcile;

/**
 * A reorg deeper than the configured bound. Nothing has been reverted when this is thrown.
 */
public class RevertDepthExceededException extends ChainStateException {

    private final int depth;
    private final int maxDepth;

    public RevertDepthExceededException(int depth, int maxDepth) {
        super("Revert depth " + depth + " exceeds maximum " + maxDepth);
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
