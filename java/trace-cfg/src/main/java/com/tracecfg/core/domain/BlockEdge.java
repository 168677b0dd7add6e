package com.tracecfg.core.domain;

// ============================================
// BlockEdge: outgoing edge as seen from its source block
// ============================================
public class BlockEdge {
    private final int ordinal;
    private final int targetIndex;
    private final long traversalCount;

    public BlockEdge(int ordinal, int targetIndex, long traversalCount) {
        this.ordinal = ordinal;
        this.targetIndex = targetIndex;
        this.traversalCount = traversalCount;
    }

    /** Position of this edge in the source block's registration order. */
    public int getOrdinal() {
        return ordinal;
    }

    public int getTargetIndex() {
        return targetIndex;
    }

    public long getTraversalCount() {
        return traversalCount;
    }
}
