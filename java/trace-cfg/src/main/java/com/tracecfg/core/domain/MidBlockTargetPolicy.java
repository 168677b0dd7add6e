package com.tracecfg.core.domain;

/**
 * What {@link ControlFlowGraph} does with a jump whose target lies strictly
 * inside a block that already has instructions recorded past that address.
 */
public enum MidBlockTargetPolicy {
    /** Start an overlapping block at the target and record a {@link BlockOverlap}. */
    ALLOW,
    /** Throw {@link SequenceException} before the graph is touched. */
    REJECT
}
