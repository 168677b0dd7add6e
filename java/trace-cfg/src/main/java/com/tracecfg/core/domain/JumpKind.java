package com.tracecfg.core.domain;

// ============================================
// JumpKind: how control left a block
// ============================================
public enum JumpKind {
    UNCONDITIONAL,
    BRANCH_TAKEN,
    BRANCH_NOT_TAKEN;

    public boolean isConditional() {
        return this != UNCONDITIONAL;
    }
}
