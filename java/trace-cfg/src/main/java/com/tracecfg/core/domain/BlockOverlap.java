package com.tracecfg.core.domain;

/**
 * A jump landed strictly inside an explored block and a second block was
 * started there instead of splitting the first one.
 */
public class BlockOverlap {
    private final int existingBlockIndex;
    private final int newBlockIndex;
    private final long address;

    public BlockOverlap(int existingBlockIndex, int newBlockIndex, long address) {
        this.existingBlockIndex = existingBlockIndex;
        this.newBlockIndex = newBlockIndex;
        this.address = address;
    }

    public int getExistingBlockIndex() {
        return existingBlockIndex;
    }

    public int getNewBlockIndex() {
        return newBlockIndex;
    }

    public long getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return "0x" + Long.toHexString(address) + " lies inside block #" + existingBlockIndex
            + ", started overlapping block #" + newBlockIndex;
    }
}
