package com.tracecfg.core.domain;

/**
 * Thrown when the caller drives a graph outside the ordering discipline of a
 * trace: an address below the start of the block the cursor is on, or a jump
 * into the middle of an explored block while overlaps are rejected.
 */
public class SequenceException extends IllegalStateException {
    private final long address;

    public SequenceException(long address, String message) {
        super(message);
        this.address = address;
    }

    public long getAddress() {
        return address;
    }
}
