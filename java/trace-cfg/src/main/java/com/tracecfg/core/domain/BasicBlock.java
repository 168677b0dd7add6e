package com.tracecfg.core.domain;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

// ============================================
// BasicBlock: straight-line run observed in a trace
// ============================================
public class BasicBlock {
    private final int id;
    private final long startAddress;
    private final Map<Long, TraceRecord> instructions;
    private final Map<Integer, Long> edgeCounts;
    private long endAddress;

    BasicBlock(int id, long startAddress) {
        this.id = id;
        this.startAddress = startAddress;
        this.instructions = new LinkedHashMap<>();
        this.edgeCounts = new LinkedHashMap<>();
        this.endAddress = startAddress;
    }

    /**
     * Records {@code record} at {@code address}. An address that is already
     * recorded keeps its first record.
     *
     * @throws SequenceException if {@code address} lies below the block start
     */
    public void addInstruction(long address, TraceRecord record) {
        if (record == null) {
            throw ValidationException.wrongType("record", null, "TraceRecord");
        }
        if (Long.compareUnsigned(address, startAddress) < 0) {
            throw new SequenceException(address, "Address " + hex(address)
                + " precedes the start " + hex(startAddress) + " of block #" + id);
        }
        if (instructions.putIfAbsent(address, record) == null) {
            if (Long.compareUnsigned(address, endAddress) > 0) {
                endAddress = address;
            }
        }
    }

    /**
     * Registers an edge to {@code targetIndex} if it is new, and counts one
     * traversal of it when {@code traversed} is set.
     */
    public void addEdge(int targetIndex, boolean traversed) {
        edgeCounts.merge(targetIndex, traversed ? 1L : 0L, Long::sum);
    }

    /**
     * Live view of the outgoing edges in registration order; every call
     * returns an iterable that reflects the current counts.
     */
    public Iterable<BlockEdge> edges() {
        return () -> new Iterator<BlockEdge>() {
            private final Iterator<Map.Entry<Integer, Long>> entries = edgeCounts.entrySet().iterator();
            private int ordinal;

            @Override
            public boolean hasNext() {
                return entries.hasNext();
            }

            @Override
            public BlockEdge next() {
                Map.Entry<Integer, Long> entry = entries.next();
                return new BlockEdge(ordinal++, entry.getKey(), entry.getValue());
            }
        };
    }

    public int getEdgeCount() {
        return edgeCounts.size();
    }

    public boolean hasEdge(int targetIndex) {
        return edgeCounts.containsKey(targetIndex);
    }

    /**
     * @return traversals of the edge to {@code targetIndex}, or -1 if no such edge exists
     */
    public long getTraversalCount(int targetIndex) {
        return edgeCounts.getOrDefault(targetIndex, -1L);
    }

    public boolean containsAddress(long address) {
        return instructions.containsKey(address);
    }

    public TraceRecord getInstruction(long address) {
        return instructions.get(address);
    }

    public Set<Long> getAddresses() {
        return Collections.unmodifiableSet(instructions.keySet());
    }

    public int getInstructionCount() {
        return instructions.size();
    }

    public boolean isExplored() {
        return !instructions.isEmpty();
    }

    /**
     * Whether {@code address} lies past the start of this block and no further
     * than the highest address recorded in it.
     */
    public boolean spans(long address) {
        return isExplored()
            && Long.compareUnsigned(address, startAddress) > 0
            && Long.compareUnsigned(address, endAddress) <= 0;
    }

    /**
     * @throws IllegalStateException if nothing has been recorded in this block yet
     */
    public long getEndAddress() {
        if (!isExplored()) {
            throw new IllegalStateException("Block #" + id + " at " + hex(startAddress) + " is unexplored");
        }
        return endAddress;
    }

    public long getStartAddress() {
        return startAddress;
    }

    public int getId() {
        return id;
    }

    /**
     * Same lines as {@link #toString()}, ready to sit inside a quoted DOT label:
     * quotes and backslashes escaped, newlines written as {@code \n}.
     */
    public String toEscapedString() {
        return toString()
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Long, TraceRecord> entry : instructions.entrySet()) {
            TraceRecord record = entry.getValue();
            sb.append(String.format("%-16s %-12s %-12s", hex(entry.getKey()), record.getName(),
                record.getOperandText()));
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String hex(long address) {
        return "0x" + Long.toHexString(address);
    }
}
