package com.tracecfg.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// ============================================
// ControlFlowGraph: built one executed step at a time
// ============================================
/**
 * Control-flow graph grown from a trace. Blocks are created only as jump
 * targets and are never removed; the cursor marks the block the trace is
 * currently executing in. Instances are not thread-safe.
 */
public class ControlFlowGraph {
    private final long entryAddress;
    private final MidBlockTargetPolicy midBlockTargetPolicy;
    private final List<BasicBlock> blocks;
    private final Map<Long, Integer> blockIndexByStart;
    private final List<BlockOverlap> overlaps;
    private int nextBlockId;
    private int cursor;

    public ControlFlowGraph(long entryAddress) {
        this(entryAddress, MidBlockTargetPolicy.ALLOW);
    }

    public ControlFlowGraph(long entryAddress, MidBlockTargetPolicy midBlockTargetPolicy) {
        if (midBlockTargetPolicy == null) {
            throw ValidationException.wrongType("midBlockTargetPolicy", null, "MidBlockTargetPolicy");
        }
        this.entryAddress = entryAddress;
        this.midBlockTargetPolicy = midBlockTargetPolicy;
        this.blocks = new ArrayList<>();
        this.blockIndexByStart = new HashMap<>();
        this.overlaps = new ArrayList<>();
        this.cursor = createBlock(entryAddress);
    }

    // ============================================
    // EXECUTION
    // ============================================

    /**
     * Feeds one executed step into the graph. The step is recorded in the
     * current block; a jump then registers edges to its targets and moves the
     * cursor to the arm that was taken.
     *
     * @throws ValidationException if {@code record} is null
     * @throws SequenceException   if {@code address} lies below the current block's
     *                             start, or a jump lands inside an explored block
     *                             under {@link MidBlockTargetPolicy#REJECT}
     */
    public void execute(long address, TraceRecord record) {
        if (record == null) {
            throw ValidationException.wrongType("record", null, "TraceRecord");
        }
        BasicBlock current = blocks.get(cursor);
        if (Long.compareUnsigned(address, current.getStartAddress()) < 0) {
            throw new SequenceException(address, "Executed address " + hex(address)
                + " precedes the start " + hex(current.getStartAddress()) + " of the current block");
        }
        if (record instanceof JumpRecord && midBlockTargetPolicy == MidBlockTargetPolicy.REJECT) {
            rejectMidBlockTargets(address, (JumpRecord) record);
        }

        current.addInstruction(address, record);

        if (record instanceof JumpRecord) {
            cursor = transition(current, (JumpRecord) record);
        }
    }

    private int transition(BasicBlock source, JumpRecord jump) {
        return switch (jump.getKind()) {
            case UNCONDITIONAL -> {
                int success = findOrCreate(jump.getSuccessAddress());
                source.addEdge(success, true);
                yield success;
            }
            case BRANCH_TAKEN -> {
                int failure = findOrCreate(jump.getFailureAddress());
                source.addEdge(failure, false);
                int success = findOrCreate(jump.getSuccessAddress());
                source.addEdge(success, true);
                yield success;
            }
            case BRANCH_NOT_TAKEN -> {
                int failure = findOrCreate(jump.getFailureAddress());
                source.addEdge(failure, true);
                int success = findOrCreate(jump.getSuccessAddress());
                source.addEdge(success, false);
                yield failure;
            }
        };
    }

    // ============================================
    // BLOCK RESOLUTION
    // ============================================

    private int findOrCreate(long targetAddress) {
        Integer existing = blockIndexByStart.get(targetAddress);
        if (existing != null) {
            return existing;
        }
        int containing = findSpanningBlock(targetAddress);
        int created = createBlock(targetAddress);
        if (containing >= 0) {
            overlaps.add(new BlockOverlap(containing, created, targetAddress));
        }
        return created;
    }

    private int createBlock(long startAddress) {
        int index = blocks.size();
        blocks.add(new BasicBlock(nextBlockId++, startAddress));
        blockIndexByStart.put(startAddress, index);
        return index;
    }

    private int findSpanningBlock(long address) {
        for (int i = blocks.size() - 1; i >= 0; i--) {
            if (blocks.get(i).spans(address)) {
                return i;
            }
        }
        return -1;
    }

    private void rejectMidBlockTargets(long address, JumpRecord jump) {
        List<Long> targets = new ArrayList<>();
        targets.add(jump.getSuccessAddress());
        if (jump.getKind().isConditional()) {
            targets.add(jump.getFailureAddress());
        }
        BasicBlock current = blocks.get(cursor);
        for (long target : targets) {
            if (blockIndexByStart.containsKey(target)) {
                continue;
            }
            // the jump itself is about to be recorded in the current block
            long currentEnd = current.isExplored() && Long.compareUnsigned(current.getEndAddress(), address) > 0
                ? current.getEndAddress()
                : address;
            boolean insideCurrent = Long.compareUnsigned(target, current.getStartAddress()) > 0
                && Long.compareUnsigned(target, currentEnd) <= 0;
            if (insideCurrent || findSpanningBlock(target) >= 0) {
                throw new SequenceException(target, "Jump at " + hex(address) + " targets " + hex(target)
                    + ", which lies inside an already explored block");
            }
        }
    }

    // ============================================
    // ACCESSORS
    // ============================================

    public BasicBlock getCurrentBlock() {
        return blocks.get(cursor);
    }

    public int getCursor() {
        return cursor;
    }

    public BasicBlock getBlock(int index) {
        return blocks.get(index);
    }

    /**
     * @return the block starting at {@code startAddress}, or null if none does
     */
    public BasicBlock findBlock(long startAddress) {
        Integer index = blockIndexByStart.get(startAddress);
        return index == null ? null : blocks.get(index);
    }

    /**
     * @return index of the block starting at {@code startAddress}, or -1
     */
    public int indexOf(long startAddress) {
        return blockIndexByStart.getOrDefault(startAddress, -1);
    }

    /**
     * Blocks in display order, most recently created first.
     */
    public List<BasicBlock> getBlocks() {
        List<BasicBlock> ordered = new ArrayList<>(blocks);
        Collections.reverse(ordered);
        return Collections.unmodifiableList(ordered);
    }

    public List<BasicBlock> getBlocksInCreationOrder() {
        return Collections.unmodifiableList(blocks);
    }

    public int getBlockCount() {
        return blocks.size();
    }

    public long getEntryAddress() {
        return entryAddress;
    }

    public List<BlockOverlap> getOverlaps() {
        return Collections.unmodifiableList(overlaps);
    }

    private static String hex(long address) {
        return "0x" + Long.toHexString(address);
    }
}
