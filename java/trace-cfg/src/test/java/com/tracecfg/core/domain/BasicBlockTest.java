package com.tracecfg.core.domain;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

public class BasicBlockTest {

    @Test
    public void reexecutedAddressKeepsFirstRecord() {
        BasicBlock block = new BasicBlock(0, 0x10);
        block.addInstruction(0x10, new InstructionRecord("LOAD", "1"));
        block.addInstruction(0x11, new InstructionRecord("ADD", "2"));
        block.addInstruction(0x10, new InstructionRecord("STORE", "9"));

        Assert.assertEquals(2, block.getInstructionCount());
        Assert.assertEquals(new InstructionRecord("LOAD", "1"), block.getInstruction(0x10));
        Assert.assertEquals(Arrays.asList(0x10L, 0x11L), new ArrayList<>(block.getAddresses()));
        Assert.assertEquals(0x10, block.getStartAddress());
        Assert.assertEquals(0x11, block.getEndAddress());
    }

    @Test(expected = SequenceException.class)
    public void addressBelowStartIsRejected() {
        new BasicBlock(0, 0x10).addInstruction(0x0f, new InstructionRecord("NOP"));
    }

    @Test(expected = IllegalStateException.class)
    public void unexploredBlockHasNoEnd() {
        new BasicBlock(3, 0x40).getEndAddress();
    }

    @Test
    public void edgeRegistersAtZeroAndCountsTraversals() {
        BasicBlock block = new BasicBlock(0, 0);
        block.addEdge(2, false);
        Assert.assertTrue(block.hasEdge(2));
        Assert.assertEquals(0, block.getTraversalCount(2));

        block.addEdge(2, true);
        block.addEdge(2, true);
        block.addEdge(1, true);
        Assert.assertEquals(2, block.getTraversalCount(2));
        Assert.assertEquals(1, block.getTraversalCount(1));
        Assert.assertEquals(-1, block.getTraversalCount(7));
        Assert.assertEquals(2, block.getEdgeCount());
    }

    @Test
    public void edgesIterateInRegistrationOrderAndStayLive() {
        BasicBlock block = new BasicBlock(0, 0);
        block.addEdge(5, false);
        block.addEdge(3, true);
        Iterable<BlockEdge> edges = block.edges();

        List<String> first = describe(edges);
        Assert.assertEquals(Arrays.asList("0:5=0", "1:3=1"), first);

        block.addEdge(5, true);
        block.addEdge(9, false);
        Assert.assertEquals(Arrays.asList("0:5=1", "1:3=1", "2:9=0"), describe(edges));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void edgesCannotBeRemovedThroughIterator() {
        BasicBlock block = new BasicBlock(0, 0);
        block.addEdge(1, true);
        Iterator<BlockEdge> iterator = block.edges().iterator();
        iterator.next();
        iterator.remove();
    }

    @Test(expected = UnsupportedOperationException.class)
    public void addressesAreReadOnly() {
        BasicBlock block = new BasicBlock(0, 0);
        block.addInstruction(1, new InstructionRecord("NOP"));
        block.getAddresses().clear();
    }

    @Test
    public void rendersFixedWidthColumns() {
        BasicBlock block = new BasicBlock(0, 0);
        block.addInstruction(1, new InstructionRecord("LOAD", "1"));
        block.addInstruction(2, JumpRecord.unconditional("JMP", 0x1f));

        String expected =
            "0x1              LOAD         1           \n"
                + "0x2              JMP          0x1f        \n";
        Assert.assertEquals(expected, block.toString());
    }

    @Test
    public void escapedRenderingIsSingleLine() {
        BasicBlock block = new BasicBlock(0, 0);
        block.addInstruction(1, new InstructionRecord("MOV", "\"a\""));
        block.addInstruction(2, new InstructionRecord("RET"));

        String escaped = block.toEscapedString();
        Assert.assertFalse(escaped.contains("\n"));
        Assert.assertTrue(escaped.endsWith("\\n"));
        Assert.assertTrue(escaped.contains("\\\"a\\\""));
        Assert.assertEquals(2, escaped.split("\\\\n", -1).length - 1);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void traversalCountGrowsPastIntRange() throws Exception {
        BasicBlock block = new BasicBlock(0, 0);
        block.addEdge(1, false);
        Field field = BasicBlock.class.getDeclaredField("edgeCounts");
        field.setAccessible(true);
        ((Map<Integer, Long>) field.get(block)).put(1, (long) Integer.MAX_VALUE);

        block.addEdge(1, true);

        Assert.assertEquals(2147483648L, block.getTraversalCount(1));
        Assert.assertEquals(2147483648L, block.edges().iterator().next().getTraversalCount());
    }

    private static List<String> describe(Iterable<BlockEdge> edges) {
        List<String> described = new ArrayList<>();
        for (BlockEdge edge : edges) {
            described.add(edge.getOrdinal() + ":" + edge.getTargetIndex() + "=" + edge.getTraversalCount());
        }
        return described;
    }
}
