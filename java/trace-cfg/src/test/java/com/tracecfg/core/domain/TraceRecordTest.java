package com.tracecfg.core.domain;

import java.util.HashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

public class TraceRecordTest {

    @Test
    public void instructionDefaultsToEmptyOperand() {
        InstructionRecord nop = new InstructionRecord("NOP");
        Assert.assertEquals("NOP", nop.getName());
        Assert.assertEquals("", nop.getOperand());
    }

    @Test
    public void recordsCompareStructurally() {
        Assert.assertEquals(new InstructionRecord("LOAD", "1"), new InstructionRecord("LOAD", "1"));
        Assert.assertEquals(new InstructionRecord("LOAD", "1").hashCode(),
            new InstructionRecord("LOAD", "1").hashCode());
        Assert.assertNotEquals(new InstructionRecord("LOAD", "1"), new InstructionRecord("LOAD", "2"));

        Assert.assertEquals(JumpRecord.branchTaken("JNE", 10, 5), JumpRecord.branchTaken("JNE", 10, 5));
        Assert.assertNotEquals(JumpRecord.branchTaken("JNE", 10, 5), JumpRecord.branchNotTaken("JNE", 10, 5));
        Assert.assertNotEquals(JumpRecord.unconditional("JMP", 10), new InstructionRecord("JMP", "0xa"));
    }

    @Test
    public void conditionalJumpWithoutFailureAddressIsRejected() {
        for (JumpKind kind : new JumpKind[] {JumpKind.BRANCH_TAKEN, JumpKind.BRANCH_NOT_TAKEN}) {
            try {
                new JumpRecord("JNE", 10, kind, null);
                Assert.fail("expected ValidationException for " + kind);
            } catch (ValidationException e) {
                Assert.assertEquals("failureAddress", e.getField());
                Assert.assertTrue(e.getMessage().contains(kind.toString()));
            }
        }
    }

    @Test
    public void unconditionalJumpNeedsNoFailureAddress() {
        JumpRecord jump = JumpRecord.unconditional("JMP", 0x10);
        Assert.assertFalse(jump.hasFailureAddress());
        Assert.assertEquals(0x10, jump.getSuccessAddress());
        Assert.assertEquals("0x10", jump.getOperandText());
    }

    @Test(expected = IllegalStateException.class)
    public void missingFailureAddressCannotBeRead() {
        JumpRecord.unconditional("JMP", 0x10).getFailureAddress();
    }

    @Test
    public void nullFieldsNameTheField() {
        try {
            new InstructionRecord(null, "1");
            Assert.fail();
        } catch (ValidationException e) {
            Assert.assertEquals("name", e.getField());
            Assert.assertEquals("The field `name` was assigned by `null` instead of `String`", e.getMessage());
        }
        try {
            new JumpRecord("JMP", 1, null, null);
            Assert.fail();
        } catch (ValidationException e) {
            Assert.assertEquals("kind", e.getField());
        }
    }

    @Test
    public void upperHalfAddressesAreAccepted() {
        JumpRecord jump = JumpRecord.branchTaken("JNE", 0xffffffff81000000L, 0xffffffff81000004L);
        Assert.assertEquals("0xffffffff81000000", jump.getOperandText());
        Assert.assertEquals(0xffffffff81000004L, jump.getFailureAddress());

        Map<String, Object> fields = new HashMap<>();
        fields.put("name", "JMP");
        fields.put("kind", JumpKind.UNCONDITIONAL);
        fields.put("successAddress", 0xffffffff81000000L);
        Assert.assertEquals(JumpRecord.unconditional("JMP", 0xffffffff81000000L), TraceRecord.fromFields(fields));
    }

    @Test
    public void negativeNarrowAddressIsRejected() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", "JMP");
        fields.put("kind", JumpKind.UNCONDITIONAL);
        fields.put("successAddress", -1);
        try {
            TraceRecord.fromFields(fields);
            Assert.fail();
        } catch (ValidationException e) {
            Assert.assertEquals("successAddress", e.getField());
        }
    }

    @Test
    public void fromFieldsBuildsInstruction() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", "PUSH");
        fields.put("operand", "1");
        Assert.assertEquals(new InstructionRecord("PUSH", "1"), TraceRecord.fromFields(fields));
    }

    @Test
    public void fromFieldsBuildsJump() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", "JNE");
        fields.put("kind", JumpKind.BRANCH_NOT_TAKEN);
        fields.put("successAddress", 10);
        fields.put("failureAddress", 5L);
        Assert.assertEquals(JumpRecord.branchNotTaken("JNE", 10, 5), TraceRecord.fromFields(fields));
    }

    @Test
    public void fromFieldsReportsSuppliedType() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", "JMP");
        fields.put("kind", JumpKind.UNCONDITIONAL);
        fields.put("successAddress", "0x10");
        try {
            TraceRecord.fromFields(fields);
            Assert.fail();
        } catch (ValidationException e) {
            Assert.assertEquals("successAddress", e.getField());
            Assert.assertEquals(
                "The field `successAddress` was assigned by `java.lang.String` instead of `address`",
                e.getMessage());
        }

        Map<String, Object> instruction = new HashMap<>();
        instruction.put("name", 42);
        try {
            TraceRecord.fromFields(instruction);
            Assert.fail();
        } catch (ValidationException e) {
            Assert.assertEquals("name", e.getField());
            Assert.assertTrue(e.getMessage().contains("java.lang.Integer"));
        }
    }

    @Test
    public void fromFieldsRejectsConditionalWithoutFailure() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", "JE");
        fields.put("kind", JumpKind.BRANCH_TAKEN);
        fields.put("successAddress", 7L);
        try {
            TraceRecord.fromFields(fields);
            Assert.fail();
        } catch (ValidationException e) {
            Assert.assertEquals("failureAddress", e.getField());
        }
    }
}
