package com.tracecfg.core.domain;

import java.util.Objects;

// ============================================
// InstructionRecord: plain, non-branching step
// ============================================
public final class InstructionRecord implements TraceRecord {
    private final String name;
    private final String operand;

    public InstructionRecord(String name, String operand) {
        if (name == null) {
            throw ValidationException.wrongType("name", null, "String");
        }
        if (operand == null) {
            throw ValidationException.wrongType("operand", null, "String");
        }
        this.name = name;
        this.operand = operand;
    }

    public InstructionRecord(String name) {
        this(name, "");
    }

    @Override
    public String getName() {
        return name;
    }

    public String getOperand() {
        return operand;
    }

    @Override
    public String getOperandText() {
        return operand;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InstructionRecord)) {
            return false;
        }
        InstructionRecord other = (InstructionRecord) o;
        return name.equals(other.name) && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, operand);
    }

    @Override
    public String toString() {
        return "InstructionRecord{name=" + name + ", operand=" + operand + "}";
    }
}
