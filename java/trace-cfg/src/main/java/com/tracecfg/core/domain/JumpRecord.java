package com.tracecfg.core.domain;

import java.util.Objects;

// ============================================
// JumpRecord: step that transfers control
// ============================================
public final class JumpRecord implements TraceRecord {
    private final String name;
    private final long successAddress;
    private final JumpKind kind;
    private final Long failureAddress;

    /**
     * @param failureAddress fall-through target; required for conditional kinds,
     *                       ignored by {@link JumpKind#UNCONDITIONAL}, may be null
     * @throws ValidationException if a field is missing, or a
     *                             conditional jump has no failure address
     */
    public JumpRecord(String name, long successAddress, JumpKind kind, Long failureAddress) {
        if (name == null) {
            throw ValidationException.wrongType("name", null, "String");
        }
        if (kind == null) {
            throw ValidationException.wrongType("kind", null, "JumpKind");
        }
        if (kind.isConditional() && failureAddress == null) {
            throw new ValidationException("failureAddress",
                "The jump kind " + kind + " requires a failure address, in addition to the success address.");
        }
        this.name = name;
        this.successAddress = successAddress;
        this.kind = kind;
        this.failureAddress = failureAddress;
    }

    public static JumpRecord unconditional(String name, long target) {
        return new JumpRecord(name, target, JumpKind.UNCONDITIONAL, null);
    }

    public static JumpRecord branchTaken(String name, long successAddress, long failureAddress) {
        return new JumpRecord(name, successAddress, JumpKind.BRANCH_TAKEN, failureAddress);
    }

    public static JumpRecord branchNotTaken(String name, long successAddress, long failureAddress) {
        return new JumpRecord(name, successAddress, JumpKind.BRANCH_NOT_TAKEN, failureAddress);
    }

    @Override
    public String getName() {
        return name;
    }

    public long getSuccessAddress() {
        return successAddress;
    }

    public JumpKind getKind() {
        return kind;
    }

    public boolean hasFailureAddress() {
        return failureAddress != null;
    }

    public long getFailureAddress() {
        if (failureAddress == null) {
            throw new IllegalStateException(name + " has no failure address");
        }
        return failureAddress;
    }

    @Override
    public String getOperandText() {
        return "0x" + Long.toHexString(successAddress);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JumpRecord)) {
            return false;
        }
        JumpRecord other = (JumpRecord) o;
        return successAddress == other.successAddress
            && name.equals(other.name)
            && kind == other.kind
            && Objects.equals(failureAddress, other.failureAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, successAddress, kind, failureAddress);
    }

    @Override
    public String toString() {
        return "JumpRecord{name=" + name
            + ", successAddress=0x" + Long.toHexString(successAddress)
            + ", kind=" + kind
            + (failureAddress == null ? "" : ", failureAddress=0x" + Long.toHexString(failureAddress))
            + "}";
    }
}
