package com.tracecfg.core.domain;

import java.util.Map;

/**
 * One executed step handed to {@link ControlFlowGraph#execute(long, TraceRecord)}:
 * either a plain {@link InstructionRecord} or a branching {@link JumpRecord}.
 */
public interface TraceRecord {

    String getName();

    /**
     * Text shown in the operand column when a block is rendered.
     */
    String getOperandText();

    /**
     * Builds a record from loosely typed fields, checking each value against the
     * type it stands for. A map carrying {@code kind} or {@code successAddress}
     * becomes a {@link JumpRecord}; anything else an {@link InstructionRecord}.
     *
     * @param fields field name to value; addresses are a {@link Long} holding the
     *               unsigned 64-bit address, or a non-negative Integer, Short or Byte
     * @return the validated record
     * @throws ValidationException naming the first field whose value does not fit
     */
    static TraceRecord fromFields(Map<String, ?> fields) {
        if (fields == null) {
            throw ValidationException.wrongType("fields", null, "Map");
        }
        Object name = fields.get("name");
        if (!(name instanceof String)) {
            throw ValidationException.wrongType("name", name, "String");
        }

        if (fields.containsKey("kind") || fields.containsKey("successAddress")) {
            Object kind = fields.get("kind");
            if (!(kind instanceof JumpKind)) {
                throw ValidationException.wrongType("kind", kind, "JumpKind");
            }
            long successAddress = requireAddress("successAddress", fields.get("successAddress"));
            Object failure = fields.get("failureAddress");
            Long failureAddress = failure == null ? null : requireAddress("failureAddress", failure);
            return new JumpRecord((String) name, successAddress, (JumpKind) kind, failureAddress);
        }

        Object operand = fields.containsKey("operand") ? fields.get("operand") : "";
        if (!(operand instanceof String)) {
            throw ValidationException.wrongType("operand", operand, "String");
        }
        return new InstructionRecord((String) name, (String) operand);
    }

    private static long requireAddress(String field, Object value) {
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            long address = ((Number) value).longValue();
            if (address < 0) {
                throw ValidationException.invalid(field, "address must not be negative, got " + address);
            }
            return address;
        }
        throw ValidationException.wrongType(field, value, "address");
    }
}
