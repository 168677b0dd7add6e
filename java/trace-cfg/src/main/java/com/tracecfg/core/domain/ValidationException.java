package com.tracecfg.core.domain;

/**
 * Thrown when a trace record is built from a field of the wrong semantic type,
 * when a conditional jump is missing its failure address, or when a trace line
 * cannot be parsed into a record.
 */
public class ValidationException extends IllegalArgumentException {
    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public static ValidationException wrongType(String field, Object supplied, String expected) {
        String suppliedType = supplied == null ? "null" : supplied.getClass().getName();
        return new ValidationException(field,
            "The field `" + field + "` was assigned by `" + suppliedType + "` instead of `" + expected + "`");
    }

    public static ValidationException invalid(String field, String reason) {
        return new ValidationException(field, "The field `" + field + "` is invalid: " + reason);
    }

    /**
     * Same failure, prefixed with the trace line it came from.
     */
    public ValidationException atLine(int lineNumber) {
        return new ValidationException(field, "line " + lineNumber + ": " + getMessage(), this);
    }

    public String getField() {
        return field;
    }
}
