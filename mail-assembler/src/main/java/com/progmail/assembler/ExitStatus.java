package com.progmail.assembler;

/**
 * Process exit codes. Every fatal condition has its own code.
 */
public enum ExitStatus {
    SUCCESS(0),
    BAD_PARAMETERS(1),
    MISSING_INPUT(2),
    UNBALANCED_MARKUP(3),
    MALFORMED_TEMPLATE(4),
    MISSING_COLUMN(5),
    IO_FAILURE(6);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
