package com.progmail.assembler;

/**
 * A fatal condition that ends the run without writing the email file.
 */
public class AssemblyException extends Exception {

    private final ExitStatus status;

    public AssemblyException(ExitStatus status, String message) {
        super(message);
        this.status = status;
    }

    public AssemblyException(ExitStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public ExitStatus getStatus() {
        return status;
    }
}
