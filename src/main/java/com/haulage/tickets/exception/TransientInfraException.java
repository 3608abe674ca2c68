package com.haulage.tickets.exception;

/**
 * A failure that may succeed if the file is attempted again: timeouts,
 * extraction-service errors, momentary database contention.
 */
public class TransientInfraException extends TicketProcessingException {

    private final String sourceFile;

    public TransientInfraException(String message, String sourceFile) {
        super(message);
        this.sourceFile = sourceFile;
    }

    public TransientInfraException(String message, String sourceFile, Throwable cause) {
        super(message, cause);
        this.sourceFile = sourceFile;
    }

    public String getSourceFile() {
        return sourceFile;
    }
}
