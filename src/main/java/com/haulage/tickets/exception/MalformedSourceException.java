package com.haulage.tickets.exception;

/**
 * The source file itself cannot be processed. Retrying will not help.
 */
public class MalformedSourceException extends TicketProcessingException {

    private final String sourceFile;

    public MalformedSourceException(String message, String sourceFile) {
        super(message);
        this.sourceFile = sourceFile;
    }

    public MalformedSourceException(String message, String sourceFile, Throwable cause) {
        super(message, cause);
        this.sourceFile = sourceFile;
    }

    public String getSourceFile() {
        return sourceFile;
    }
}
