package com.haulage.tickets.exception;

/**
 * Unrecoverable infrastructure failure, such as losing the persistence backend.
 * Aborts the whole run instead of failing a single file.
 */
public class TerminalInfraException extends TicketProcessingException {

    public TerminalInfraException(String message) {
        super(message);
    }

    public TerminalInfraException(String message, Throwable cause) {
        super(message, cause);
    }
}
