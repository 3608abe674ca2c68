package com.haulage.tickets.exception;

/**
 * Base exception for ticket processing errors.
 */
public class TicketProcessingException extends RuntimeException {

    public TicketProcessingException(String message) {
        super(message);
    }

    public TicketProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
