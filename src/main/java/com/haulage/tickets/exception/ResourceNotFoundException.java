package com.haulage.tickets.exception;

/**
 * Requested ticket, review entry or run does not exist.
 */
public class ResourceNotFoundException extends TicketProcessingException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
