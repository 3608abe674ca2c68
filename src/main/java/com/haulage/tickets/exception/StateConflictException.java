package com.haulage.tickets.exception;

/**
 * The requested operation conflicts with the current state of a run or review
 * entry, for example cancelling a run that already finished or resolving an
 * entry twice.
 */
public class StateConflictException extends TicketProcessingException {

    public StateConflictException(String message) {
        super(message);
    }
}
