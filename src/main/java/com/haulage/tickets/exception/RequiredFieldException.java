package com.haulage.tickets.exception;

import com.haulage.tickets.entity.ReviewReason;

/**
 * A required ticket field is missing or malformed. Local to one page: the page
 * is routed to review, the file carries on.
 */
public class RequiredFieldException extends TicketProcessingException {

    private final String fieldName;
    private final ReviewReason reason;

    public RequiredFieldException(String fieldName, ReviewReason reason, String message) {
        super(message);
        this.fieldName = fieldName;
        this.reason = reason;
    }

    public String getFieldName() {
        return fieldName;
    }

    public ReviewReason getReason() {
        return reason;
    }
}
