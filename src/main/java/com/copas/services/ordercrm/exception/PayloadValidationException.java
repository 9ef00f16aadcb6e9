package com.copas.services.ordercrm.exception;

import lombok.Getter;

/**
 * Thrown when an inbound order payload is malformed.
 * Carries the offending field path (e.g. "line_items[0].quantity").
 */
@Getter
public class PayloadValidationException extends OrderCrmException {

    private final String field;

    public PayloadValidationException(String field, String message) {
        super(message, "VALIDATION_ERROR");
        this.field = field;
    }

    public static PayloadValidationException required(String field) {
        return new PayloadValidationException(field, field + " is required");
    }
}
