package com.copas.services.ordercrm.exception;

import com.copas.services.ordercrm.constants.CrmStatus;

/**
 * Thrown for invalid management requests
 */
public class InvalidRequestException extends OrderCrmException {

    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }

    public static InvalidRequestException invalidStatus(String status) {
        return new InvalidRequestException(
                "Invalid status '" + status + "'. Use one of: " + CrmStatus.allowedValues()
        );
    }
}
