package com.copas.services.ordercrm.exception;

import lombok.Getter;

/**
 * Base exception for all order CRM service exceptions
 */
@Getter
public class OrderCrmException extends RuntimeException {

    private final String errorCode;

    public OrderCrmException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public OrderCrmException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
