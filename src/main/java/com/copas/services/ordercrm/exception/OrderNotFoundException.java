package com.copas.services.ordercrm.exception;

import java.util.UUID;

/**
 * Thrown when an order is not found
 */
public class OrderNotFoundException extends OrderCrmException {

    public OrderNotFoundException(String message) {
        super(message, "ORDER_NOT_FOUND");
    }

    public static OrderNotFoundException withId(UUID id) {
        return new OrderNotFoundException("Order not found with ID: " + id);
    }
}
