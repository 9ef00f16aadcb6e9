package com.copas.services.ordercrm.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Classified result of one dispatch attempt.
 * messageId is set only on success, errorMessage only on failure.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DeliveryOutcome {

    private final boolean success;
    private final String messageId;
    private final String errorMessage;

    public static DeliveryOutcome success(String messageId) {
        return new DeliveryOutcome(true, messageId, null);
    }

    public static DeliveryOutcome failure(String errorMessage) {
        return new DeliveryOutcome(false, null, errorMessage);
    }
}
