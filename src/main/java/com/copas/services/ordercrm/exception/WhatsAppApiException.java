package com.copas.services.ordercrm.exception;

import lombok.Getter;

/**
 * Thrown when the WhatsApp Cloud API returns an error or is unavailable.
 *
 * Never reaches an HTTP caller: NotificationDispatcher turns it into a
 * failed delivery outcome.
 *
 * Has two types:
 * - WhatsAppApiException: server errors (5xx), timeouts, open circuit
 * - WhatsAppApiException.ClientException: client errors (4xx)
 */
@Getter
public class WhatsAppApiException extends OrderCrmException {

    private final int httpStatus;

    public WhatsAppApiException(String message) {
        super(message, "WHATSAPP_API_ERROR");
        this.httpStatus = 503;
    }

    public WhatsAppApiException(String message, int httpStatus) {
        super(message, "WHATSAPP_API_ERROR");
        this.httpStatus = httpStatus;
    }

    public WhatsAppApiException(String message, Throwable cause) {
        super(message, "WHATSAPP_API_ERROR", cause);
        this.httpStatus = 503;
    }

    public static WhatsAppApiException serviceUnavailable() {
        return new WhatsAppApiException(
                "WhatsApp API is temporarily unavailable (circuit open)"
        );
    }

    public static WhatsAppApiException timeout(java.time.Duration limit) {
        return new WhatsAppApiException(
                "WhatsApp API did not answer within " + limit.toMillis() + "ms", 504
        );
    }

    // ========================
    // INNER CLASS
    // 4xx errors
    // ========================

    /**
     * Represents a 4xx client error from the WhatsApp API
     * (bad template, invalid recipient, expired token, ...)
     */
    @Getter
    public static class ClientException extends WhatsAppApiException {

        public ClientException(String message, int httpStatus) {
            super(message, httpStatus);
        }
    }
}
