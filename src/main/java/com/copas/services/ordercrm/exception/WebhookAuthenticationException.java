package com.copas.services.ordercrm.exception;

/**
 * Thrown when the webhook shared secret is missing or wrong.
 * Raised before any validation or persistence.
 */
public class WebhookAuthenticationException extends OrderCrmException {

    public WebhookAuthenticationException(String message) {
        super(message, "WEBHOOK_AUTH_FAILED");
    }

    public static WebhookAuthenticationException missingToken(String header) {
        return new WebhookAuthenticationException("Missing webhook token header " + header);
    }

    public static WebhookAuthenticationException invalidToken() {
        return new WebhookAuthenticationException("Invalid webhook token");
    }
}
