package com.copas.services.ordercrm.constants;

/**
 * Application-wide constants for the order CRM service
 */
public final class OrderCrmConstants {

    private OrderCrmConstants() {
        throw new IllegalStateException("Constants class cannot be instantiated");
    }

    // API Versioning
    public static final String API_V1 = "/api/v1";

    // Meta API Constants
    public static final String META_MESSAGING_PRODUCT = "whatsapp";
    public static final String META_MESSAGE_TYPE_TEMPLATE = "template";

    // Webhook
    public static final String DEFAULT_WEBHOOK_TOKEN_HEADER = "X-Webhook-Token";

    // Order defaults
    public static final String DEFAULT_CURRENCY = "COP";
    public static final String DEFAULT_CUSTOMER_NAME = "Cliente";
    public static final String NO_CONTACT_NOTE = "[no contact number: confirmation not sent]";


    // Error Messages
    public static final String ERROR_NO_CONTACT_NUMBER = "No contact number on order";

    // Success Messages
    public static final String SUCCESS_ORDER_RECEIVED = "Order received";
    public static final String SUCCESS_ORDER_DUPLICATE = "Order already registered, no changes";
    public static final String SUCCESS_NOTIFICATION_RESENT = "WhatsApp confirmation resent";
}
