package com.copas.services.ordercrm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Typed config properties for the WhatsApp Cloud API (Meta Graph API).
 *
 * Bound from application.yaml under prefix "whatsapp":
 * ┌─────────────────────────────────────────────────────────────────┐
 * │  whatsapp:                                                      │
 * │    graph-api-base-url:  https://graph.facebook.com             │
 * │    graph-api-version:   v18.0                                  │
 * │    phone-number-id:     ${WHATSAPP_PHONE_NUMBER_ID}            │
 * │    access-token:        ${WHATSAPP_ACCESS_TOKEN}               │
 * │    template-name:       ${WHATSAPP_TEMPLATE_NAME}              │
 * │    template-language:   ${WHATSAPP_TEMPLATE_LANGUAGE}          │
 * │    default-country-code: "57"                                  │
 * │    send-timeout:        30s                                    │
 * └─────────────────────────────────────────────────────────────────┘
 *
 * The access token is a secret: never log or expose it.
 */
@Configuration
@ConfigurationProperties(prefix = "whatsapp")
@Data
public class WhatsAppProperties {

    /** Base URL for Graph API (override in tests with WireMock) */
    private String graphApiBaseUrl = "https://graph.facebook.com";

    /** Graph API version to use for all calls (e.g. "v18.0") */
    private String graphApiVersion = "v18.0";

    /** Sender phone number ID from the WhatsApp Business Account */
    private String phoneNumberId;

    /** Permanent system-user access token with whatsapp_business_messaging scope */
    private String accessToken;

    /** Approved message template used for order confirmations */
    private String templateName = "order_confirmation";

    /** Template locale code as approved in Meta Business Manager */
    private String templateLanguage = "es";

    /** Prepended to 10-digit local mobile numbers (Colombia) */
    private String defaultCountryCode = "57";

    /** Upper bound for a single send, on top of the HTTP client timeouts */
    private Duration sendTimeout = Duration.ofSeconds(30);

    /**
     * Build the full versioned Graph API base URL.
     * Example: https://graph.facebook.com/v18.0
     */
    public String getVersionedBaseUrl() {
        return graphApiBaseUrl + "/" + graphApiVersion;
    }

    /**
     * True when both sender ID and token are present.
     */
    public boolean isConfigured() {
        return phoneNumberId != null && !phoneNumberId.isBlank()
                && accessToken != null && !accessToken.isBlank();
    }
}
