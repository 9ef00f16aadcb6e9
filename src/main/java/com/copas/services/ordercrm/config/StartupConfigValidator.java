package com.copas.services.ordercrm.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Fail-fast validation for required configuration.
 *
 * The webhook secret is mandatory: without it the intake endpoint would accept
 * orders from anyone. WhatsApp credentials are only recommended; when they are
 * missing, orders are still stored and every dispatch is logged as a failure
 * until they are set.
 *
 * Required env vars:
 *   - WEBHOOK_SECRET_TOKEN → webhook.secret-token
 *
 * Recommended env vars:
 *   - WHATSAPP_PHONE_NUMBER_ID → whatsapp.phone-number-id
 *   - WHATSAPP_ACCESS_TOKEN    → whatsapp.access-token
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class StartupConfigValidator {

    private final WebhookProperties webhookProperties;
    private final WhatsAppProperties whatsAppProperties;

    // Placeholder values that indicate config was not properly set
    private static final Set<String> PLACEHOLDER_VALUES = Set.of(
            "",
            "your-webhook-secret",
            "changeme",
            "null",
            "undefined",
            "${WEBHOOK_SECRET_TOKEN}"
    );

    @PostConstruct
    public void validateConfig() {
        log.info("Validating order CRM configuration...");

        validateRequired("WEBHOOK_SECRET_TOKEN", "webhook.secret-token", webhookProperties.getSecretToken());

        if (!whatsAppProperties.isConfigured()) {
            log.warn("WHATSAPP_PHONE_NUMBER_ID or WHATSAPP_ACCESS_TOKEN is not set. " +
                    "Orders will be stored, but every WhatsApp confirmation will be logged as failed " +
                    "until both are configured.");
        }

        log.info("Configuration validated. WhatsApp template={}, language={}, timeout={}",
                whatsAppProperties.getTemplateName(),
                whatsAppProperties.getTemplateLanguage(),
                whatsAppProperties.getSendTimeout());
    }

    private void validateRequired(String envVar, String configKey, String value) {
        if (isNullOrPlaceholder(value)) {
            String message = String.format(
                    "%n%n" +
                            "╔══════════════════════════════════════════════════════════════╗%n" +
                            "║  STARTUP FAILED: Missing Required Configuration              ║%n" +
                            "╠══════════════════════════════════════════════════════════════╣%n" +
                            "║  Config key : %-48s ║%n" +
                            "║  Env var    : %-48s ║%n" +
                            "║                                                              ║%n" +
                            "║  Set the environment variable before starting the service:   ║%n" +
                            "║  export %s=<your-value>%n" +
                            "╚══════════════════════════════════════════════════════════════╝%n",
                    configKey, envVar, envVar
            );
            throw new IllegalStateException(message);
        }
    }

    private boolean isNullOrPlaceholder(String value) {
        if (value == null) return true;
        return PLACEHOLDER_VALUES.contains(value.trim().toLowerCase())
                || PLACEHOLDER_VALUES.contains(value.trim());
    }
}
