package com.copas.services.ordercrm.config;

import com.copas.services.ordercrm.constants.OrderCrmConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Shared-secret settings for the order intake webhook.
 *
 * Make sends the secret in the {@code X-Webhook-Token} header on every call.
 * Env var: WEBHOOK_SECRET_TOKEN
 */
@Configuration
@ConfigurationProperties(prefix = "webhook")
@Data
public class WebhookProperties {

    /** Expected value of the token header */
    private String secretToken;

    /** Header carrying the token */
    private String tokenHeader = OrderCrmConstants.DEFAULT_WEBHOOK_TOKEN_HEADER;
}
