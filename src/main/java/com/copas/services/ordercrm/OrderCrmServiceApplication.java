package com.copas.services.ordercrm;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the COPAS Order CRM service
 *
 * This service handles:
 * - Shopify order intake (mapped and forwarded by Make)
 * - Customer deduplication by email
 * - Idempotent order persistence keyed by Shopify order ID
 * - WhatsApp order confirmation via Meta Cloud API templates
 * - Delivery log and manual resend for the CRM dashboard
 *
 * @author COPAS Team
 * @version 1.0.0
 */
@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "COPAS CRM API",
                version = "1.0.0",
                description = "Shopify order CRM with WhatsApp order confirmations. " +
                        "Direct Meta Cloud API integration.",
                contact = @Contact(
                        name = "COPAS Support",
                        email = "soporte@copas.co"
                )
        ),
        servers = {
                @Server(url = "http://localhost:8000", description = "Local Development")
        }
)
public class OrderCrmServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderCrmServiceApplication.class, args);
    }
}
