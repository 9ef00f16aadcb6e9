package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.client.WhatsAppCloudApiClient;
import com.copas.services.ordercrm.config.WhatsAppProperties;
import com.copas.services.ordercrm.constants.OrderCrmConstants;
import com.copas.services.ordercrm.entity.CustomerOrder;
import com.copas.services.ordercrm.exception.WhatsAppApiException;
import com.copas.services.ordercrm.repository.CustomerOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Sends the order-confirmation template and classifies the result.
 *
 * Provider problems (HTTP errors, timeouts, open circuit, bad number, missing
 * credentials) never escape: they come back as a failed DeliveryOutcome for
 * the caller to record. After every attempt the order's whatsapp_sent flag is
 * set to the outcome; whatsapp_sent_at is stamped only on success. A failed
 * flag update is logged and does not stop the outcome from being returned.
 *
 * Template body parameters, in order:
 *   {{1}} customer first name   "Ana"
 *   {{2}} order number          "#1001"
 *   {{3}} formatted total       "COP 150000.00"
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final WhatsAppCloudApiClient whatsAppClient;
    private final WhatsAppProperties whatsAppProperties;
    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final CustomerOrderRepository orderRepository;

    /**
     * @param phone contact number chosen by PhoneResolver; null when the order has none
     */
    public DeliveryOutcome dispatch(CustomerOrder order, String phone) {
        DeliveryOutcome outcome = send(order, phone);
        applyOutcome(order, outcome);
        return outcome;
    }

    private DeliveryOutcome send(CustomerOrder order, String phone) {
        if (phone == null || phone.isBlank()) {
            return DeliveryOutcome.failure(OrderCrmConstants.ERROR_NO_CONTACT_NUMBER);
        }
        if (!whatsAppProperties.isConfigured()) {
            log.warn("WhatsApp not configured, confirmation skipped: orderId={}", order.getId());
            return DeliveryOutcome.failure(
                    "WhatsApp is not configured: set WHATSAPP_PHONE_NUMBER_ID and WHATSAPP_ACCESS_TOKEN");
        }

        Optional<String> destination = phoneNumberNormalizer.normalize(phone);
        if (destination.isEmpty()) {
            log.warn("Unusable contact number: orderId={}", order.getId());
            return DeliveryOutcome.failure("Invalid phone number: '" + phone + "'");
        }

        try {
            String messageId = whatsAppClient.sendTemplateMessage(destination.get(), templateParameters(order));
            log.info("Order confirmation sent: orderId={}, messageId={}", order.getId(), messageId);
            return DeliveryOutcome.success(messageId);
        } catch (WhatsAppApiException ex) {
            log.warn("Order confirmation failed: orderId={}, error={}", order.getId(), ex.getMessage());
            return DeliveryOutcome.failure(ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Order confirmation failed unexpectedly: orderId={}", order.getId(), ex);
            return DeliveryOutcome.failure("Unexpected error: " + ex.getMessage());
        }
    }

    List<String> templateParameters(CustomerOrder order) {
        return List.of(
                firstName(order.getCustomerName()),
                order.getOrderNumber(),
                order.getCurrency() + " " + order.getTotalPrice()
        );
    }

    private String firstName(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return OrderCrmConstants.DEFAULT_CUSTOMER_NAME;
        }
        return displayName.trim().split("\\s+")[0];
    }

    private void applyOutcome(CustomerOrder order, DeliveryOutcome outcome) {
        LocalDateTime now = LocalDateTime.now();
        try {
            if (outcome.isSuccess()) {
                orderRepository.markNotificationSent(order.getId(), now);
            } else {
                orderRepository.markNotificationFailed(order.getId(), now);
            }
        } catch (DataAccessException ex) {
            // Not rethrown: the caller still records the attempt.
            log.error("Could not update notification flag: orderId={}, success={}, error={}",
                    order.getId(), outcome.isSuccess(), ex.getMessage());
        }
    }
}
