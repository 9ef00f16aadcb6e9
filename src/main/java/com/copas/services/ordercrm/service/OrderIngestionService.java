package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.constants.OrderCrmConstants;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.CustomerData;
import com.copas.services.ordercrm.entity.CustomerOrder;
import com.copas.services.ordercrm.entity.DeliveryLogEntry;
import com.copas.services.ordercrm.exception.OrderNotFoundException;
import com.copas.services.ordercrm.mapper.OrderMapper;
import com.copas.services.ordercrm.repository.CustomerOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * End-to-end flows behind the webhook and the manual resend.
 *
 * Ingest:
 *   validate → resolve customer → resolve phone → upsert
 *   → (new order with phone) dispatch → record attempt
 *
 * Each persistence step commits on its own. No transaction is held open
 * across the WhatsApp call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderIngestionService {

    private final OrderPayloadValidator payloadValidator;
    private final CustomerResolver customerResolver;
    private final PhoneResolver phoneResolver;
    private final OrderUpsertEngine orderUpsertEngine;
    private final NotificationDispatcher notificationDispatcher;
    private final DeliveryLogService deliveryLogService;
    private final CustomerOrderRepository orderRepository;

    public IngestionResult ingest(ShopifyOrderPayload payload) {
        payloadValidator.validate(payload);

        CustomerData customer = payload.getCustomer();
        String shippingPhone = payload.getShippingAddress() != null
                ? payload.getShippingAddress().getPhone() : null;
        Optional<String> phone = phoneResolver.resolve(
                customer != null ? customer.getPhone() : null, shippingPhone);

        String displayName = OrderMapper.displayName(customer);
        CustomerRef customerRef = customerResolver.resolve(
                displayName,
                customer != null ? customer.getEmail() : null,
                phone.orElse(null));

        String notes = phone.isPresent()
                ? payload.getNote()
                : appendNote(payload.getNote(), OrderCrmConstants.NO_CONTACT_NOTE);

        CustomerOrder candidate = OrderMapper.toNewOrder(payload, customerRef, phone.orElse(null), notes);
        UpsertResult upsert = orderUpsertEngine.upsert(payload.getShopifyOrderId().trim(), candidate);
        CustomerOrder order = upsert.order();

        if (!upsert.isNew()) {
            return IngestionResult.replay(order);
        }

        if (phone.isEmpty()) {
            log.warn("Order has no contact number, confirmation not sent: orderId={}, orderNumber={}",
                    order.getId(), order.getOrderNumber());
            return IngestionResult.noContact(order, OrderCrmConstants.ERROR_NO_CONTACT_NUMBER);
        }

        DeliveryOutcome outcome = notificationDispatcher.dispatch(order, phone.get());
        deliveryLogService.record(order.getId(), outcome);
        return IngestionResult.dispatched(order, outcome);
    }

    /**
     * Manual resend from the dashboard. Runs regardless of the current flag
     * and prior attempts, and always appends one log entry.
     */
    public DeliveryLogEntry resend(UUID orderId) {
        CustomerOrder order = orderRepository.findById(orderId)
                .orElseThrow(() -> OrderNotFoundException.withId(orderId));

        log.info("Manual resend requested: orderId={}, orderNumber={}", orderId, order.getOrderNumber());

        String phone = phoneResolver.resolveFor(order).orElse(null);
        DeliveryOutcome outcome = notificationDispatcher.dispatch(order, phone);
        return deliveryLogService.record(orderId, outcome);
    }

    private String appendNote(String existing, String note) {
        if (existing == null || existing.isBlank()) {
            return note;
        }
        return existing.trim() + "\n" + note;
    }
}
