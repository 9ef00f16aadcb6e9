package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.constants.CrmStatus;
import com.copas.services.ordercrm.entity.CustomerOrder;
import com.copas.services.ordercrm.exception.InvalidRequestException;
import com.copas.services.ordercrm.exception.OrderNotFoundException;
import com.copas.services.ordercrm.exception.StorageException;
import com.copas.services.ordercrm.repository.CustomerOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Create-once storage of orders, plus the CRM status state machine.
 *
 * ═══════════════════════════════════════════════════════════════════
 * IDEMPOTENCY
 * ═══════════════════════════════════════════════════════════════════
 *
 * Shopify (through Make) delivers at least once, sometimes twice within
 * milliseconds. An existing shopify_order_id is returned untouched with
 * isNew=false. A new one is inserted with saveAndFlush in its own
 * transaction; if a concurrent request won the race, the unique constraint
 * rejects ours and we return the winner's row, also with isNew=false.
 *
 * ═══════════════════════════════════════════════════════════════════
 * STATE MACHINE
 * ═══════════════════════════════════════════════════════════════════
 *
 * nuevo → en_proceso → enviado → completado, cancelado from anywhere.
 * Sequencing is operator discretion: any value may follow any other,
 * including leaving cancelado. Only membership in the five values is enforced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderUpsertEngine {

    private final CustomerOrderRepository orderRepository;

    public UpsertResult upsert(String shopifyOrderId, CustomerOrder candidate) {
        try {
            Optional<CustomerOrder> existing = orderRepository.findByShopifyOrderId(shopifyOrderId);
            if (existing.isPresent()) {
                log.info("Order already registered, replay ignored: shopifyOrderId={}", shopifyOrderId);
                return new UpsertResult(existing.get(), false);
            }

            candidate.setShopifyOrderId(shopifyOrderId);
            candidate.setStatus(CrmStatus.NUEVO);
            candidate.setNotificationSent(false);
            candidate.setNotificationSentAt(null);

            try {
                CustomerOrder saved = orderRepository.saveAndFlush(candidate);
                log.info("Order created: id={}, shopifyOrderId={}, orderNumber={}",
                        saved.getId(), shopifyOrderId, saved.getOrderNumber());
                return new UpsertResult(saved, true);
            } catch (DataIntegrityViolationException ex) {
                log.warn("Race on order insert, returning winner: shopifyOrderId={}", shopifyOrderId);
                CustomerOrder winner = orderRepository.findByShopifyOrderId(shopifyOrderId)
                        .orElseThrow(() -> new StorageException(
                                "Order insert conflicted but no row exists for shopify_order_id " + shopifyOrderId, ex));
                return new UpsertResult(winner, false);
            }
        } catch (StorageException ex) {
            throw ex;
        } catch (DataAccessException ex) {
            log.error("Order upsert failed: shopifyOrderId={}, error={}", shopifyOrderId, ex.getMessage());
            throw new StorageException("Could not store order " + shopifyOrderId, ex);
        }
    }

    /**
     * Operator status change. A non-null note replaces the current notes,
     * a null note keeps them.
     */
    @Transactional
    public CustomerOrder updateStatus(UUID orderId, String status, String note) {
        CrmStatus newStatus;
        try {
            newStatus = CrmStatus.fromValue(status);
        } catch (IllegalArgumentException ex) {
            throw InvalidRequestException.invalidStatus(status);
        }

        CustomerOrder order = orderRepository.findById(orderId)
                .orElseThrow(() -> OrderNotFoundException.withId(orderId));

        CrmStatus previous = order.getStatus();
        order.changeStatus(newStatus, note, LocalDateTime.now());
        CustomerOrder saved = orderRepository.save(order);

        log.info("Order status changed: id={}, {} → {}", orderId, previous.getValue(), newStatus.getValue());
        return saved;
    }
}
