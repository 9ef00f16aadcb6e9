package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.entity.CustomerOrder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Picks the contact number for an order.
 *
 * Candidates are given in priority order: customer phone, then shipping-address
 * phone. The first non-blank one wins, trimmed. This is the single answer to
 * "can we reach this customer" for both ingestion and resend.
 */
@Component
public class PhoneResolver {

    public Optional<String> resolve(String... candidates) {
        if (candidates == null) return Optional.empty();
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return Optional.of(candidate.trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Same rule applied to the fields stored on an already-persisted order.
     */
    public Optional<String> resolveFor(CustomerOrder order) {
        return resolve(order.getCustomerPhone(), order.getShippingPhone());
    }
}
