package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.entity.CustomerOrder;

/**
 * Outcome of one webhook delivery.
 *
 * @param outcome null on replay and when the order has no contact number
 */
public record IngestionResult(CustomerOrder order, boolean isNew, DeliveryOutcome outcome, String notificationError) {

    static IngestionResult replay(CustomerOrder order) {
        return new IngestionResult(order, false, null, null);
    }

    static IngestionResult noContact(CustomerOrder order, String reason) {
        return new IngestionResult(order, true, null, reason);
    }

    static IngestionResult dispatched(CustomerOrder order, DeliveryOutcome outcome) {
        return new IngestionResult(order, true, outcome, outcome.getErrorMessage());
    }

    public boolean notificationSent() {
        return outcome != null && outcome.isSuccess();
    }
}
