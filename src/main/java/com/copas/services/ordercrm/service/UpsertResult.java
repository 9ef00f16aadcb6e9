package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.entity.CustomerOrder;

/**
 * @param order the stored order (new or pre-existing, never modified on replay)
 * @param isNew true only for the request whose insert created the row
 */
public record UpsertResult(CustomerOrder order, boolean isNew) {
}
