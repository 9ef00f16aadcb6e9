package com.copas.services.ordercrm.service;

import java.util.UUID;

/**
 * Resolved customer. {@code id} is null for a transient customer (no email,
 * so nothing to deduplicate on and nothing persisted).
 */
public record CustomerRef(UUID id, String name, String email, String phone) {

    public boolean isPersisted() {
        return id != null;
    }
}
