package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.entity.DeliveryLogEntry;
import com.copas.services.ordercrm.exception.StorageException;
import com.copas.services.ordercrm.repository.DeliveryLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Append-only record of WhatsApp dispatch attempts (table whatsapp_logs).
 * There is intentionally no update or delete operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryLogService {

    private final DeliveryLogRepository deliveryLogRepository;

    public DeliveryLogEntry record(UUID orderId, DeliveryOutcome outcome) {
        DeliveryLogEntry entry = DeliveryLogEntry.builder()
                .orderId(orderId)
                .success(outcome.isSuccess())
                .messageId(outcome.getMessageId())
                .errorMessage(outcome.getErrorMessage())
                .sentAt(LocalDateTime.now())
                .build();
        try {
            DeliveryLogEntry saved = deliveryLogRepository.saveAndFlush(entry);
            log.debug("Delivery attempt recorded: orderId={}, success={}", orderId, outcome.isSuccess());
            return saved;
        } catch (DataAccessException ex) {
            log.error("Could not record delivery attempt: orderId={}, error={}", orderId, ex.getMessage());
            throw new StorageException("Could not record delivery attempt for order " + orderId, ex);
        }
    }

    /**
     * All attempts for an order, oldest first.
     */
    @Transactional(readOnly = true)
    public List<DeliveryLogEntry> history(UUID orderId) {
        return deliveryLogRepository.findByOrderIdOrderBySentAtAscIdAsc(orderId);
    }
}
