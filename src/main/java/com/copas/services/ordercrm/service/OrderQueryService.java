package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.constants.CrmStatus;
import com.copas.services.ordercrm.dto.response.OrderDetailResponse;
import com.copas.services.ordercrm.dto.response.OrderStatsResponse;
import com.copas.services.ordercrm.dto.response.OrderSummaryResponse;
import com.copas.services.ordercrm.exception.InvalidRequestException;
import com.copas.services.ordercrm.exception.OrderNotFoundException;
import com.copas.services.ordercrm.mapper.OrderMapper;
import com.copas.services.ordercrm.repository.CustomerOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of the management API. Filtering happens in the database.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderQueryService {

    private final CustomerOrderRepository orderRepository;
    private final DeliveryLogService deliveryLogService;

    @Transactional(readOnly = true)
    public Page<OrderSummaryResponse> listOrders(String status, Boolean notificationSent, Pageable pageable) {
        CrmStatus statusFilter = parseStatusFilter(status);
        log.debug("Listing orders: status={}, notificationSent={}, page={}",
                statusFilter, notificationSent, pageable.getPageNumber());
        return orderRepository.search(statusFilter, notificationSent, pageable)
                .map(OrderMapper::toSummary);
    }

    @Transactional(readOnly = true)
    public OrderDetailResponse getOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .map(order -> OrderMapper.toDetail(order, deliveryLogService.history(orderId)))
                .orElseThrow(() -> OrderNotFoundException.withId(orderId));
    }

    @Transactional(readOnly = true)
    public OrderStatsResponse getStats() {
        Map<String, Long> countsByStatus = new LinkedHashMap<>();
        for (CrmStatus status : CrmStatus.values()) {
            countsByStatus.put(status.getValue(), orderRepository.countByStatus(status));
        }
        return OrderStatsResponse.builder()
                .totalOrders(orderRepository.count())
                .countsByStatus(countsByStatus)
                .pendingNotification(orderRepository.countByNotificationSentFalse())
                .build();
    }

    private CrmStatus parseStatusFilter(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return CrmStatus.fromValue(status);
        } catch (IllegalArgumentException ex) {
            throw InvalidRequestException.invalidStatus(status);
        }
    }
}
