package com.copas.services.ordercrm.controller;

import com.copas.services.ordercrm.constants.OrderCrmConstants;
import com.copas.services.ordercrm.dto.request.UpdateOrderStatusRequest;
import com.copas.services.ordercrm.dto.response.ApiResponse;
import com.copas.services.ordercrm.dto.response.DeliveryLogEntryResponse;
import com.copas.services.ordercrm.dto.response.OrderDetailResponse;
import com.copas.services.ordercrm.dto.response.OrderStatsResponse;
import com.copas.services.ordercrm.dto.response.OrderSummaryResponse;
import com.copas.services.ordercrm.entity.DeliveryLogEntry;
import com.copas.services.ordercrm.mapper.OrderMapper;
import com.copas.services.ordercrm.service.OrderIngestionService;
import com.copas.services.ordercrm.service.OrderQueryService;
import com.copas.services.ordercrm.service.OrderUpsertEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Management API used by the CRM dashboard
 */
@RestController
@RequestMapping(OrderCrmConstants.API_V1 + "/orders")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Orders", description = "Browse orders, change CRM status, resend confirmations")
public class OrderController {

    private final OrderQueryService orderQueryService;
    private final OrderUpsertEngine orderUpsertEngine;
    private final OrderIngestionService orderIngestionService;

    @GetMapping
    @Operation(summary = "List orders (paginated, newest first)")
    public ResponseEntity<ApiResponse<Page<OrderSummaryResponse>>> listOrders(
            @Parameter(description = "CRM status filter", example = "nuevo")
            @RequestParam(required = false) String status,
            @Parameter(description = "Filter by WhatsApp confirmation state")
            @RequestParam(required = false) Boolean notificationSent,
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        log.debug("GET /orders - status={}, notificationSent={}", status, notificationSent);
        Page<OrderSummaryResponse> response = orderQueryService.listOrders(status, notificationSent, pageable);
        return ResponseEntity.ok(ApiResponse.success(response, "Orders fetched successfully"));
    }

    @GetMapping("/stats")
    @Operation(summary = "Order counters for the dashboard header")
    public ResponseEntity<ApiResponse<OrderStatsResponse>> getStats() {
        return ResponseEntity.ok(ApiResponse.success(orderQueryService.getStats(), "Stats fetched successfully"));
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "Get order with its WhatsApp delivery history")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> getOrder(
            @Parameter(description = "CRM order id") @PathVariable UUID orderId
    ) {
        log.debug("GET /orders/{}", orderId);
        return ResponseEntity.ok(ApiResponse.success(orderQueryService.getOrder(orderId), "Order fetched successfully"));
    }

    @PatchMapping("/{orderId}/status")
    @Operation(summary = "Update order CRM status",
            description = "Any status may follow any other. notes, when present, replaces the current notes.")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> updateStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request
    ) {
        log.info("PATCH /orders/{}/status - New status: {}", orderId, request.getStatus());
        orderUpsertEngine.updateStatus(orderId, request.getStatus(), request.getNotes());
        return ResponseEntity.ok(ApiResponse.success(orderQueryService.getOrder(orderId), "Order status updated"));
    }

    @PostMapping("/{orderId}/resend-notification")
    @Operation(summary = "Resend the WhatsApp order confirmation",
            description = "Always appends a delivery log entry. 502 when the confirmation was not delivered.")
    public ResponseEntity<ApiResponse<DeliveryLogEntryResponse>> resendNotification(
            @PathVariable UUID orderId
    ) {
        log.info("POST /orders/{}/resend-notification", orderId);
        DeliveryLogEntry entry = orderIngestionService.resend(orderId);
        DeliveryLogEntryResponse response = OrderMapper.toLogEntryResponse(entry);

        if (!entry.isSuccess()) {
            return ResponseEntity
                    .status(HttpStatus.BAD_GATEWAY)
                    .body(ApiResponse.error(response, entry.getErrorMessage(), "NOTIFICATION_FAILED"));
        }
        return ResponseEntity.ok(ApiResponse.success(response, OrderCrmConstants.SUCCESS_NOTIFICATION_RESENT));
    }
}
