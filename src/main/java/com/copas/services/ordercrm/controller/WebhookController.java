package com.copas.services.ordercrm.controller;

import com.copas.services.ordercrm.constants.OrderCrmConstants;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload;
import com.copas.services.ordercrm.dto.response.ApiResponse;
import com.copas.services.ordercrm.dto.response.WebhookAckResponse;
import com.copas.services.ordercrm.service.IngestionResult;
import com.copas.services.ordercrm.service.OrderIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Order intake webhook, called by the Make scenario on every Shopify order.
 *
 * Security: X-Webhook-Token is checked by WebhookTokenFilter before this
 * controller runs; unauthenticated calls never reach the body parser.
 *
 * Responses:
 *   201: order created (confirmation attempted or flagged as no-contact)
 *   200: order already registered, nothing changed
 * A failed WhatsApp send does not fail the webhook: the order is stored and
 * the failure is visible in the ack and in the delivery history.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "Shopify order intake (via Make)")
public class WebhookController {

    private final OrderIngestionService orderIngestionService;

    @PostMapping({OrderCrmConstants.API_V1 + "/webhooks/shopify", "/webhook/shopify"})
    @Operation(summary = "Receive a Shopify order",
            description = "Idempotent on shopify_order_id. Requires the X-Webhook-Token header.")
    public ResponseEntity<ApiResponse<WebhookAckResponse>> receiveOrder(
            @RequestBody ShopifyOrderPayload payload
    ) {
        log.info("POST /webhooks/shopify - shopifyOrderId={}, orderNumber={}",
                payload.getShopifyOrderId(), payload.getOrderNumber());

        IngestionResult result = orderIngestionService.ingest(payload);

        WebhookAckResponse ack = WebhookAckResponse.builder()
                .orderId(result.order().getId())
                .orderNumber(result.order().getOrderNumber())
                .duplicate(!result.isNew())
                .notificationSent(result.notificationSent())
                .notificationError(result.notificationError())
                .build();

        if (!result.isNew()) {
            return ResponseEntity.ok(ApiResponse.success(ack, OrderCrmConstants.SUCCESS_ORDER_DUPLICATE));
        }
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success(ack, OrderCrmConstants.SUCCESS_ORDER_RECEIVED));
    }
}
