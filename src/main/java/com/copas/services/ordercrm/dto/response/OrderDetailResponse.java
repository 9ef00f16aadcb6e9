package com.copas.services.ordercrm.dto.response;

import com.copas.services.ordercrm.entity.LineItem;
import com.copas.services.ordercrm.entity.ShippingAddress;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Full order view, including the delivery history oldest-first
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Order details with WhatsApp delivery history")
public class OrderDetailResponse {

    private UUID id;
    private String shopifyOrderId;
    private String orderNumber;

    private UUID customerId;
    private String customerName;
    private String customerEmail;
    private String customerPhone;

    private ShippingAddress shippingAddress;
    private List<LineItem> lineItems;

    private String totalPrice;
    private String currency;
    private String financialStatus;
    private String fulfillmentStatus;

    @Schema(example = "en_proceso")
    private String status;

    private boolean notificationSent;
    private LocalDateTime notificationSentAt;

    private String notes;
    private String tags;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @Schema(description = "Every dispatch attempt, oldest first")
    private List<DeliveryLogEntryResponse> deliveryHistory;
}
