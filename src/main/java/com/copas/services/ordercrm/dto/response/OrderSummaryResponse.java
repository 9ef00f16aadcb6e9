package com.copas.services.ordercrm.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Row of the dashboard order table
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Order list item")
public class OrderSummaryResponse {

    private UUID id;

    @Schema(example = "5678901234")
    private String shopifyOrderId;

    @Schema(example = "#1001")
    private String orderNumber;

    @Schema(example = "Ana Gómez")
    private String customerName;

    private String customerPhone;

    @Schema(example = "150000.00")
    private String totalPrice;

    @Schema(example = "COP")
    private String currency;

    @Schema(example = "nuevo")
    private String status;

    private boolean notificationSent;

    private LocalDateTime createdAt;
}
