package com.copas.services.ordercrm.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Dashboard counters")
public class OrderStatsResponse {

    @Schema(example = "42")
    private long totalOrders;

    @Schema(description = "Order count per CRM status; every status is present")
    private Map<String, Long> countsByStatus;

    @Schema(description = "Orders whose last dispatch failed or never happened", example = "3")
    private long pendingNotification;
}
