package com.copas.services.ordercrm.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.util.UUID;

/**
 * Acknowledgement returned to Make for every accepted order event
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Order intake acknowledgement")
public class WebhookAckResponse {

    @Schema(description = "CRM order id")
    private UUID orderId;

    @Schema(example = "#1001")
    private String orderNumber;

    @Schema(description = "True when the order was already registered (replay)", example = "false")
    private boolean duplicate;

    @Schema(description = "True when the WhatsApp confirmation was delivered on this call", example = "true")
    private boolean notificationSent;

    @Schema(description = "Delivery failure detail, or the no-contact flag", example = "HTTP 400: Invalid parameter")
    private String notificationError;
}
