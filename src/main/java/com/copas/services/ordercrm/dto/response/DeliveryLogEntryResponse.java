package com.copas.services.ordercrm.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "One WhatsApp delivery attempt")
public class DeliveryLogEntryResponse {

    private Long id;

    private UUID orderId;

    @Schema(example = "true")
    private boolean success;

    @Schema(description = "Provider message id, success only", example = "wamid.HBgMNTczMDAxMjM0NTY3FQIAERgS")
    private String messageId;

    @Schema(description = "Failure detail, failure only")
    private String errorMessage;

    private LocalDateTime sentAt;
}
