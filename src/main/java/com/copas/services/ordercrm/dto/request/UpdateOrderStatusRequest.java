package com.copas.services.ordercrm.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * Request DTO for changing the CRM status of an order
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Request to update order CRM status")
public class UpdateOrderStatusRequest {

    @NotBlank(message = "Status is required")
    @Pattern(regexp = "^(nuevo|en_proceso|enviado|completado|cancelado)$",
            message = "Status must be nuevo, en_proceso, enviado, completado or cancelado")
    @Schema(description = "New CRM status",
            example = "en_proceso",
            allowableValues = {"nuevo", "en_proceso", "enviado", "completado", "cancelado"})
    private String status;

    @Size(max = 4000, message = "Notes must be at most 4000 characters")
    @Schema(description = "Replaces the current notes when present", example = "Empacado, sale mañana")
    private String notes;
}
