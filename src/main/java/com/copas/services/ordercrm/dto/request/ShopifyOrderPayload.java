package com.copas.services.ordercrm.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Order event posted by the Make scenario after a Shopify "order created".
 *
 * Field names are snake_case on the wire. Unknown fields are rejected by the
 * JSON mapper (fail-on-unknown-properties), so a changed Make mapping fails
 * loudly instead of silently dropping data.
 *
 * Semantic checks (required ids, decimal total, line items) live in
 * OrderPayloadValidator so that every failure names the offending field.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Shopify order as mapped by Make")
public class ShopifyOrderPayload {

    @Schema(description = "Shopify order id (idempotency key)", example = "5678901234")
    private String shopifyOrderId;

    @Schema(description = "Human-facing order number", example = "#1001")
    private String orderNumber;

    private CustomerData customer;

    private ShippingAddressData shippingAddress;

    @Builder.Default
    private List<LineItemData> lineItems = new ArrayList<>();

    @Schema(description = "Order total as a decimal string", example = "150000.00")
    private String totalPrice;

    @Schema(description = "ISO-4217 code, COP when absent", example = "COP")
    private String currency;

    @Schema(example = "paid")
    private String financialStatus;

    @Schema(example = "unfulfilled")
    private String fulfillmentStatus;

    @Schema(description = "Customer note from checkout")
    private String note;

    private String tags;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CustomerData {

        @Schema(description = "Full name; when absent first_name + last_name is used", example = "Ana Gómez")
        private String name;
        private String firstName;
        private String lastName;

        @Schema(example = "ana@example.com")
        private String email;

        @Schema(example = "+57 300 123 4567")
        private String phone;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ShippingAddressData {
        private String address1;
        private String address2;
        private String city;
        private String province;
        private String country;
        private String zip;
        private String phone;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class LineItemData {
        private String name;
        private Integer quantity;
        private String price;
        private String sku;
        private String variantTitle;
    }
}
