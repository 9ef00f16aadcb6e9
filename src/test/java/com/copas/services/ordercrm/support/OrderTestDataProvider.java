package com.copas.services.ordercrm.support;

import com.copas.services.ordercrm.constants.CrmStatus;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.CustomerData;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.LineItemData;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.ShippingAddressData;
import com.copas.services.ordercrm.entity.CustomerOrder;
import com.copas.services.ordercrm.entity.LineItem;
import com.copas.services.ordercrm.entity.ShippingAddress;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Canonical orders used across tests. Order #1001 is the reference example:
 * Ana Gómez, one line item, 150000.00 COP, reachable on +57 300 123 4567.
 */
public final class OrderTestDataProvider {

    public static final String SHOPIFY_ORDER_ID = "5678901234";
    public static final String ORDER_NUMBER = "#1001";
    public static final String CUSTOMER_EMAIL = "ana@example.com";
    public static final String CUSTOMER_PHONE = "+57 300 123 4567";
    public static final String SHIPPING_PHONE = "3109876543";

    private OrderTestDataProvider() {
    }

    public static ShopifyOrderPayload order1001() {
        return ShopifyOrderPayload.builder()
                .shopifyOrderId(SHOPIFY_ORDER_ID)
                .orderNumber(ORDER_NUMBER)
                .customer(CustomerData.builder()
                        .name("Ana Gómez")
                        .email(CUSTOMER_EMAIL)
                        .phone(CUSTOMER_PHONE)
                        .build())
                .shippingAddress(ShippingAddressData.builder()
                        .address1("Calle 10 # 5-20")
                        .city("Bogotá")
                        .province("Cundinamarca")
                        .country("CO")
                        .phone(SHIPPING_PHONE)
                        .build())
                .lineItems(new ArrayList<>(List.of(LineItemData.builder()
                        .name("Copa artesanal")
                        .quantity(2)
                        .price("75000.00")
                        .sku("COPA-001")
                        .build())))
                .totalPrice("150000.00")
                .currency("COP")
                .financialStatus("paid")
                .fulfillmentStatus("unfulfilled")
                .build();
    }

    public static ShopifyOrderPayload orderWithoutCustomerPhone() {
        ShopifyOrderPayload payload = order1001();
        payload.getCustomer().setPhone(null);
        return payload;
    }

    public static ShopifyOrderPayload orderWithoutAnyPhone() {
        ShopifyOrderPayload payload = order1001();
        payload.getCustomer().setPhone(null);
        payload.getShippingAddress().setPhone("   ");
        return payload;
    }

    public static CustomerOrder storedOrder() {
        return CustomerOrder.builder()
                .id(UUID.randomUUID())
                .shopifyOrderId(SHOPIFY_ORDER_ID)
                .orderNumber(ORDER_NUMBER)
                .customerId(UUID.randomUUID())
                .customerName("Ana Gómez")
                .customerEmail(CUSTOMER_EMAIL)
                .customerPhone(CUSTOMER_PHONE)
                .shippingAddress(ShippingAddress.builder().city("Bogotá").phone(SHIPPING_PHONE).build())
                .lineItems(new ArrayList<>(List.of(LineItem.builder().name("Copa artesanal").quantity(2).price("75000.00").build())))
                .totalPrice("150000.00")
                .currency("COP")
                .status(CrmStatus.NUEVO)
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();
    }
}
