package com.copas.services.ordercrm.mapper;

import com.copas.services.ordercrm.constants.OrderCrmConstants;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.CustomerData;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.LineItemData;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.ShippingAddressData;
import com.copas.services.ordercrm.dto.response.DeliveryLogEntryResponse;
import com.copas.services.ordercrm.dto.response.OrderDetailResponse;
import com.copas.services.ordercrm.dto.response.OrderSummaryResponse;
import com.copas.services.ordercrm.entity.CustomerOrder;
import com.copas.services.ordercrm.entity.DeliveryLogEntry;
import com.copas.services.ordercrm.entity.LineItem;
import com.copas.services.ordercrm.entity.ShippingAddress;
import com.copas.services.ordercrm.service.CustomerRef;
import com.copas.services.ordercrm.service.OrderPayloadValidator;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Mapper utility for converting between order payloads, entities and DTOs
 */
@UtilityClass
public class OrderMapper {

    /**
     * Customer display name: "name", else "first_name last_name", else "Cliente".
     */
    public String displayName(CustomerData customer) {
        if (customer == null) return OrderCrmConstants.DEFAULT_CUSTOMER_NAME;
        if (customer.getName() != null && !customer.getName().isBlank()) {
            return customer.getName().trim();
        }
        String joined = (nullToEmpty(customer.getFirstName()) + " " + nullToEmpty(customer.getLastName())).trim();
        return joined.isEmpty() ? OrderCrmConstants.DEFAULT_CUSTOMER_NAME : joined;
    }

    /**
     * Build a not-yet-persisted order. Status and notification fields are
     * initialised by OrderUpsertEngine.
     */
    public CustomerOrder toNewOrder(ShopifyOrderPayload payload, CustomerRef customer,
                                   String contactPhone, String notes) {
        return CustomerOrder.builder()
                .orderNumber(payload.getOrderNumber().trim())
                .customerId(customer.id())
                .customerName(customer.name())
                .customerEmail(customer.email())
                .customerPhone(contactPhone)
                .shippingAddress(toShippingAddress(payload.getShippingAddress()))
                .lineItems(toLineItems(payload.getLineItems()))
                .totalPrice(payload.getTotalPrice().trim())
                .currency(OrderPayloadValidator.effectiveCurrency(payload.getCurrency()))
                .financialStatus(payload.getFinancialStatus())
                .fulfillmentStatus(payload.getFulfillmentStatus())
                .notes(notes)
                .tags(payload.getTags())
                .build();
    }

    public ShippingAddress toShippingAddress(ShippingAddressData data) {
        if (data == null) return null;
        return ShippingAddress.builder()
                .address1(data.getAddress1())
                .address2(data.getAddress2())
                .city(data.getCity())
                .province(data.getProvince())
                .country(data.getCountry())
                .zip(data.getZip())
                .phone(data.getPhone())
                .build();
    }

    public List<LineItem> toLineItems(List<LineItemData> items) {
        List<LineItem> result = new ArrayList<>();
        if (items == null) return result;
        for (LineItemData item : items) {
            result.add(LineItem.builder()
                    .name(item.getName())
                    .quantity(item.getQuantity())
                    .price(item.getPrice())
                    .sku(item.getSku())
                    .variantTitle(item.getVariantTitle())
                    .build());
        }
        return result;
    }

    public OrderSummaryResponse toSummary(CustomerOrder order) {
        if (order == null) return null;
        return OrderSummaryResponse.builder()
                .id(order.getId())
                .shopifyOrderId(order.getShopifyOrderId())
                .orderNumber(order.getOrderNumber())
                .customerName(order.getCustomerName())
                .customerPhone(order.getCustomerPhone())
                .totalPrice(order.getTotalPrice())
                .currency(order.getCurrency())
                .status(order.getStatus() != null ? order.getStatus().getValue() : null)
                .notificationSent(order.isNotificationSent())
                .createdAt(order.getCreatedAt())
                .build();
    }

    public OrderDetailResponse toDetail(CustomerOrder order, List<DeliveryLogEntry> history) {
        if (order == null) return null;
        return OrderDetailResponse.builder()
                .id(order.getId())
                .shopifyOrderId(order.getShopifyOrderId())
                .orderNumber(order.getOrderNumber())
                .customerId(order.getCustomerId())
                .customerName(order.getCustomerName())
                .customerEmail(order.getCustomerEmail())
                .customerPhone(order.getCustomerPhone())
                .shippingAddress(order.getShippingAddress())
                .lineItems(order.getLineItems())
                .totalPrice(order.getTotalPrice())
                .currency(order.getCurrency())
                .financialStatus(order.getFinancialStatus())
                .fulfillmentStatus(order.getFulfillmentStatus())
                .status(order.getStatus() != null ? order.getStatus().getValue() : null)
                .notificationSent(order.isNotificationSent())
                .notificationSentAt(order.getNotificationSentAt())
                .notes(order.getNotes())
                .tags(order.getTags())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .deliveryHistory(history == null ? List.of()
                        : history.stream().map(OrderMapper::toLogEntryResponse).toList())
                .build();
    }

    public DeliveryLogEntryResponse toLogEntryResponse(DeliveryLogEntry entry) {
        if (entry == null) return null;
        return DeliveryLogEntryResponse.builder()
                .id(entry.getId())
                .orderId(entry.getOrderId())
                .success(entry.isSuccess())
                .messageId(entry.getMessageId())
                .errorMessage(entry.getErrorMessage())
                .sentAt(entry.getSentAt())
                .build();
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
