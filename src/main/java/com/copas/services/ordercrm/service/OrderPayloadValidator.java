package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.constants.OrderCrmConstants;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.CustomerData;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.LineItemData;
import com.copas.services.ordercrm.exception.PayloadValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.List;

/**
 * Semantic checks on an inbound order, run before anything is persisted.
 *
 * Shape errors (wrong types, unknown fields) never get here: the JSON mapper
 * rejects them while binding. Every failure names the offending field using
 * the wire (snake_case) name, e.g. "line_items[2].quantity".
 */
@Component
@Slf4j
public class OrderPayloadValidator {

    public void validate(ShopifyOrderPayload payload) {
        if (payload == null) {
            throw new PayloadValidationException("body", "Request body is required");
        }

        requireText(payload.getShopifyOrderId(), "shopify_order_id");
        requireText(payload.getOrderNumber(), "order_number");

        Currency currency = validateCurrency(payload.getCurrency());
        validateTotal(payload.getTotalPrice(), currency);
        validateLineItems(payload.getLineItems());
        validateCustomerContact(payload);

        log.debug("Payload valid: shopifyOrderId={}", payload.getShopifyOrderId());
    }

    /**
     * Currency code to store: upper-cased, COP when absent.
     */
    public static String effectiveCurrency(String currency) {
        return currency == null || currency.isBlank()
                ? OrderCrmConstants.DEFAULT_CURRENCY
                : currency.trim().toUpperCase();
    }

    private void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw PayloadValidationException.required(field);
        }
    }

    private Currency validateCurrency(String raw) {
        String code = effectiveCurrency(raw);
        try {
            return Currency.getInstance(code);
        } catch (IllegalArgumentException ex) {
            throw new PayloadValidationException("currency", "Unknown ISO-4217 currency code: " + raw);
        }
    }

    private void validateTotal(String totalPrice, Currency currency) {
        requireText(totalPrice, "total_price");
        BigDecimal amount = parseNonNegative(totalPrice, "total_price");

        int fractionDigits = currency.getDefaultFractionDigits();
        if (fractionDigits >= 0 && amount.scale() > fractionDigits) {
            throw new PayloadValidationException("total_price",
                    "total_price has more decimals than " + currency.getCurrencyCode()
                            + " allows (" + fractionDigits + ")");
        }
    }

    private void validateLineItems(List<LineItemData> lineItems) {
        if (lineItems == null) return;

        for (int i = 0; i < lineItems.size(); i++) {
            String prefix = "line_items[" + i + "]";
            LineItemData item = lineItems.get(i);
            if (item == null) {
                throw new PayloadValidationException(prefix, "Line item must not be null");
            }
            requireText(item.getName(), prefix + ".name");
            if (item.getQuantity() == null || item.getQuantity() < 1) {
                throw new PayloadValidationException(prefix + ".quantity",
                        prefix + ".quantity must be a positive integer");
            }
            if (item.getPrice() != null && !item.getPrice().isBlank()) {
                parseNonNegative(item.getPrice(), prefix + ".price");
            }
        }
    }

    /**
     * A customer object must leave us some way to identify or reach the buyer.
     */
    private void validateCustomerContact(ShopifyOrderPayload payload) {
        CustomerData customer = payload.getCustomer();
        if (customer == null) return;

        boolean hasEmail = customer.getEmail() != null && !customer.getEmail().isBlank();
        String shippingPhone = payload.getShippingAddress() != null
                ? payload.getShippingAddress().getPhone() : null;
        boolean hasPhone = isPresent(customer.getPhone()) || isPresent(shippingPhone);

        if (!hasEmail && !hasPhone) {
            throw new PayloadValidationException("customer",
                    "customer must have an email or a phone (customer or shipping address)");
        }
    }

    private BigDecimal parseNonNegative(String value, String field) {
        BigDecimal amount;
        try {
            amount = new BigDecimal(value.trim());
        } catch (NumberFormatException ex) {
            throw new PayloadValidationException(field, field + " is not a decimal amount: " + value);
        }
        if (amount.signum() < 0) {
            throw new PayloadValidationException(field, field + " must not be negative");
        }
        return amount;
    }

    private boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
