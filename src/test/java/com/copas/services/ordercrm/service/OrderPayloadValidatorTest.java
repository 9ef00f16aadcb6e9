package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload;
import com.copas.services.ordercrm.dto.request.ShopifyOrderPayload.LineItemData;
import com.copas.services.ordercrm.exception.PayloadValidationException;
import com.copas.services.ordercrm.support.OrderTestDataProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderPayloadValidatorTest {

    private final OrderPayloadValidator validator = new OrderPayloadValidator();

    @Test
    @DisplayName("Accepts the reference order")
    void shouldAcceptValidOrder() {
        assertThatCode(() -> validator.validate(OrderTestDataProvider.order1001())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Accepts an order without customer and without line items")
    void shouldAcceptMinimalOrder() {
        ShopifyOrderPayload payload = ShopifyOrderPayload.builder()
                .shopifyOrderId("1")
                .orderNumber("#1")
                .totalPrice("0")
                .build();

        assertThatCode(() -> validator.validate(payload)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Rejects a missing shopify_order_id")
    void shouldRejectMissingSourceId() {
        ShopifyOrderPayload payload = OrderTestDataProvider.order1001();
        payload.setShopifyOrderId("  ");

        assertField(payload, "shopify_order_id");
    }

    @Test
    @DisplayName("Rejects a missing order_number")
    void shouldRejectMissingOrderNumber() {
        ShopifyOrderPayload payload = OrderTestDataProvider.order1001();
        payload.setOrderNumber(null);

        assertField(payload, "order_number");
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "-1", "150000.001", "1,000"})
    @DisplayName("Rejects totals that are not a non-negative COP amount")
    void shouldRejectBadTotals(String total) {
        ShopifyOrderPayload payload = OrderTestDataProvider.order1001();
        payload.setTotalPrice(total);

        assertField(payload, "total_price");
    }

    @ParameterizedTest
    @ValueSource(strings = {"150000", "150000.5", "0.00"})
    @DisplayName("Accepts totals within the currency's decimals")
    void shouldAcceptTotalsWithinScale(String total) {
        ShopifyOrderPayload payload = OrderTestDataProvider.order1001();
        payload.setTotalPrice(total);

        assertThatCode(() -> validator.validate(payload)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Rejects an unknown currency code")
    void shouldRejectUnknownCurrency() {
        ShopifyOrderPayload payload = OrderTestDataProvider.order1001();
        payload.setCurrency("PESOS");

        assertField(payload, "currency");
    }

    @Test
    @DisplayName("Names the offending line item")
    void shouldRejectBadLineItem() {
        ShopifyOrderPayload payload = OrderTestDataProvider.order1001();
        payload.setLineItems(List.of(
                LineItemData.builder().name("Copa").quantity(1).build(),
                LineItemData.builder().name("Plato").quantity(0).build()));

        assertField(payload, "line_items[1].quantity");

        payload.setLineItems(List.of(LineItemData.builder().name(" ").quantity(1).build()));
        assertField(payload, "line_items[0].name");

        payload.setLineItems(List.of(LineItemData.builder().name("Copa").quantity(1).price("-5").build()));
        assertField(payload, "line_items[0].price");
    }

    @Test
    @DisplayName("A customer needs an email or some phone")
    void shouldRejectUnreachableCustomer() {
        ShopifyOrderPayload payload = OrderTestDataProvider.orderWithoutAnyPhone();
        payload.getCustomer().setEmail(null);

        assertField(payload, "customer");
    }

    @Test
    @DisplayName("A customer with email but no phone is valid")
    void shouldAcceptCustomerWithEmailOnly() {
        assertThatCode(() -> validator.validate(OrderTestDataProvider.orderWithoutAnyPhone()))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Currency defaults to COP and is upper-cased")
    void shouldComputeEffectiveCurrency() {
        assertThat(OrderPayloadValidator.effectiveCurrency(null)).isEqualTo("COP");
        assertThat(OrderPayloadValidator.effectiveCurrency(" usd ")).isEqualTo("USD");
    }

    private void assertField(ShopifyOrderPayload payload, String field) {
        assertThatThrownBy(() -> validator.validate(payload))
                .isInstanceOf(PayloadValidationException.class)
                .extracting("field")
                .isEqualTo(field);
    }
}
