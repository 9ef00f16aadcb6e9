package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.constants.CrmStatus;
import com.copas.services.ordercrm.entity.CustomerOrder;
import com.copas.services.ordercrm.exception.InvalidRequestException;
import com.copas.services.ordercrm.exception.OrderNotFoundException;
import com.copas.services.ordercrm.exception.StorageException;
import com.copas.services.ordercrm.repository.CustomerOrderRepository;
import com.copas.services.ordercrm.support.OrderTestDataProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderUpsertEngineTest {

    @Mock
    private CustomerOrderRepository orderRepository;

    @InjectMocks
    private OrderUpsertEngine upsertEngine;

    @Test
    @DisplayName("New source id → inserted as nuevo, not notified")
    void shouldInsertNewOrder() {
        CustomerOrder candidate = OrderTestDataProvider.storedOrder();
        candidate.setStatus(CrmStatus.COMPLETADO);
        candidate.setNotificationSent(true);
        when(orderRepository.findByShopifyOrderId("5678901234")).thenReturn(Optional.empty());
        when(orderRepository.saveAndFlush(candidate)).thenReturn(candidate);

        UpsertResult result = upsertEngine.upsert("5678901234", candidate);

        assertThat(result.isNew()).isTrue();
        assertThat(result.order().getStatus()).isEqualTo(CrmStatus.NUEVO);
        assertThat(result.order().isNotificationSent()).isFalse();
        assertThat(result.order().getShopifyOrderId()).isEqualTo("5678901234");
    }

    @Test
    @DisplayName("Existing source id → returned unchanged, nothing written")
    void shouldReturnExistingOrderOnReplay() {
        CustomerOrder existing = OrderTestDataProvider.storedOrder();
        existing.setStatus(CrmStatus.ENVIADO);
        when(orderRepository.findByShopifyOrderId("5678901234")).thenReturn(Optional.of(existing));

        UpsertResult result = upsertEngine.upsert("5678901234", OrderTestDataProvider.storedOrder());

        assertThat(result.isNew()).isFalse();
        assertThat(result.order()).isSameAs(existing);
        assertThat(result.order().getStatus()).isEqualTo(CrmStatus.ENVIADO);
        verify(orderRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Lost insert race → winner returned with isNew=false")
    void shouldReturnWinnerOnConstraintViolation() {
        CustomerOrder winner = OrderTestDataProvider.storedOrder();
        when(orderRepository.findByShopifyOrderId("5678901234"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(orderRepository.saveAndFlush(any(CustomerOrder.class)))
                .thenThrow(new DataIntegrityViolationException("uq_orders_shopify_order_id"));

        UpsertResult result = upsertEngine.upsert("5678901234", OrderTestDataProvider.storedOrder());

        assertThat(result.isNew()).isFalse();
        assertThat(result.order()).isSameAs(winner);
    }

    @Test
    @DisplayName("Violation without a winner row → StorageException")
    void shouldFailWhenRereadFindsNothing() {
        when(orderRepository.findByShopifyOrderId("5678901234")).thenReturn(Optional.empty());
        when(orderRepository.saveAndFlush(any(CustomerOrder.class)))
                .thenThrow(new DataIntegrityViolationException("not null"));

        assertThatThrownBy(() -> upsertEngine.upsert("5678901234", OrderTestDataProvider.storedOrder()))
                .isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Status update replaces the note and allows leaving cancelado")
    void shouldUpdateStatusAndReplaceNote() {
        CustomerOrder order = OrderTestDataProvider.storedOrder();
        order.setStatus(CrmStatus.CANCELADO);
        order.setNotes("old note");
        when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
        when(orderRepository.save(order)).thenReturn(order);

        CustomerOrder updated = upsertEngine.updateStatus(order.getId(), "en_proceso", "reabierto por cliente");

        assertThat(updated.getStatus()).isEqualTo(CrmStatus.EN_PROCESO);
        assertThat(updated.getNotes()).isEqualTo("reabierto por cliente");
    }

    @Test
    @DisplayName("Status update without note keeps the current note")
    void shouldKeepNoteWhenNoneGiven() {
        CustomerOrder order = OrderTestDataProvider.storedOrder();
        order.setNotes("keep me");
        when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
        when(orderRepository.save(order)).thenReturn(order);

        CustomerOrder updated = upsertEngine.updateStatus(order.getId(), "COMPLETADO", null);

        assertThat(updated.getStatus()).isEqualTo(CrmStatus.COMPLETADO);
        assertThat(updated.getNotes()).isEqualTo("keep me");
    }

    @Test
    @DisplayName("Unknown status → InvalidRequestException, order untouched")
    void shouldRejectUnknownStatus() {
        UUID id = UUID.randomUUID();

        assertThatThrownBy(() -> upsertEngine.updateStatus(id, "perdido", null))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("perdido");
        verify(orderRepository, never()).findById(any());
    }

    @Test
    @DisplayName("Unknown order → OrderNotFoundException")
    void shouldRejectUnknownOrder() {
        UUID id = UUID.randomUUID();
        when(orderRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> upsertEngine.updateStatus(id, "nuevo", null))
                .isInstanceOf(OrderNotFoundException.class);
    }
}
