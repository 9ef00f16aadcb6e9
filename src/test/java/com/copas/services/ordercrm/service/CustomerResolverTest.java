package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.entity.Customer;
import com.copas.services.ordercrm.exception.StorageException;
import com.copas.services.ordercrm.repository.CustomerRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CustomerResolverTest {

    @Mock
    private CustomerRepository customerRepository;

    @InjectMocks
    private CustomerResolver customerResolver;

    @Test
    @DisplayName("No email → transient customer, nothing stored")
    void shouldReturnTransientCustomerWithoutEmail() {
        CustomerRef ref = customerResolver.resolve("Ana", "  ", "3001234567");

        assertThat(ref.isPersisted()).isFalse();
        assertThat(ref.name()).isEqualTo("Ana");
        assertThat(ref.phone()).isEqualTo("3001234567");
        verifyNoInteractions(customerRepository);
    }

    @Test
    @DisplayName("Existing email → latest name and phone win")
    void shouldRefreshExistingCustomer() {
        Customer existing = Customer.builder().id(UUID.randomUUID()).name("Ana").email("ana@example.com").phone("1").build();
        when(customerRepository.findByEmail("ana@example.com")).thenReturn(Optional.of(existing));
        when(customerRepository.save(existing)).thenReturn(existing);

        CustomerRef ref = customerResolver.resolve("Ana María", "ana@example.com", "3001234567");

        assertThat(ref.id()).isEqualTo(existing.getId());
        assertThat(ref.name()).isEqualTo("Ana María");
        assertThat(ref.phone()).isEqualTo("3001234567");
        verify(customerRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Blank values never erase stored contact data")
    void shouldKeepStoredPhoneWhenNewOneIsBlank() {
        Customer existing = Customer.builder().id(UUID.randomUUID()).name("Ana").email("ana@example.com").phone("3001234567").build();
        when(customerRepository.findByEmail("ana@example.com")).thenReturn(Optional.of(existing));

        CustomerRef ref = customerResolver.resolve("Ana", "ana@example.com", null);

        assertThat(ref.phone()).isEqualTo("3001234567");
        verify(customerRepository, never()).save(any());
    }

    @Test
    @DisplayName("Lost insert race → winner's row is re-read and refreshed")
    void shouldRereadWinnerOnConstraintViolation() {
        Customer winner = Customer.builder().id(UUID.randomUUID()).name("Ana").email("ana@example.com").build();
        when(customerRepository.findByEmail("ana@example.com"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(customerRepository.saveAndFlush(any(Customer.class)))
                .thenThrow(new DataIntegrityViolationException("uq_customers_email"));
        when(customerRepository.save(winner)).thenReturn(winner);

        CustomerRef ref = customerResolver.resolve("Ana", "ana@example.com", "3001234567");

        assertThat(ref.id()).isEqualTo(winner.getId());
        assertThat(ref.phone()).isEqualTo("3001234567");
    }

    @Test
    @DisplayName("Violation without a winner row → StorageException")
    void shouldFailWhenRereadFindsNothing() {
        when(customerRepository.findByEmail("ana@example.com")).thenReturn(Optional.empty());
        when(customerRepository.saveAndFlush(any(Customer.class)))
                .thenThrow(new DataIntegrityViolationException("not null"));

        assertThatThrownBy(() -> customerResolver.resolve("Ana", "ana@example.com", null))
                .isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Other persistence failures surface as StorageException")
    void shouldWrapDataAccessFailures() {
        when(customerRepository.findByEmail("ana@example.com")).thenThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> customerResolver.resolve("Ana", "ana@example.com", null))
                .isInstanceOf(StorageException.class)
                .hasFieldOrPropertyWithValue("errorCode", "STORAGE_ERROR");
    }
}
