package com.copas.services.ordercrm.service;

import com.copas.services.ordercrm.entity.Customer;
import com.copas.services.ordercrm.exception.StorageException;
import com.copas.services.ordercrm.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Deduplicates customers by email.
 *
 * Creation is a conditional insert against uq_customers_email: when two
 * requests race on a new email, the loser's insert fails with a constraint
 * violation and it re-reads the winner's row. There is no check-then-insert
 * path and no outer transaction, so a violation never poisons a caller's
 * unit of work.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerResolver {

    private final CustomerRepository customerRepository;

    public CustomerRef resolve(String name, String email, String phone) {
        if (email == null || email.isBlank()) {
            return new CustomerRef(null, name, null, phone);
        }
        String key = email.trim();

        try {
            Optional<Customer> existing = customerRepository.findByEmail(key);
            if (existing.isPresent()) {
                return refresh(existing.get(), name, phone);
            }
            return insertOrReread(name, key, phone);
        } catch (StorageException ex) {
            throw ex;
        } catch (DataAccessException ex) {
            log.error("Customer resolution failed: email={}, error={}", key, ex.getMessage());
            throw new StorageException("Could not resolve customer", ex);
        }
    }

    private CustomerRef insertOrReread(String name, String email, String phone) {
        try {
            Customer created = customerRepository.saveAndFlush(Customer.builder()
                    .name(name)
                    .email(email)
                    .phone(blankToNull(phone))
                    .build());
            log.info("Customer created: id={}", created.getId());
            return toRef(created);
        } catch (DataIntegrityViolationException ex) {
            log.warn("Concurrent customer insert for the same email, re-reading winner");
            Customer winner = customerRepository.findByEmail(email)
                    .orElseThrow(() -> new StorageException(
                            "Customer insert conflicted but no row exists for the email", ex));
            return refresh(winner, name, phone);
        }
    }

    private CustomerRef refresh(Customer customer, String name, String phone) {
        if (customer.refreshContact(name, phone)) {
            customer = customerRepository.save(customer);
            log.debug("Customer refreshed: id={}", customer.getId());
        }
        return toRef(customer);
    }

    private CustomerRef toRef(Customer customer) {
        return new CustomerRef(customer.getId(), customer.getName(), customer.getEmail(), customer.getPhone());
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
