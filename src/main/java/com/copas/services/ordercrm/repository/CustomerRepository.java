package com.copas.services.ordercrm.repository;

import com.copas.services.ordercrm.entity.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Customer lookups. Uniqueness of email is enforced by uq_customers_email,
 * not by a check before insert.
 */
@Repository
public interface CustomerRepository extends JpaRepository<Customer, UUID> {

    Optional<Customer> findByEmail(String email);
}
