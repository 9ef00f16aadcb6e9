package com.copas.services.ordercrm.repository;

import com.copas.services.ordercrm.constants.CrmStatus;
import com.copas.services.ordercrm.entity.CustomerOrder;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for orders.
 *
 * Idempotency relies on uq_orders_shopify_order_id: callers insert and
 * resolve a constraint violation by re-reading with findByShopifyOrderId.
 *
 * The notification flag is written with targeted UPDATE statements so a
 * dispatch never overwrites concurrent operator edits (status, notes).
 */
@Repository
public interface CustomerOrderRepository extends JpaRepository<CustomerOrder, UUID> {

    Optional<CustomerOrder> findByShopifyOrderId(String shopifyOrderId);

    /**
     * Dashboard listing. A null filter means "any".
     */
    @Query("SELECT o FROM CustomerOrder o " +
            "WHERE (:status IS NULL OR o.status = :status) " +
            "AND (:notificationSent IS NULL OR o.notificationSent = :notificationSent)")
    Page<CustomerOrder> search(@Param("status") CrmStatus status,
                               @Param("notificationSent") Boolean notificationSent,
                               Pageable pageable);

    long countByStatus(CrmStatus status);

    long countByNotificationSentFalse();

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CustomerOrder o SET o.notificationSent = true, " +
            "o.notificationSentAt = :now, o.updatedAt = :now WHERE o.id = :id")
    int markNotificationSent(@Param("id") UUID id, @Param("now") LocalDateTime now);

    /** whatsapp_sent_at keeps the last successful delivery time */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CustomerOrder o SET o.notificationSent = false, " +
            "o.updatedAt = :now WHERE o.id = :id")
    int markNotificationFailed(@Param("id") UUID id, @Param("now") LocalDateTime now);
}
