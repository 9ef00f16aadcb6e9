package com.copas.services.ordercrm.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One WhatsApp dispatch attempt for an order. Append-only.
 *
 * messageId is set only on success, errorMessage only on failure.
 * Rows are deleted only through ON DELETE CASCADE from orders.
 */
@Entity
@Immutable
@Table(name = "whatsapp_logs",
        indexes = @Index(name = "idx_whatsapp_logs_order_id", columnList = "order_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class DeliveryLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    @Column(name = "success", nullable = false, updatable = false)
    private boolean success;

    @Column(name = "message_id", updatable = false)
    private String messageId;

    @Column(name = "error_message", length = 2000, updatable = false)
    private String errorMessage;

    @Column(name = "sent_at", nullable = false, updatable = false)
    private LocalDateTime sentAt;
}
