package com.copas.services.ordercrm.entity;

import com.copas.services.ordercrm.constants.CrmStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A Shopify order as seen by the CRM.
 *
 * shopify_order_id is the idempotency key: unique, never updated.
 * Customer name/email/phone are a snapshot taken at ingestion and are not
 * kept in sync with later edits of the customer row.
 */
@Entity
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uq_orders_shopify_order_id", columnNames = "shopify_order_id"),
        indexes = {
                @Index(name = "idx_orders_status",        columnList = "status"),
                @Index(name = "idx_orders_customer_id",   columnList = "customer_id"),
                @Index(name = "idx_orders_whatsapp_sent", columnList = "whatsapp_sent"),
                @Index(name = "idx_orders_created_at",    columnList = "created_at"),
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustomerOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "shopify_order_id", nullable = false, updatable = false, length = 100)
    private String shopifyOrderId;

    @Column(name = "order_number", nullable = false, length = 50)
    private String orderNumber;

    /** Nullable: orders without email have no customer row; ON DELETE SET NULL */
    @Column(name = "customer_id")
    private UUID customerId;

    @Column(name = "customer_name")
    private String customerName;

    @Column(name = "customer_email", length = 320)
    private String customerEmail;

    @Column(name = "customer_phone", length = 40)
    private String customerPhone;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "shipping_address")
    private ShippingAddress shippingAddress;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "line_items")
    @Builder.Default
    private List<LineItem> lineItems = new ArrayList<>();

    @Column(name = "total_price", nullable = false, length = 40)
    private String totalPrice;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "financial_status", length = 50)
    private String financialStatus;

    @Column(name = "fulfillment_status", length = 50)
    private String fulfillmentStatus;

    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private CrmStatus status = CrmStatus.NUEVO;

    @Column(name = "whatsapp_sent", nullable = false)
    @Builder.Default
    private boolean notificationSent = false;

    @Column(name = "whatsapp_sent_at")
    private LocalDateTime notificationSentAt;

    @Column(name = "notes", length = 4000)
    private String notes;

    @Column(name = "tags", length = 1000)
    private String tags;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /**
     * Operator-driven status change. Any status may follow any other.
     * A null note keeps the current one; a non-null note replaces it.
     */
    public void changeStatus(CrmStatus newStatus, String note, LocalDateTime now) {
        this.status = newStatus;
        if (note != null) {
            this.notes = note;
        }
        this.updatedAt = now;
    }

    public String getShippingPhone() {
        return shippingAddress != null ? shippingAddress.getPhone() : null;
    }
}
