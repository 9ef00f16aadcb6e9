package com.copas.services.ordercrm.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Deduplicated customer identity.
 *
 * Email is the deduplication key: optional, but unique when present.
 * Name and phone are refreshed in place on every order from the same email.
 */
@Entity
@Table(name = "customers",
        uniqueConstraints = @UniqueConstraint(name = "uq_customers_email", columnNames = "email"),
        indexes = @Index(name = "idx_customers_phone", columnList = "phone"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "phone", length = 40)
    private String phone;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /**
     * Last-write-wins refresh; blank values never erase stored data.
     *
     * @return true if anything changed
     */
    public boolean refreshContact(String latestName, String latestPhone) {
        boolean changed = false;
        if (latestName != null && !latestName.isBlank() && !latestName.equals(name)) {
            this.name = latestName;
            changed = true;
        }
        if (latestPhone != null && !latestPhone.isBlank() && !latestPhone.equals(phone)) {
            this.phone = latestPhone;
            changed = true;
        }
        return changed;
    }
}
