package com.copas.services.ordercrm.repository;

import com.copas.services.ordercrm.entity.DeliveryLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DeliveryLogRepository extends JpaRepository<DeliveryLogEntry, Long> {

    List<DeliveryLogEntry> findByOrderIdOrderBySentAtAscIdAsc(UUID orderId);
}
