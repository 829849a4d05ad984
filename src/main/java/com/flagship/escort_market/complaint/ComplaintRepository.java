package com.flagship.escort_market.complaint;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ComplaintRepository extends JpaRepository<ComplaintEntity, UUID> {

    List<ComplaintEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<ComplaintEntity> findByOrderIdOrderByCreatedAtDesc(UUID orderId);
}
