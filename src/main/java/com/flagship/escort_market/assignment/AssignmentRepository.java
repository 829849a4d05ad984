package com.flagship.escort_market.assignment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AssignmentRepository extends JpaRepository<AssignmentEntity, UUID> {

    List<AssignmentEntity> findByOrderIdAndReleasedAtIsNullOrderByPositionAsc(UUID orderId);

    List<AssignmentEntity> findByOrderIdOrderByAssignedAtAscPositionAsc(UUID orderId);

    long countByOrderIdAndReleasedAtIsNull(UUID orderId);
}
