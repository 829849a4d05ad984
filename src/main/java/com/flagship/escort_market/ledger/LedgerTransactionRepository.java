package com.flagship.escort_market.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransactionEntity, UUID> {

    List<LedgerTransactionEntity> findByUserIdOrderByCreatedAtAsc(UUID userId);

    List<LedgerTransactionEntity> findByReferenceIdAndType(UUID referenceId, TransactionType type);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransactionEntity t WHERE t.userId = :userId")
    long sumByUserId(@Param("userId") UUID userId);
}
