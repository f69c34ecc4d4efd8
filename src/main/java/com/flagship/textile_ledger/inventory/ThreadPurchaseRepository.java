package com.flagship.textile_ledger.inventory;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ThreadPurchaseRepository extends JpaRepository<ThreadPurchaseEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM ThreadPurchaseEntity t WHERE t.id = :id")
    Optional<ThreadPurchaseEntity> findByIdForUpdate(@Param("id") Long id);
}
