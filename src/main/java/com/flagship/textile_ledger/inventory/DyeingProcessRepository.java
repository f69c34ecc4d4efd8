package com.flagship.textile_ledger.inventory;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DyeingProcessRepository extends JpaRepository<DyeingProcessEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DyeingProcessEntity d WHERE d.id = :id")
    Optional<DyeingProcessEntity> findByIdForUpdate(@Param("id") Long id);
}
